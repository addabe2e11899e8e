package com.ryuqq.taskorchestrator.testkit.contract;

import com.ryuqq.taskorchestrator.adapter.runner.PriorityGroupScheduler;
import com.ryuqq.taskorchestrator.adapter.runner.SchedulerConfig;
import com.ryuqq.taskorchestrator.adapter.runner.SelectorConfig;
import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import com.ryuqq.taskorchestrator.application.orchestrator.SchedulerListener;
import com.ryuqq.taskorchestrator.application.orchestrator.TaskOrchestrator;
import com.ryuqq.taskorchestrator.core.exception.SchedulingAbortedException;
import com.ryuqq.taskorchestrator.core.executor.CommandExecutor;
import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.statemachine.RunState;
import com.ryuqq.taskorchestrator.core.statemachine.TaskState;
import com.ryuqq.taskorchestrator.testkit.contract.RecordingSchedulerListener.EventType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test: a failing group aborts the run after its siblings settle.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Later groups never start after a failure</li>
 *   <li>Siblings of the failed task run to completion before the failure is reported</li>
 *   <li>The outcome names failed and skipped tasks</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FailFastContractTest extends AbstractSchedulerContractTest {

    @Override
    protected TaskOrchestrator createOrchestrator(CommandExecutor executor, SchedulerListener listener) {
        return new PriorityGroupScheduler(executor, new SchedulerConfig(), new SelectorConfig(), listener);
    }

    @Test
    void testFailure_AbortsLaterGroupsAfterSiblingsComplete() {
        // Given: a fails immediately, b succeeds slowly in the same group
        executor.failWithExitCode("a", 1);
        executor.succeedAfter("b", Duration.ofMillis(200));

        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("a", task(1));
        tasks.put("b", task(1));
        tasks.put("c", task(2));

        // When
        RunOutcome outcome = orchestrator.start(tasks, invocation("--all"));

        // Then
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getState()).isEqualTo(RunState.SETTLED_FAILURE);
        assertThat(outcome.getFailedTasks()).containsExactly(TaskName.of("a"));
        assertThat(outcome.getSkipped()).containsExactly(TaskName.of("c"));
        assertThat(outcome.getTaskState("b")).contains(TaskState.SUCCEEDED);
        assertThat(outcome.getTaskState("c")).contains(TaskState.SKIPPED);
        assertNeverStarted("c");

        int bFinished = listener.indexOf(EventType.TASK_FINISHED, "b");
        int runSettled = listener.indexOf(EventType.RUN_SETTLED, "");
        assertThat(bFinished).isGreaterThanOrEqualTo(0).isLessThan(runSettled);
    }

    @Test
    void testFailure_ReportsExitCode() {
        // Given
        executor.failWithExitCode("build", 7);
        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("build", task(1));

        // When
        RunOutcome outcome = orchestrator.start(tasks, invocation("build"));

        // Then
        assertThat(outcome.getResult("build")).hasValueSatisfying(result -> {
            assertThat(result.exitCode()).isEqualTo(7);
            assertThat(result.failure()).hasValueSatisfying(fail ->
                assertThat(fail.errorCode()).isEqualTo("TASK_EXIT_7"));
        });
    }

    @Test
    void testFailure_SkipsEveryLaterGroup() {
        // Given
        executor.respondWith("boom", descriptor -> {
            throw new IllegalStateException("boom");
        });
        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("boom", task(1));
        tasks.put("second", task(2));
        tasks.put("third", task(3));

        // When
        RunOutcome outcome = orchestrator.start(tasks, invocation("--all"));

        // Then
        assertThat(outcome.getSkipped()).containsExactly(TaskName.of("second"), TaskName.of("third"));
        assertThat(listener.subjects(EventType.TASK_SKIPPED)).containsExactly("second", "third");
        assertThat(listener.subjects(EventType.GROUP_STARTED)).containsExactly("1");
    }

    @Test
    void testOrThrow_ConvertsFailureToException() {
        // Given
        executor.failWithExitCode("a", 2);
        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("a", task(1));
        tasks.put("b", task(2));

        // When
        RunOutcome outcome = orchestrator.start(tasks, invocation("--all"));

        // Then
        assertThatThrownBy(outcome::orThrow)
            .isInstanceOf(SchedulingAbortedException.class)
            .hasMessageContaining("a");
    }
}
