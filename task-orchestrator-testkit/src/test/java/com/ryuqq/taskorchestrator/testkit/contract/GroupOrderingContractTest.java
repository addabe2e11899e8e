package com.ryuqq.taskorchestrator.testkit.contract;

import com.ryuqq.taskorchestrator.adapter.runner.PriorityGroupScheduler;
import com.ryuqq.taskorchestrator.adapter.runner.SchedulerConfig;
import com.ryuqq.taskorchestrator.adapter.runner.SelectorConfig;
import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import com.ryuqq.taskorchestrator.application.orchestrator.SchedulerListener;
import com.ryuqq.taskorchestrator.application.orchestrator.TaskOrchestrator;
import com.ryuqq.taskorchestrator.core.executor.CommandExecutor;
import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.outcome.Fail;
import com.ryuqq.taskorchestrator.core.outcome.Ok;
import com.ryuqq.taskorchestrator.testkit.contract.RecordingSchedulerListener.EventType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: priority groups run in ascending order with a barrier between them.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Tasks with the same priority start together (rendezvous inside the group)</li>
 *   <li>No task of a later group starts before every task of the earlier group finished</li>
 *   <li>Results are ordered by group, then by declaration order</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GroupOrderingContractTest extends AbstractSchedulerContractTest {

    @Override
    protected TaskOrchestrator createOrchestrator(CommandExecutor executor, SchedulerListener listener) {
        return new PriorityGroupScheduler(executor, new SchedulerConfig(), new SelectorConfig(), listener);
    }

    @Test
    void testSamePriorityTasks_StartTogether() {
        // Given: a and b must both be running before either may finish
        CountDownLatch bothStarted = new CountDownLatch(2);
        ScriptedCommandExecutor.Behavior rendezvous = descriptor -> {
            bothStarted.countDown();
            if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                return Fail.of(Fail.TASK_ERROR, "sibling never started");
            }
            return Ok.empty();
        };
        executor.respondWith("a", rendezvous).respondWith("b", rendezvous);

        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("a", task(1));
        tasks.put("b", task(1));
        tasks.put("c", task(2));

        // When
        RunOutcome outcome = orchestrator.start(tasks, invocation("--all"));

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(listener.getMaxConcurrentTasks()).isGreaterThanOrEqualTo(2);
        assertFinishedBeforeStarted("a", "c");
        assertFinishedBeforeStarted("b", "c");
    }

    @Test
    void testLaterGroup_WaitsForSlowTaskOfEarlierGroup() {
        // Given: the slow task shares group 1 with a fast one
        executor.succeedAfter("slow", Duration.ofMillis(200));

        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("fast", task(1));
        tasks.put("slow", task(1));
        tasks.put("next", task(2));

        // When
        RunOutcome outcome = orchestrator.start(tasks, invocation("--all"));

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertFinishedBeforeStarted("slow", "next");
        assertFinishedBeforeStarted("fast", "next");
    }

    @Test
    void testResults_OrderedByGroupThenDeclaration() {
        // Given: declaration order differs from priority order
        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("deploy", task(30));
        tasks.put("lint", task(10));
        tasks.put("build", task(20));
        tasks.put("test", task(10));

        // When
        RunOutcome outcome = orchestrator.start(tasks, invocation("--all"));

        // Then
        assertThat(outcome.getResults())
            .extracting(result -> result.taskName().getValue())
            .containsExactly("lint", "test", "build", "deploy");
        assertThat(listener.subjects(EventType.GROUP_STARTED)).containsExactly("10", "20", "30");
    }

    @Test
    void testSingleGroup_AllTasksRun() {
        // Given
        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("x", task(5));
        tasks.put("y", task(5));

        // When
        RunOutcome outcome = orchestrator.start(tasks, invocation("--all"));

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(executor.getExecutedTasks()).containsExactlyInAnyOrder(TaskName.of("x"), TaskName.of("y"));
        assertThat(listener.subjects(EventType.GROUP_SETTLED)).containsExactly("5");
    }
}
