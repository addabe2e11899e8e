package com.ryuqq.taskorchestrator.adapter.runner;

import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import com.ryuqq.taskorchestrator.application.orchestrator.SchedulerListener;
import com.ryuqq.taskorchestrator.core.executor.CommandExecutor;
import com.ryuqq.taskorchestrator.core.invocation.ArgumentParser;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.model.TaskSpec;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;
import com.ryuqq.taskorchestrator.core.outcome.Fail;
import com.ryuqq.taskorchestrator.core.outcome.Ok;
import com.ryuqq.taskorchestrator.core.statemachine.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PriorityGroupScheduler 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>위치 인자 선택 + 우선순위 순서</li>
 *   <li>실패 시 이후 그룹 skip, 같은 그룹 Task는 끝까지 실행</li>
 *   <li>선택 없음 → 실행 없이 실패 결과</li>
 *   <li>실행기/리스너 예외 격리, 동시 실행 수 제한, 인터럽트 처리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PriorityGroupSchedulerTest {

    @Mock
    private CommandExecutor executor;

    private PriorityGroupScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new PriorityGroupScheduler(executor);
    }

    private static InvocationContext invocation(String... tokens) {
        return InvocationContext.of(ArgumentParser.parse(tokens), Map.of(), Paths.get("."));
    }

    private static ExecutionResult ok(TaskDescriptor descriptor) {
        return ExecutionResult.of(descriptor.name(), Ok.empty(), Duration.ZERO);
    }

    private static Answer<ExecutionResult> succeed() {
        return invocation -> ok(invocation.getArgument(0, TaskDescriptor.class));
    }

    // ============================================================
    // 1. 선택 + 순서
    // ============================================================

    @Test
    void start_위치_인자로_선택한_Task만_우선순위_순서로_실행() {
        // given
        List<String> order = new CopyOnWriteArrayList<>();
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            TaskDescriptor descriptor = invocation.getArgument(0);
            order.add(descriptor.name().getValue());
            return ok(descriptor);
        });

        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("a", TaskSpec.of("cmdA", 1));
        tasks.put("b", TaskSpec.of("cmdB", 1));
        tasks.put("c", TaskSpec.of("cmdC", 2));

        // when
        RunOutcome outcome = scheduler.start(tasks, invocation("a", "c"));

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getState()).isEqualTo(RunState.SETTLED_SUCCESS);
        assertThat(order).containsExactly("a", "c");
        assertThat(outcome.getResult("b")).isEmpty();
        verify(executor, times(2)).execute(any(), any());
    }

    @Test
    void start_문자열_정의는_설정된_기본_우선순위_사용() {
        // given
        scheduler = new PriorityGroupScheduler(executor, new SchedulerConfig().withDefaultPriority(7),
            new SelectorConfig(), SchedulerListener.NOOP);
        when(executor.execute(any(), any())).thenAnswer(succeed());
        ArgumentCaptor<TaskDescriptor> captor = ArgumentCaptor.forClass(TaskDescriptor.class);

        // when
        scheduler.start(Map.of("build", "make"), invocation("build"));

        // then
        verify(executor).execute(captor.capture(), any());
        assertThat(captor.getValue().priority().value()).isEqualTo(7);
    }

    @Test
    void start_Task는_이름_있는_작업_스레드에서_실행() {
        // given
        List<String> threadNames = new CopyOnWriteArrayList<>();
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            threadNames.add(Thread.currentThread().getName());
            return ok(invocation.getArgument(0));
        });

        // when
        scheduler.start(Map.of("a", "x"), invocation("--all"));

        // then
        assertThat(threadNames).hasSize(1);
        assertThat(threadNames.get(0)).startsWith("task-orchestrator-");
    }

    @Test
    void start_빈_맵_전체_실행은_성공() {
        // when
        RunOutcome outcome = scheduler.start(Map.of(), invocation("--all"));

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getResults()).isEmpty();
        verify(executor, never()).execute(any(), any());
    }

    // ============================================================
    // 2. 실패 처리
    // ============================================================

    @Test
    void start_실패한_그룹_이후는_skip_같은_그룹은_완료() {
        // given
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            TaskDescriptor descriptor = invocation.getArgument(0);
            if (descriptor.name().getValue().equals("a")) {
                return ExecutionResult.of(descriptor.name(), Fail.of(Fail.exitCode(1), "exit 1"), Duration.ZERO);
            }
            Thread.sleep(150);
            return ok(descriptor);
        });

        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("a", TaskSpec.of("false", 1));
        tasks.put("b", TaskSpec.of("sleep", 1));
        tasks.put("c", TaskSpec.of("never", 2));

        // when
        RunOutcome outcome = scheduler.start(tasks, invocation("--all"));

        // then
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getFailedTasks()).containsExactly(TaskName.of("a"));
        assertThat(outcome.getResult("b")).hasValueSatisfying(result -> assertThat(result.isSuccess()).isTrue());
        assertThat(outcome.getSkipped()).containsExactly(TaskName.of("c"));
        verify(executor, times(2)).execute(any(), any());
    }

    @Test
    void start_실행기_예외는_TASK_ERROR_실패로_기록() {
        // given
        when(executor.execute(any(), any())).thenThrow(new IllegalStateException("executor broke"));

        // when
        RunOutcome outcome = scheduler.start(Map.of("a", "x"), invocation("a"));

        // then
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getResult("a")).hasValueSatisfying(result -> {
            assertThat(result.failure()).hasValueSatisfying(fail -> {
                assertThat(fail.errorCode()).isEqualTo(Fail.TASK_ERROR);
                assertThat(fail.cause()).isInstanceOf(IllegalStateException.class);
            });
        });
    }

    @Test
    void start_실행기가_null_반환시_실패로_기록() {
        // given
        when(executor.execute(any(), any())).thenReturn(null);

        // when
        RunOutcome outcome = scheduler.start(Map.of("a", "x"), invocation("a"));

        // then
        assertThat(outcome.getFailedTasks()).containsExactly(TaskName.of("a"));
    }

    // ============================================================
    // 3. 선택 없음
    // ============================================================

    @Test
    void start_선택이_없으면_실행없이_실패_결과() {
        // given
        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("a", "cmdA");
        tasks.put("b", "cmdB");

        // when
        RunOutcome outcome = scheduler.start(tasks, invocation());

        // then
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.isNothingSelected()).isTrue();
        assertThat(outcome.getAvailableTasks()).containsExactly(TaskName.of("a"), TaskName.of("b"));
        verify(executor, never()).execute(any(), any());
    }

    @Test
    void start_잘못된_정의는_실행없이_예외() {
        // given
        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("good", "echo ok");
        tasks.put("bad", 42);

        // when/then
        assertThatThrownBy(() -> scheduler.start(tasks, invocation("--all")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bad");
        verify(executor, never()).execute(any(), any());
    }

    // ============================================================
    // 4. 리스너, 동시성 제한, 인터럽트
    // ============================================================

    @Test
    void start_리스너_예외는_결과에_영향_없음() {
        // given
        SchedulerListener listener = mock(SchedulerListener.class);
        doThrow(new RuntimeException("listener broke")).when(listener).onTaskStarted(any());
        scheduler = new PriorityGroupScheduler(executor, new SchedulerConfig(), new SelectorConfig(), listener);
        when(executor.execute(any(), any())).thenAnswer(succeed());

        // when
        RunOutcome outcome = scheduler.start(Map.of("a", "x"), invocation("a"));

        // then
        assertThat(outcome.isSuccess()).isTrue();
        verify(listener).onRunSettled(outcome);
    }

    @Test
    void start_maxParallelism_1이면_그룹_내_순차_실행() {
        // given
        scheduler = new PriorityGroupScheduler(executor, new SchedulerConfig().withMaxParallelism(1),
            new SelectorConfig(), SchedulerListener.NOOP);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            Thread.sleep(30);
            running.decrementAndGet();
            return ok(invocation.getArgument(0));
        });

        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("a", TaskSpec.of("x", 1));
        tasks.put("b", TaskSpec.of("y", 1));
        tasks.put("c", TaskSpec.of("z", 1));

        // when
        RunOutcome outcome = scheduler.start(tasks, invocation("--all"));

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(peak.get()).isEqualTo(1);
    }

    @Test
    void start_호출_스레드가_인터럽트되어도_그룹_완료까지_대기하고_플래그_복원() {
        // given
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(100);
            return ok(invocation.getArgument(0));
        });
        Thread.currentThread().interrupt();

        // when
        RunOutcome outcome;
        try {
            outcome = scheduler.start(Map.of("slow", "x"), invocation("slow"));
        } finally {
            // then (interrupt flag restored; Thread.interrupted() also clears it for later tests)
            assertThat(Thread.interrupted()).isTrue();
        }
        assertThat(outcome.isSuccess()).isTrue();
    }

    // ============================================================
    // 5. 입력 검증
    // ============================================================

    @Test
    void constructor_의존성이_null이면_예외() {
        assertThatThrownBy(() -> new PriorityGroupScheduler(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("executor cannot be null");
        assertThatThrownBy(() -> new PriorityGroupScheduler(executor, null, new SelectorConfig(), SchedulerListener.NOOP))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
        assertThatThrownBy(() -> new PriorityGroupScheduler(executor, new SchedulerConfig(), null, SchedulerListener.NOOP))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("selectorConfig cannot be null");
        assertThatThrownBy(() -> new PriorityGroupScheduler(executor, new SchedulerConfig(), new SelectorConfig(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("listener cannot be null");
    }

    @Test
    void start_null_입력이면_예외() {
        assertThatThrownBy(() -> scheduler.start(null, invocation()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.start(Map.of(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void group_우선순위_오름차순_그룹화() {
        // given
        List<TaskDescriptor> runSet = List.of(
            TaskDescriptor.shell("c", "x", 3),
            TaskDescriptor.shell("a", "x", 1),
            TaskDescriptor.shell("b", "x", 3));

        // when/then
        assertThat(PriorityGroupScheduler.group(runSet).keySet())
            .extracting(priority -> priority.value())
            .containsExactly(1, 3);
        assertThat(PriorityGroupScheduler.group(runSet).lastEntry().getValue())
            .extracting(descriptor -> descriptor.name().getValue())
            .containsExactly("c", "b");
    }
}
