package com.ryuqq.taskorchestrator.application.orchestrator;

import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.Priority;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;

import java.util.List;

/**
 * 스케줄링 진행 상황 수신자.
 *
 * <p>모든 메서드는 기본 구현이 비어 있으므로 필요한 것만 재정의합니다.
 * {@link #onTaskStarted}와 {@link #onTaskFinished}는 작업 스레드에서 동시에 호출될 수 있으므로
 * 구현체는 thread-safe해야 합니다.</p>
 *
 * <p>수신자에서 발생한 예외는 로그로만 남고 실행 결과에 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SchedulerListener {

    /**
     * 아무 동작도 하지 않는 수신자.
     */
    SchedulerListener NOOP = new SchedulerListener() { };

    /**
     * 실행 대상이 결정되고 첫 그룹이 시작되기 전.
     *
     * @param context 호출 정보
     * @param runSet 선택된 Task
     */
    default void onRunStarted(InvocationContext context, List<TaskDescriptor> runSet) { }

    /**
     * 그룹의 Task들이 제출되기 직전.
     *
     * @param priority 그룹 우선순위
     * @param group 그룹 Task
     */
    default void onGroupStarted(Priority priority, List<TaskDescriptor> group) { }

    /**
     * Task 실행 시작 (작업 스레드).
     *
     * @param descriptor Task
     */
    default void onTaskStarted(TaskDescriptor descriptor) { }

    /**
     * Task 실행 종료 (작업 스레드).
     *
     * @param descriptor Task
     * @param result 실행 결과
     */
    default void onTaskFinished(TaskDescriptor descriptor, ExecutionResult result) { }

    /**
     * 그룹의 모든 Task가 종료됨 (barrier 해제).
     *
     * @param priority 그룹 우선순위
     * @param results 그룹 결과 (선언 순서)
     */
    default void onGroupSettled(Priority priority, List<ExecutionResult> results) { }

    /**
     * 앞선 그룹 실패로 Task가 시작되지 않음.
     *
     * @param descriptor Task
     */
    default void onTaskSkipped(TaskDescriptor descriptor) { }

    /**
     * 호출 종료.
     *
     * @param outcome 최종 결과
     */
    default void onRunSettled(RunOutcome outcome) { }
}
