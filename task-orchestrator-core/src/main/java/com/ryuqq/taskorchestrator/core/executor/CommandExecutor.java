package com.ryuqq.taskorchestrator.core.executor;

import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;

/**
 * 단일 Task 실행자.
 *
 * <p>Task 하나를 끝까지 실행하고 결과를 {@link ExecutionResult}로 환원합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>Shell Task: 서브프로세스 실행, 종료 코드 0이면 성공</li>
 *   <li>Callable Task: 직접 호출, 정상 반환이면 성공 (비동기 결과는 완료까지 대기)</li>
 *   <li>No-op Task: 즉시 성공</li>
 * </ul>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>블로킹 호출이며, Task가 종료된 뒤 반환합니다.</li>
 *   <li>Task 실패로 예외를 던지지 않습니다. 모든 실패는 Fail Outcome으로 기록됩니다.</li>
 *   <li>구현체는 thread-safe해야 합니다 (같은 그룹의 Task가 동시에 호출).</li>
 *   <li>프로세스 전역 상태 대신 {@link InvocationContext}의 환경 변수와 작업 디렉터리를 사용합니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CommandExecutor {

    /**
     * Task 실행.
     *
     * @param descriptor 실행할 Task
     * @param context 호출 정보
     * @return 실행 결과 (non-null)
     * @throws IllegalArgumentException descriptor 또는 context가 null인 경우
     */
    ExecutionResult execute(TaskDescriptor descriptor, InvocationContext context);
}
