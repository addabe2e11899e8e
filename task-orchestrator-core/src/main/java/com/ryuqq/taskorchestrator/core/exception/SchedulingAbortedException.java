package com.ryuqq.taskorchestrator.core.exception;

import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 우선순위 그룹 실패로 이후 그룹 실행이 중단됨.
 *
 * <p>실패한 그룹의 모든 Task가 종료된 뒤에 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SchedulingAbortedException extends OrchestratorException {

    private final List<ExecutionResult> failures;
    private final List<TaskName> skipped;

    /**
     * 생성자.
     *
     * @param failures 실패한 Task 결과 (1개 이상)
     * @param skipped 시작되지 않은 Task
     */
    public SchedulingAbortedException(List<ExecutionResult> failures, List<TaskName> skipped) {
        super(buildMessage(failures, skipped), firstCause(failures));
        this.failures = List.copyOf(failures);
        this.skipped = List.copyOf(skipped);
    }

    /**
     * 실패한 Task 결과.
     *
     * @return 실패 결과 목록
     */
    public List<ExecutionResult> getFailures() {
        return failures;
    }

    /**
     * 시작되지 않은 Task.
     *
     * @return 이후 그룹의 Task 이름
     */
    public List<TaskName> getSkipped() {
        return skipped;
    }

    private static String buildMessage(List<ExecutionResult> failures, List<TaskName> skipped) {
        String failed = failures.stream()
            .map(result -> result.taskName().getValue())
            .collect(Collectors.joining(", "));
        return "Run aborted: failed task(s) [" + failed + "], skipped " + skipped.size() + " task(s)";
    }

    private static Throwable firstCause(List<ExecutionResult> failures) {
        return failures.stream()
            .map(result -> result.failure().map(fail -> fail.cause()).orElse(null))
            .filter(cause -> cause != null)
            .findFirst()
            .orElse(null);
    }
}
