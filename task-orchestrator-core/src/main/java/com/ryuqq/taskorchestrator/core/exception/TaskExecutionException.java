package com.ryuqq.taskorchestrator.core.exception;

import com.ryuqq.taskorchestrator.core.model.TaskName;

/**
 * 단일 Task 실행 실패.
 *
 * <p>실패한 {@link com.ryuqq.taskorchestrator.core.outcome.ExecutionResult}의
 * 원인(cause)으로 기록됩니다. 스케줄러 밖으로 던져지지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TaskExecutionException extends OrchestratorException {

    private final TaskName taskName;
    private final Integer exitCode;

    /**
     * 0이 아닌 종료 코드로 인한 실패.
     *
     * @param taskName Task 이름
     * @param exitCode 종료 코드
     */
    public TaskExecutionException(TaskName taskName, int exitCode) {
        super("Task '" + taskName + "' exited with code " + exitCode);
        this.taskName = taskName;
        this.exitCode = exitCode;
    }

    /**
     * 예외로 인한 실패.
     *
     * @param taskName Task 이름
     * @param cause 원인
     */
    public TaskExecutionException(TaskName taskName, Throwable cause) {
        super("Task '" + taskName + "' failed: " + cause.getMessage(), cause);
        this.taskName = taskName;
        this.exitCode = null;
    }

    /**
     * Task 이름.
     *
     * @return 실패한 Task 이름
     */
    public TaskName getTaskName() {
        return taskName;
    }

    /**
     * 종료 코드.
     *
     * @return 종료 코드 (예외로 실패한 경우 null)
     */
    public Integer getExitCode() {
        return exitCode;
    }
}
