package com.ryuqq.taskorchestrator.core.model;

/**
 * Task가 실제로 수행할 작업 (tagged variant).
 *
 * <p>TaskCommand는 세 가지 형태 중 하나입니다:</p>
 * <ul>
 *   <li>{@link ShellCommand}: 서브프로세스로 실행할 명령줄</li>
 *   <li>{@link CallableCommand}: 직접 호출할 {@link TaskAction}</li>
 *   <li>{@link NoOpCommand}: 아무 작업도 하지 않음</li>
 * </ul>
 *
 * <p>Task 등록 시점에 한 번 결정되며, 실행 시점에는 타입 판별만 수행합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (command instanceof ShellCommand shell) {
 *     runProcess(shell.commandLine());
 * } else if (command instanceof CallableCommand callable) {
 *     callable.action().run(parameters);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface TaskCommand permits ShellCommand, CallableCommand, NoOpCommand {

    /**
     * Shell 명령인지 확인.
     *
     * @return Shell 명령 여부
     */
    default boolean isShell() {
        return this instanceof ShellCommand;
    }

    /**
     * Callable 명령인지 확인.
     *
     * @return Callable 명령 여부
     */
    default boolean isCallable() {
        return this instanceof CallableCommand;
    }

    /**
     * No-op 명령인지 확인.
     *
     * @return No-op 여부
     */
    default boolean isNoOp() {
        return this instanceof NoOpCommand;
    }
}
