package com.ryuqq.taskorchestrator.core.model;

/**
 * 서브프로세스로 실행할 Shell 명령.
 *
 * <p>명령줄 전체가 설정된 shell(예: {@code sh -c})에 그대로 전달됩니다.
 * 종료 코드 0이 성공입니다.</p>
 *
 * @param commandLine 명령줄 텍스트
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ShellCommand(String commandLine) implements TaskCommand {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException commandLine이 null이거나 빈 문자열인 경우
     */
    public ShellCommand {
        if (commandLine == null || commandLine.isBlank()) {
            throw new IllegalArgumentException("commandLine cannot be null or blank");
        }
    }

    /**
     * ShellCommand 생성.
     *
     * @param commandLine 명령줄 텍스트
     * @return ShellCommand 인스턴스
     */
    public static ShellCommand of(String commandLine) {
        return new ShellCommand(commandLine);
    }
}
