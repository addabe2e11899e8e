package com.ryuqq.taskorchestrator.adapter.runner;

import java.util.List;
import java.util.Locale;

/**
 * ShellCommandExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>shellCommand: 명령줄 앞에 붙는 shell 호출 (Unix 기본 {@code sh -c}, Windows 기본 {@code cmd.exe /c})</li>
 *   <li>echoOutput: 출력 줄을 Task 이름과 함께 로그로 남길지 여부 (기본 false, 캡처는 항상 수행)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param shellCommand shell 프로그램과 인자 (1개 이상)
 * @param echoOutput 출력 로그 여부
 */
public record ShellConfig(List<String> shellCommand, boolean echoOutput) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: 현재 OS의 shell, echoOutput=false</p>
     */
    public ShellConfig() {
        this(defaultShell(), false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ShellConfig {
        if (shellCommand == null || shellCommand.isEmpty()) {
            throw new IllegalArgumentException("shellCommand cannot be null or empty");
        }
        shellCommand = List.copyOf(shellCommand);
    }

    /**
     * shellCommand만 변경한 새 인스턴스 생성.
     *
     * @param shellCommand 새로운 shell 호출
     * @return 새 ShellConfig 인스턴스
     */
    public ShellConfig withShellCommand(List<String> shellCommand) {
        return new ShellConfig(shellCommand, this.echoOutput);
    }

    /**
     * echoOutput만 변경한 새 인스턴스 생성.
     *
     * @param echoOutput 새로운 출력 로그 여부
     * @return 새 ShellConfig 인스턴스
     */
    public ShellConfig withEchoOutput(boolean echoOutput) {
        return new ShellConfig(this.shellCommand, echoOutput);
    }

    static List<String> defaultShell() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.startsWith("windows") ? List.of("cmd.exe", "/c") : List.of("sh", "-c");
    }
}
