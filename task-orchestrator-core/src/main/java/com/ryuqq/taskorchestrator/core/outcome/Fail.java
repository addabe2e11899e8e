package com.ryuqq.taskorchestrator.core.outcome;

/**
 * 실패 결과.
 *
 * <p>0이 아닌 종료 코드, Callable이 던진 예외, 실행 시작 실패 등을 나타냅니다.</p>
 *
 * <p><strong>오류 코드 예시:</strong></p>
 * <ul>
 *   <li>{@value #TASK_ERROR}: Callable 예외</li>
 *   <li>{@code TASK_EXIT_1}: Shell 종료 코드 1</li>
 *   <li>{@value #TASK_LAUNCH}: 서브프로세스 시작 실패</li>
 *   <li>{@value #TASK_INTERRUPTED}: 대기 중 인터럽트</li>
 * </ul>
 *
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    Throwable cause
) implements Outcome {

    public static final String TASK_ERROR = "TASK_ERROR";
    public static final String TASK_LAUNCH = "TASK_LAUNCH";
    public static final String TASK_INTERRUPTED = "TASK_INTERRUPTED";
    public static final String TASK_EXIT_PREFIX = "TASK_EXIT_";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * Fail 생성 (cause 포함).
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인
     * @return Fail 인스턴스
     */
    public static Fail of(String errorCode, String message, Throwable cause) {
        return new Fail(errorCode, message, cause);
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }

    /**
     * 종료 코드에 해당하는 오류 코드.
     *
     * @param exitCode 종료 코드
     * @return 오류 코드 (예: TASK_EXIT_1)
     */
    public static String exitCode(int exitCode) {
        return TASK_EXIT_PREFIX + exitCode;
    }
}
