package com.ryuqq.taskorchestrator.core.exception;

/**
 * 토큰 분석 실패.
 *
 * <p>분석 규칙 자체는 어떤 문자열도 거부하지 않으므로,
 * null 토큰처럼 호출 측의 프로그래밍 오류에서만 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ArgumentParseException extends OrchestratorException {

    public ArgumentParseException(String message) {
        super(message);
    }
}
