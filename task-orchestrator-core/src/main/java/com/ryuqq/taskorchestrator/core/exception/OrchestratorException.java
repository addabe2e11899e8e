package com.ryuqq.taskorchestrator.core.exception;

/**
 * Task Orchestrator 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 unchecked이며, 호출 계층(CLI 등)이 종류에 따라
 * 종료 코드와 메시지를 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class OrchestratorException extends RuntimeException {

    protected OrchestratorException(String message) {
        super(message);
    }

    protected OrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
