package com.ryuqq.taskorchestrator.core.model;

/**
 * 아무 작업도 하지 않는 명령.
 *
 * <p>정의에 명령이 없는 Task가 이 값으로 정규화되며, 항상 즉시 성공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum NoOpCommand implements TaskCommand {
    INSTANCE
}
