package com.ryuqq.taskorchestrator.core.model;

/**
 * 직접 호출할 함수형 Task.
 *
 * <p>호출 시 Task의 {@link TaskParameters}가 인자로 전달됩니다.</p>
 *
 * @param action 호출할 동작
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CallableCommand(TaskAction action) implements TaskCommand {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException action이 null인 경우
     */
    public CallableCommand {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
    }

    /**
     * CallableCommand 생성.
     *
     * @param action 호출할 동작
     * @return CallableCommand 인스턴스
     */
    public static CallableCommand of(TaskAction action) {
        return new CallableCommand(action);
    }
}
