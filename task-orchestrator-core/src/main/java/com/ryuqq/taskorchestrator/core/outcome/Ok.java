package com.ryuqq.taskorchestrator.core.outcome;

/**
 * 성공 결과.
 *
 * <p>Callable Task의 반환값, Shell Task의 표준 출력, 또는 Capability의 결과값을 담습니다.
 * Shell Task의 표준 출력과 표준 에러는 {@link ExecutionResult}에도 보관됩니다.</p>
 *
 * @param value 결과값 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(Object value) implements Outcome {

    private static final Ok EMPTY = new Ok(null);

    /**
     * 값 없는 성공 결과.
     *
     * @return Ok 인스턴스
     */
    public static Ok empty() {
        return EMPTY;
    }

    /**
     * 값을 포함한 성공 결과 생성.
     *
     * @param value 결과값 (null 가능)
     * @return Ok 인스턴스
     */
    public static Ok of(Object value) {
        return value == null ? EMPTY : new Ok(value);
    }
}
