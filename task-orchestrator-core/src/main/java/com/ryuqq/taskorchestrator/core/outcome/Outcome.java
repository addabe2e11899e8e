package com.ryuqq.taskorchestrator.core.outcome;

/**
 * Task 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨</li>
 *   <li>{@link Fail}: 실패 (재시도 없음)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 알려져 있습니다.
 * Shell Task와 Callable Task 모두 이 형태로 환원되므로, 스케줄러는
 * 어떤 종류의 Task를 실행했는지 알 필요가 없습니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Fail fail) {
 *     log.error("{}: {}", fail.errorCode(), fail.message(), fail.cause());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
