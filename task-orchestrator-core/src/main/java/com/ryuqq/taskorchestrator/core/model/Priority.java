package com.ryuqq.taskorchestrator.core.model;

/**
 * Task 실행 우선순위.
 *
 * <p>값이 작을수록 먼저 실행됩니다. 같은 값을 가진 Task들은 하나의
 * 우선순위 그룹을 이루어 동시에 실행됩니다.</p>
 *
 * <p><strong>기본값:</strong> {@value #DEFAULT_VALUE}. 우선순위를 지정하지 않은 Task는
 * 이 값을 사용하므로, 더 작은 값(예: 0, 1)은 그보다 먼저, 더 큰 값(예: 997, 1001)은
 * 그보다 나중에 실행됩니다.</p>
 *
 * <p>음수도 허용합니다.</p>
 *
 * @param value 우선순위 값
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Priority(int value) implements Comparable<Priority> {

    /**
     * 우선순위를 생략했을 때 사용하는 값.
     */
    public static final int DEFAULT_VALUE = 500;

    private static final Priority DEFAULT = new Priority(DEFAULT_VALUE);

    /**
     * Priority 생성.
     *
     * @param value 우선순위 값
     * @return Priority 인스턴스
     */
    public static Priority of(int value) {
        return new Priority(value);
    }

    /**
     * 기본 우선순위.
     *
     * @return {@value #DEFAULT_VALUE} 값의 Priority
     */
    public static Priority defaultPriority() {
        return DEFAULT;
    }

    @Override
    public int compareTo(Priority other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
