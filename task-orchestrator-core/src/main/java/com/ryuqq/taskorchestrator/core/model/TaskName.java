package com.ryuqq.taskorchestrator.core.model;

/**
 * 오케스트레이션 맵 안에서 Task를 식별하는 이름.
 *
 * <p>하나의 {@code start(taskMap)} 호출 안에서 유일해야 하며,
 * 위치 인자(positional)와 비교하여 선택 여부를 결정할 때 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>앞뒤 공백 불가 (위치 인자와 정확히 일치해야 하므로)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskName implements Comparable<TaskName> {

    private final String value;

    private TaskName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskName cannot be null or blank");
        }
        if (!value.equals(value.strip())) {
            throw new IllegalArgumentException("TaskName cannot have leading or trailing whitespace: '" + value + "'");
        }
        this.value = value;
    }

    /**
     * TaskName 생성.
     *
     * @param value Task 이름
     * @return TaskName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TaskName of(String value) {
        return new TaskName(value);
    }

    /**
     * TaskName 값 조회.
     *
     * @return Task 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(TaskName other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskName taskName = (TaskName) o;
        return value.equals(taskName.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
