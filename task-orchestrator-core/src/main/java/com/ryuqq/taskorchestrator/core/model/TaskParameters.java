package com.ryuqq.taskorchestrator.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Callable Task 또는 Capability에 전달되는 구조화된 파라미터 묶음.
 *
 * <p>구조화된 Task 정의의 {@code options}가 이 형태로 변환되어
 * 호출 시점에 그대로 전달됩니다. Shell Task에서는 무시됩니다.</p>
 *
 * <p><strong>불변성:</strong> 입력 Map은 복사되며, 조회 결과는 수정할 수 없습니다.</p>
 * <p>null 값은 허용하지 않습니다 (키 존재 여부와 값 부재를 구분하기 위함).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskParameters {

    private static final TaskParameters EMPTY = new TaskParameters(Map.of());

    private final Map<String, Object> values;

    private TaskParameters(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("TaskParameters key cannot be null");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("TaskParameters value cannot be null (key: " + entry.getKey() + ")");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Map으로부터 TaskParameters 생성.
     *
     * @param values 파라미터 Map (null이면 빈 파라미터)
     * @return TaskParameters 인스턴스
     * @throws IllegalArgumentException 키 또는 값에 null이 포함된 경우
     */
    public static TaskParameters of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new TaskParameters(values);
    }

    /**
     * 빈 TaskParameters.
     *
     * @return 빈 인스턴스
     */
    public static TaskParameters empty() {
        return EMPTY;
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 문자열 값 조회.
     *
     * <p>값이 문자열이 아니면 {@code toString()} 결과를 반환합니다.</p>
     *
     * @param key 키
     * @return 문자열 값 (없으면 empty)
     */
    public Optional<String> getString(String key) {
        return get(key).map(Object::toString);
    }

    /**
     * 키 존재 여부.
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * 비어 있는지 확인.
     *
     * @return 비어 있으면 true
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 전체 값 조회 (수정 불가).
     *
     * @return 파라미터 Map
     */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskParameters that = (TaskParameters) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "TaskParameters" + values;
    }
}
