package com.ryuqq.taskorchestrator.core.invocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 토큰 분석 결과.
 *
 * <p>{@link ArgumentParser}가 생성하며, 세 가지 분류를 담고 있습니다:</p>
 * <ul>
 *   <li><strong>positional:</strong> 입력 순서를 유지한 위치 인자</li>
 *   <li><strong>named:</strong> {@code key=value} / {@code --key=value} (중복 키는 마지막 값)</li>
 *   <li><strong>flags:</strong> 값 없는 {@code --key}</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 모든 컬렉션은 복사 후 수정 불가로 감싸집니다.</p>
 *
 * @param positional 위치 인자
 * @param named 이름 있는 인자
 * @param flags 플래그
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ParsedArguments(
    List<String> positional,
    Map<String, String> named,
    Set<String> flags
) {

    private static final ParsedArguments EMPTY = new ParsedArguments(List.of(), Map.of(), Set.of());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 컬렉션이 null인 경우
     */
    public ParsedArguments {
        if (positional == null) {
            throw new IllegalArgumentException("positional cannot be null");
        }
        if (named == null) {
            throw new IllegalArgumentException("named cannot be null");
        }
        if (flags == null) {
            throw new IllegalArgumentException("flags cannot be null");
        }
        positional = List.copyOf(positional);
        named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
        flags = Collections.unmodifiableSet(new LinkedHashSet<>(flags));
    }

    /**
     * 빈 분석 결과.
     *
     * @return 토큰이 없는 ParsedArguments
     */
    public static ParsedArguments empty() {
        return EMPTY;
    }
}
