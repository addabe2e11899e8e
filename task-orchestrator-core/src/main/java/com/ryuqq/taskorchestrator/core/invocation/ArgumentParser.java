package com.ryuqq.taskorchestrator.core.invocation;

import com.ryuqq.taskorchestrator.core.exception.ArgumentParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 호출 토큰 분석기.
 *
 * <p>Task 모듈 이름 뒤에 오는 원시 토큰을 위치 인자, 이름 있는 인자, 플래그로 분류합니다.</p>
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ol>
 *   <li>{@code =}를 포함한 토큰 → 이름 있는 인자. 첫 {@code =} 앞이 키({@code --} 접두사 제거), 나머지가 값</li>
 *   <li>{@code --}로 시작하고 {@code =}가 없는 토큰 → 플래그</li>
 *   <li>그 외 → 위치 인자 (순서 유지)</li>
 * </ol>
 *
 * <p><strong>관대한 분석:</strong></p>
 * <ul>
 *   <li>중복 키는 나중 값이 덮어씀 (오류 없음)</li>
 *   <li>알 수 없는 플래그도 그대로 기록 (조회하지 않는 Task에게는 무시됨)</li>
 *   <li>키가 비는 토큰({@code =x}, {@code --=x}, {@code --})은 위치 인자로 취급</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ParsedArguments args = ArgumentParser.parse("env=prod", "--force", "input1");
 * // positional = [input1], named = {env=prod}, flags = [force]
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ArgumentParser {

    private static final String LONG_PREFIX = "--";
    private static final char ASSIGNMENT = '=';

    // Utility class - prevent instantiation
    private ArgumentParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 토큰 배열 분석.
     *
     * @param tokens 원시 토큰
     * @return 분석 결과
     * @throws ArgumentParseException tokens 또는 개별 토큰이 null인 경우
     */
    public static ParsedArguments parse(String... tokens) {
        if (tokens == null) {
            throw new ArgumentParseException("tokens cannot be null");
        }
        return parse(List.of(copyChecked(tokens)));
    }

    /**
     * 토큰 목록 분석.
     *
     * @param tokens 원시 토큰
     * @return 분석 결과
     * @throws ArgumentParseException tokens 또는 개별 토큰이 null인 경우
     */
    public static ParsedArguments parse(List<String> tokens) {
        if (tokens == null) {
            throw new ArgumentParseException("tokens cannot be null");
        }

        List<String> positional = new ArrayList<>();
        Map<String, String> named = new LinkedHashMap<>();
        Set<String> flags = new LinkedHashSet<>();

        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token == null) {
                throw new ArgumentParseException("token at index " + i + " cannot be null");
            }

            int assignment = token.indexOf(ASSIGNMENT);
            if (assignment >= 0) {
                String key = stripPrefix(token.substring(0, assignment));
                if (key.isEmpty()) {
                    positional.add(token);
                } else {
                    named.put(key, token.substring(assignment + 1));
                }
            } else if (token.startsWith(LONG_PREFIX) && token.length() > LONG_PREFIX.length()) {
                flags.add(token.substring(LONG_PREFIX.length()));
            } else {
                positional.add(token);
            }
        }

        return new ParsedArguments(positional, named, flags);
    }

    private static String stripPrefix(String key) {
        return key.startsWith(LONG_PREFIX) ? key.substring(LONG_PREFIX.length()) : key;
    }

    private static String[] copyChecked(String[] tokens) {
        for (int i = 0; i < tokens.length; i++) {
            if (tokens[i] == null) {
                throw new ArgumentParseException("token at index " + i + " cannot be null");
            }
        }
        return tokens.clone();
    }
}
