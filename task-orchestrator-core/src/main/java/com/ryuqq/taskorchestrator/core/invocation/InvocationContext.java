package com.ryuqq.taskorchestrator.core.invocation;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 한 번의 명령 실행 동안 유지되는 호출 정보.
 *
 * <p>분석된 토큰, 환경 변수 스냅샷, 작업 디렉터리를 담고 있으며
 * 선택기(Selector), 스케줄러, 실행기에 명시적으로 전달됩니다.
 * 스케줄러와 실행기는 프로세스 전역 상태를 직접 읽지 않고 이 객체만 사용합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 읽기 전용. 환경 변수는 생성 시점에 복사됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * // CLI 진입점 (프로세스 상태를 한 번만 캡처)
 * InvocationContext context = InvocationContext.capture("deploy", List.of("env=prod", "--force"));
 *
 * // 테스트 (완전히 명시적)
 * InvocationContext context = InvocationContext.of(
 *     ArgumentParser.parse("build"), Map.of("HOME", "/home/ci"), Path.of("/work"));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InvocationContext {

    private final String moduleName;
    private final ParsedArguments arguments;
    private final Map<String, String> environment;
    private final Path workingDirectory;

    private InvocationContext(String moduleName, ParsedArguments arguments,
                              Map<String, String> environment, Path workingDirectory) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (workingDirectory == null) {
            throw new IllegalArgumentException("workingDirectory cannot be null");
        }
        this.moduleName = moduleName;
        this.arguments = arguments;
        this.environment = Collections.unmodifiableMap(new TreeMap<>(environment));
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    }

    /**
     * 명시적 값으로 생성 (모듈 이름 없음).
     *
     * @param arguments 분석된 토큰
     * @param environment 환경 변수 스냅샷
     * @param workingDirectory 작업 디렉터리
     * @return InvocationContext 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static InvocationContext of(ParsedArguments arguments, Map<String, String> environment, Path workingDirectory) {
        return new InvocationContext(null, arguments, environment, workingDirectory);
    }

    /**
     * 명시적 값으로 생성.
     *
     * @param moduleName Task 모듈 이름 (null 가능)
     * @param arguments 분석된 토큰
     * @param environment 환경 변수 스냅샷
     * @param workingDirectory 작업 디렉터리
     * @return InvocationContext 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static InvocationContext of(String moduleName, ParsedArguments arguments,
                                       Map<String, String> environment, Path workingDirectory) {
        return new InvocationContext(moduleName, arguments, environment, workingDirectory);
    }

    /**
     * 현재 프로세스의 환경 변수와 작업 디렉터리를 캡처하여 생성.
     *
     * <p>진입점에서 한 번만 호출해야 합니다.</p>
     *
     * @param moduleName Task 모듈 이름
     * @param tokens 모듈 이름 뒤의 원시 토큰
     * @return InvocationContext 인스턴스
     */
    public static InvocationContext capture(String moduleName, List<String> tokens) {
        return new InvocationContext(
            moduleName,
            ArgumentParser.parse(tokens),
            System.getenv(),
            Paths.get(System.getProperty("user.dir"))
        );
    }

    /**
     * Task 모듈 이름.
     *
     * @return 모듈 이름 (프로그래밍 방식으로 생성한 경우 empty)
     */
    public Optional<String> moduleName() {
        return Optional.ofNullable(moduleName);
    }

    /**
     * 분석된 토큰 전체.
     *
     * @return ParsedArguments
     */
    public ParsedArguments arguments() {
        return arguments;
    }

    /**
     * 위치 인자.
     *
     * @return 입력 순서의 위치 인자 (수정 불가)
     */
    public List<String> positional() {
        return arguments.positional();
    }

    /**
     * 이름 있는 인자.
     *
     * @return 키/값 (수정 불가)
     */
    public Map<String, String> named() {
        return arguments.named();
    }

    /**
     * 플래그.
     *
     * @return 플래그 키 (수정 불가)
     */
    public Set<String> flags() {
        return arguments.flags();
    }

    /**
     * 환경 변수 스냅샷.
     *
     * @return 환경 변수 (수정 불가)
     */
    public Map<String, String> environment() {
        return environment;
    }

    /**
     * 호출 시작 시점의 작업 디렉터리 (절대 경로).
     *
     * @return 작업 디렉터리
     */
    public Path workingDirectory() {
        return workingDirectory;
    }

    /**
     * 이름 있는 인자 값 조회.
     *
     * <p>예외를 던지지 않습니다. key가 null이면 empty를 반환합니다.</p>
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<String> extract(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(arguments.named().get(key));
    }

    /**
     * 키가 플래그 또는 이름 있는 인자로 존재하는지 확인.
     *
     * <p>{@code --force}와 {@code force=yes} 모두 {@code has("force")}를 만족합니다.</p>
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean has(String key) {
        if (key == null) {
            return false;
        }
        return arguments.flags().contains(key) || arguments.named().containsKey(key);
    }

    @Override
    public String toString() {
        return "InvocationContext{module=" + moduleName
            + ", positional=" + arguments.positional()
            + ", named=" + arguments.named().keySet()
            + ", flags=" + arguments.flags()
            + ", workingDirectory=" + workingDirectory + "}";
    }
}
