package com.ryuqq.taskorchestrator.application.context;

import com.ryuqq.taskorchestrator.application.orchestrator.TaskOrchestrator;
import com.ryuqq.taskorchestrator.core.invocation.ArgumentParser;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.spi.Capability;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TaskContext} 조립기.
 *
 * <p>원시 토큰을 분석하고, 환경 변수와 작업 디렉터리를 캡처한 뒤
 * 스케줄러와 외부 협력자 바인딩을 연결합니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>environment: {@code System.getenv()} (build 시점에 한 번 복사)</li>
 *   <li>workingDirectory: {@code user.dir} 시스템 프로퍼티</li>
 *   <li>tokens: 없음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TaskContext context = TaskContextBuilder.create()
 *     .moduleName("deploy")
 *     .tokens(List.of("env=prod", "--force"))
 *     .orchestrator(new PriorityGroupScheduler())
 *     .capability("pushImage", registryClient::push)
 *     .build();
 * </pre>
 *
 * <p>thread-safe하지 않습니다. 호출마다 새 Builder를 사용하세요.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskContextBuilder {

    private String moduleName;
    private List<String> tokens = List.of();
    private Map<String, String> environment;
    private Path workingDirectory;
    private InvocationContext invocation;
    private TaskOrchestrator orchestrator;
    private final Map<String, Capability> capabilities = new LinkedHashMap<>();

    private TaskContextBuilder() {
    }

    /**
     * 새 Builder 생성.
     *
     * @return TaskContextBuilder 인스턴스
     */
    public static TaskContextBuilder create() {
        return new TaskContextBuilder();
    }

    /**
     * Task 모듈 이름.
     *
     * @param moduleName 모듈 이름 (null 허용)
     * @return this
     */
    public TaskContextBuilder moduleName(String moduleName) {
        this.moduleName = moduleName;
        return this;
    }

    /**
     * 모듈 이름 뒤의 원시 토큰.
     *
     * @param tokens 토큰
     * @return this
     * @throws IllegalArgumentException tokens가 null인 경우
     */
    public TaskContextBuilder tokens(List<String> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("tokens cannot be null");
        }
        this.tokens = tokens;
        return this;
    }

    /**
     * 모듈 이름 뒤의 원시 토큰 (가변 인자).
     *
     * @param tokens 토큰
     * @return this
     * @throws IllegalArgumentException tokens가 null인 경우
     */
    public TaskContextBuilder tokens(String... tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("tokens cannot be null");
        }
        return tokens(Arrays.asList(tokens));
    }

    /**
     * 환경 변수 원본 (생략 시 {@code System.getenv()}).
     *
     * @param environment 환경 변수
     * @return this
     */
    public TaskContextBuilder environment(Map<String, String> environment) {
        this.environment = environment;
        return this;
    }

    /**
     * 작업 디렉터리 (생략 시 {@code user.dir}).
     *
     * @param workingDirectory 작업 디렉터리
     * @return this
     */
    public TaskContextBuilder workingDirectory(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
        return this;
    }

    /**
     * 이미 만들어진 호출 정보 사용.
     *
     * <p>지정하면 moduleName, tokens, environment, workingDirectory는 무시됩니다.</p>
     *
     * @param invocation 호출 정보
     * @return this
     */
    public TaskContextBuilder invocation(InvocationContext invocation) {
        this.invocation = invocation;
        return this;
    }

    /**
     * {@code start}가 위임할 오케스트레이터 (필수).
     *
     * @param orchestrator 오케스트레이터
     * @return this
     */
    public TaskContextBuilder orchestrator(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
        return this;
    }

    /**
     * 외부 협력자 바인딩 등록.
     *
     * <p>같은 이름으로 다시 등록하면 나중 바인딩이 사용됩니다.</p>
     *
     * @param name 바인딩 이름
     * @param capability 바인딩
     * @return this
     * @throws IllegalArgumentException name이 비었거나 capability가 null인 경우
     */
    public TaskContextBuilder capability(String name, Capability capability) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("capability name cannot be null or blank");
        }
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null (name: " + name + ")");
        }
        capabilities.put(name, capability);
        return this;
    }

    /**
     * 바인딩 일괄 등록.
     *
     * @param capabilities 이름 → 바인딩
     * @return this
     * @throws IllegalArgumentException capabilities가 null이거나 잘못된 항목이 있는 경우
     */
    public TaskContextBuilder capabilities(Map<String, Capability> capabilities) {
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        capabilities.forEach(this::capability);
        return this;
    }

    /**
     * TaskContext 생성.
     *
     * @return TaskContext 인스턴스
     * @throws IllegalArgumentException orchestrator가 지정되지 않은 경우
     * @throws com.ryuqq.taskorchestrator.core.exception.ArgumentParseException 토큰에 null이 포함된 경우
     */
    public TaskContext build() {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        return new TaskContext(resolveInvocation(), orchestrator, capabilities);
    }

    private InvocationContext resolveInvocation() {
        if (invocation != null) {
            return invocation;
        }
        Map<String, String> env = environment != null ? environment : System.getenv();
        Path dir = workingDirectory != null ? workingDirectory : Paths.get(System.getProperty("user.dir"));
        return InvocationContext.of(moduleName, ArgumentParser.parse(tokens), env, dir);
    }
}
