package com.ryuqq.taskorchestrator.application.context;

import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import com.ryuqq.taskorchestrator.application.orchestrator.TaskOrchestrator;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.TaskParameters;
import com.ryuqq.taskorchestrator.core.outcome.Fail;
import com.ryuqq.taskorchestrator.core.outcome.Outcome;
import com.ryuqq.taskorchestrator.core.spi.Capability;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Task 모듈에 주입되는 Capability 객체.
 *
 * <p>호출 정보 조회, 인자 배열 조립, 스케줄러 진입점, 외부 협력자 바인딩을 하나로 묶습니다.</p>
 *
 * <p><strong>제공 기능:</strong></p>
 * <ul>
 *   <li>{@link #positional()}, {@link #environment()}, {@link #workingDirectory()}: 호출 정보</li>
 *   <li>{@link #extract(String)}: 이름 있는 인자 값 (예외 없음)</li>
 *   <li>{@link #has(String)}: 플래그 <em>또는</em> 이름 있는 인자 존재 여부</li>
 *   <li>{@link #cmd(String...)}: null을 제거한 인자 배열</li>
 *   <li>{@link #start(Map)}: 스케줄러 실행</li>
 *   <li>{@link #invoke(String, Map)}: 외부 협력자 호출</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * public RunOutcome run(TaskContext ctx) {
 *     String env = ctx.extract("env").orElse("dev");
 *     List&lt;String&gt; args = ctx.cmd("deploy", ctx.has("force") ? "--force" : null, env);
 *
 *     Map&lt;String, Object&gt; tasks = new LinkedHashMap&lt;&gt;();
 *     tasks.put("build", TaskSpec.of("make build", 1));
 *     tasks.put("deploy", TaskSpec.of(String.join(" ", args), 2));
 *     return ctx.start(tasks);
 * }
 * </pre>
 *
 * <p><strong>불변성:</strong> 읽기 전용. 오케스트레이터는 실행 중 이 객체를 변경하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskContext {

    static final String CAPABILITY_ERROR = "CAPABILITY_ERROR";

    private final InvocationContext invocation;
    private final TaskOrchestrator orchestrator;
    private final Map<String, Capability> capabilities;

    TaskContext(InvocationContext invocation, TaskOrchestrator orchestrator, Map<String, Capability> capabilities) {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        this.invocation = invocation;
        this.orchestrator = orchestrator;
        this.capabilities = Collections.unmodifiableMap(new LinkedHashMap<>(capabilities));
    }

    /**
     * 호출 정보 전체.
     *
     * @return InvocationContext
     */
    public InvocationContext invocation() {
        return invocation;
    }

    /**
     * 모듈 이름 뒤의 위치 인자.
     *
     * @return 위치 인자 (수정 불가)
     */
    public List<String> positional() {
        return invocation.positional();
    }

    /**
     * 환경 변수 스냅샷.
     *
     * @return 환경 변수 (수정 불가)
     */
    public Map<String, String> environment() {
        return invocation.environment();
    }

    /**
     * 환경 변수 값 조회.
     *
     * @param key 변수 이름
     * @return 값 (없으면 empty)
     */
    public Optional<String> env(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(invocation.environment().get(key));
    }

    /**
     * 호출 시작 시점의 작업 디렉터리.
     *
     * @return 절대 경로
     */
    public Path workingDirectory() {
        return invocation.workingDirectory();
    }

    /**
     * 이름 있는 인자 값 조회.
     *
     * <p>{@code k=v}와 {@code --k=v} 모두 {@code "v"}를 반환합니다. 예외를 던지지 않습니다.</p>
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<String> extract(String key) {
        return invocation.extract(key);
    }

    /**
     * 이름 있는 인자 값 조회 (기본값 사용).
     *
     * @param key 키
     * @param defaultValue 값이 없을 때 반환할 값
     * @return 값 또는 defaultValue
     */
    public String extract(String key, String defaultValue) {
        return invocation.extract(key).orElse(defaultValue);
    }

    /**
     * 키 존재 여부.
     *
     * <p>{@code --k} 플래그와 {@code k=v} 이름 있는 인자 모두 true입니다.</p>
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean has(String key) {
        return invocation.has(key);
    }

    /**
     * 서브프로세스 인자 배열 조립.
     *
     * <p>null 항목은 제거하고 나머지는 호출 순서대로 유지합니다.
     * {@code cmd("ls", null, "-la")}는 {@code ["ls", "-la"]}입니다.</p>
     *
     * @param parts 인자 (null 항목 허용)
     * @return 인자 목록 (수정 불가)
     */
    public List<String> cmd(String... parts) {
        if (parts == null) {
            return List.of();
        }
        List<String> args = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part != null) {
                args.add(part);
            }
        }
        return Collections.unmodifiableList(args);
    }

    /**
     * 스케줄러 실행.
     *
     * @param taskMap Task 이름 → 정의
     * @return 집계된 실행 결과
     * @see TaskOrchestrator#start(Map, InvocationContext)
     */
    public RunOutcome start(Map<String, ?> taskMap) {
        return orchestrator.start(taskMap, invocation);
    }

    /**
     * 등록된 외부 협력자 조회.
     *
     * @param name 바인딩 이름
     * @return Capability (없으면 empty)
     */
    public Optional<Capability> capability(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(capabilities.get(name));
    }

    /**
     * 등록된 외부 협력자 이름.
     *
     * @return 바인딩 이름 (등록 순서)
     */
    public Set<String> capabilityNames() {
        return capabilities.keySet();
    }

    /**
     * 외부 협력자 호출.
     *
     * <p>협력자가 던진 예외는 {@value #CAPABILITY_ERROR} 코드의 Fail로 변환됩니다.</p>
     *
     * @param name 바인딩 이름
     * @param options 구조화된 옵션 (null이면 빈 옵션)
     * @return Ok 또는 Fail
     * @throws IllegalArgumentException 등록되지 않은 이름인 경우
     */
    public Outcome invoke(String name, Map<String, ?> options) {
        Capability capability = capability(name)
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown capability '" + name + "'; available: " + capabilities.keySet()));
        try {
            Outcome outcome = capability.invoke(TaskParameters.of(options));
            if (outcome == null) {
                return Fail.of(CAPABILITY_ERROR, "Capability '" + name + "' returned no outcome");
            }
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Fail.of(Fail.TASK_INTERRUPTED, "Capability '" + name + "' interrupted", e);
        } catch (Exception e) {
            return Fail.of(CAPABILITY_ERROR, "Capability '" + name + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "TaskContext{" + invocation + ", capabilities=" + capabilities.keySet() + "}";
    }
}
