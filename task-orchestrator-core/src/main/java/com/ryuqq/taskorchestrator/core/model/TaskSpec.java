package com.ryuqq.taskorchestrator.core.model;

import java.util.Map;

/**
 * 구조화된 Task 정의 (정규화 전 입력).
 *
 * <p>오케스트레이션 맵의 값으로 사용되며, 명령과 함께 우선순위와
 * Callable 옵션을 명시적으로 지정할 때 사용합니다.</p>
 *
 * <p><strong>command 허용 타입:</strong></p>
 * <ul>
 *   <li>{@link String}: Shell 명령줄</li>
 *   <li>{@link TaskAction}: Callable 동작</li>
 *   <li>{@link Runnable}, {@link java.util.concurrent.Callable}: TaskAction으로 변환</li>
 *   <li>null: No-op</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Map&lt;String, Object&gt; tasks = new LinkedHashMap&lt;&gt;();
 * tasks.put("lint", "npm run lint");
 * tasks.put("build", TaskSpec.of("docker build .").withPriority(1));
 * tasks.put("push", TaskSpec.of(pushAction).withPriority(2).withOptions(Map.of("tag", "latest")));
 * </pre>
 *
 * @param command 명령 (null이면 No-op)
 * @param priority 우선순위 (null이면 기본값)
 * @param options Callable 옵션 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskSpec(
    Object command,
    Integer priority,
    Map<String, ?> options
) {

    /**
     * 명령만 지정하여 생성.
     *
     * @param command 명령
     * @return TaskSpec 인스턴스
     */
    public static TaskSpec of(Object command) {
        return new TaskSpec(command, null, null);
    }

    /**
     * 명령과 우선순위를 지정하여 생성.
     *
     * @param command 명령
     * @param priority 우선순위
     * @return TaskSpec 인스턴스
     */
    public static TaskSpec of(Object command, int priority) {
        return new TaskSpec(command, priority, null);
    }

    /**
     * priority만 변경한 새 인스턴스 생성.
     *
     * @param priority 새로운 우선순위
     * @return 새 TaskSpec 인스턴스
     */
    public TaskSpec withPriority(int priority) {
        return new TaskSpec(command, priority, options);
    }

    /**
     * options만 변경한 새 인스턴스 생성.
     *
     * @param options 새로운 옵션
     * @return 새 TaskSpec 인스턴스
     */
    public TaskSpec withOptions(Map<String, ?> options) {
        return new TaskSpec(command, priority, options);
    }
}
