package com.ryuqq.taskorchestrator.application.orchestrator;

import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;

import java.util.Map;

/**
 * Task 실행 조정자.
 *
 * <p>오케스트레이션 맵을 받아 선택, 우선순위 그룹화, 그룹별 동시 실행을 수행하고
 * 집계된 결과를 반환합니다.</p>
 *
 * <p><strong>맵 값 허용 타입:</strong></p>
 * <ul>
 *   <li>{@link String}: Shell 명령</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.model.TaskAction}, {@link Runnable},
 *       {@link java.util.concurrent.Callable}: 직접 호출</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.model.TaskSpec} 또는
 *       {@code command/priority/options} 키를 가진 {@link Map}: 구조화된 정의</li>
 *   <li>null: No-op</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Map&lt;String, Object&gt; tasks = new LinkedHashMap&lt;&gt;();
 * tasks.put("lint", TaskSpec.of("npm run lint", 1));
 * tasks.put("test", TaskSpec.of("npm test", 1));
 * tasks.put("deploy", TaskSpec.of(deployAction, 2));
 *
 * RunOutcome outcome = orchestrator.start(tasks, invocation);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TaskOrchestrator {

    /**
     * 오케스트레이션 맵 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>맵의 각 값을 TaskDescriptor로 정규화</li>
     *   <li>호출 토큰으로 실행 대상 선택</li>
     *   <li>우선순위별로 그룹화하여 오름차순 정렬</li>
     *   <li>그룹 내 Task를 동시에 시작하고 모두 종료될 때까지 대기 (barrier)</li>
     *   <li>그룹에 실패가 있으면 이후 그룹을 시작하지 않음</li>
     * </ol>
     *
     * <p>블로킹 호출이며, 선택된 마지막 그룹(또는 실패한 그룹)이 종료된 뒤 반환합니다.
     * Task 실패는 예외가 아니라 {@link RunOutcome}으로 보고됩니다.</p>
     *
     * @param taskMap Task 이름 → 정의 (반복 순서가 그룹 내 결과 순서가 됨)
     * @param context 호출 정보
     * @return 집계된 실행 결과
     * @throws IllegalArgumentException taskMap 또는 context가 null이거나, 정의 형태가 잘못된 경우
     * @throws com.ryuqq.taskorchestrator.core.exception.TaskNotFoundException 명시적으로 선택한 Task가 없는 경우
     */
    RunOutcome start(Map<String, ?> taskMap, InvocationContext context);
}
