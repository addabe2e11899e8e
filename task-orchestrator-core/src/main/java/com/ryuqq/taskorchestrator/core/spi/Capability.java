package com.ryuqq.taskorchestrator.core.spi;

import com.ryuqq.taskorchestrator.core.model.TaskParameters;
import com.ryuqq.taskorchestrator.core.outcome.Outcome;

/**
 * 외부 협력자(이미지 빌드/푸시, 인프라 활성화 등)에 대한 불투명 바인딩.
 *
 * <p>오케스트레이터는 내부 구현을 알지 못하며, 구조화된 옵션을 넘기고
 * 성공/실패만 돌려받습니다. Task 모듈은 Capability 객체를 통해 이름으로 호출합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Capability pushImage = options -&gt; {
 *     registry.push(options.getString("image").orElseThrow());
 *     return Ok.empty();
 * };
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Capability {

    /**
     * 협력자 호출.
     *
     * @param options 구조화된 옵션 (null 아님)
     * @return Ok 또는 Fail
     * @throws Exception 호출 실패 시 (호출 측에서 Fail로 변환)
     */
    Outcome invoke(TaskParameters options) throws Exception;
}
