package com.ryuqq.taskorchestrator.core.model;

/**
 * Callable Task의 동작.
 *
 * <p>정상 반환이 성공이며, 던진 예외는 실패로 기록됩니다.
 * 반환값이 {@link java.util.concurrent.CompletionStage} 또는
 * {@link java.util.concurrent.Future}이면 그 완료까지 기다립니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TaskAction build = params -&gt; {
 *     String target = params.getString("target").orElse("all");
 *     return compiler.compile(target);
 * };
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskAction {

    /**
     * 동작 실행.
     *
     * @param parameters Task 파라미터 (비어 있을 수 있음, null 아님)
     * @return 결과값 (null 가능)
     * @throws Exception 실행 실패 시
     */
    Object run(TaskParameters parameters) throws Exception;
}
