package com.ryuqq.taskorchestrator.adapter.runner;

/**
 * TaskSelector 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>runAllFlag: 전체 실행 플래그 이름 (기본 "all", 즉 {@code --all})</li>
 *   <li>selectionKey: 명시적 선택 키 (기본 "task", 즉 {@code task=build,lint})</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param runAllFlag 전체 실행 플래그 이름 ({@code --} 제외)
 * @param selectionKey 명시적 선택 키
 */
public record SelectorConfig(String runAllFlag, String selectionKey) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: runAllFlag="all", selectionKey="task"</p>
     */
    public SelectorConfig() {
        this("all", "task");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SelectorConfig {
        if (runAllFlag == null || runAllFlag.isBlank()) {
            throw new IllegalArgumentException("runAllFlag cannot be null or blank");
        }
        if (runAllFlag.startsWith("--")) {
            throw new IllegalArgumentException("runAllFlag must not include the -- prefix (current: " + runAllFlag + ")");
        }
        if (selectionKey == null || selectionKey.isBlank()) {
            throw new IllegalArgumentException("selectionKey cannot be null or blank");
        }
    }

    /**
     * runAllFlag만 변경한 새 인스턴스 생성.
     *
     * @param runAllFlag 새로운 전체 실행 플래그 이름
     * @return 새 SelectorConfig 인스턴스
     */
    public SelectorConfig withRunAllFlag(String runAllFlag) {
        return new SelectorConfig(runAllFlag, this.selectionKey);
    }

    /**
     * selectionKey만 변경한 새 인스턴스 생성.
     *
     * @param selectionKey 새로운 명시적 선택 키
     * @return 새 SelectorConfig 인스턴스
     */
    public SelectorConfig withSelectionKey(String selectionKey) {
        return new SelectorConfig(this.runAllFlag, selectionKey);
    }
}
