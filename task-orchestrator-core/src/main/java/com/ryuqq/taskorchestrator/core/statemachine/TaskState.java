package com.ryuqq.taskorchestrator.core.statemachine;

/**
 * 개별 Task의 상태.
 *
 * <pre>
 * SCHEDULED ──► RUNNING ──► SUCCEEDED | FAILED
 *     │
 *     └─► SKIPPED (앞선 그룹이 실패하여 시작되지 않음)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskState {
    SCHEDULED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED, FAILED, SKIPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
