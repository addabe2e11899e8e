package com.ryuqq.taskorchestrator.core.statemachine;

/**
 * 한 번의 오케스트레이션 호출의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *    │
 *    ▼
 * SELECTING ──► SETTLED_FAILURE (선택된 Task 없음 / Task 없음)
 *    │
 *    ▼
 * GROUPING ──► SETTLED_SUCCESS (빈 실행 집합)
 *    │
 *    ▼
 * RUNNING (그룹 단위로 우선순위 오름차순 진행)
 *    │
 *    ├─► SETTLED_SUCCESS
 *    │
 *    └─► SETTLED_FAILURE
 *
 * 재시도 상태, 일시정지 상태 없음.
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunState {

    /**
     * 시작 전.
     */
    IDLE,

    /**
     * 실행할 Task 선택 중.
     */
    SELECTING,

    /**
     * 우선순위 그룹 분할 중.
     */
    GROUPING,

    /**
     * 그룹 실행 중.
     */
    RUNNING,

    /**
     * 모든 그룹 성공.
     */
    SETTLED_SUCCESS,

    /**
     * 실패로 종료.
     */
    SETTLED_FAILURE;

    /**
     * 종료 상태인지 확인.
     *
     * @return SETTLED_SUCCESS 또는 SETTLED_FAILURE인 경우 true
     */
    public boolean isTerminal() {
        return this == SETTLED_SUCCESS || this == SETTLED_FAILURE;
    }
}
