package com.ryuqq.taskorchestrator.adapter.runner;

import com.ryuqq.taskorchestrator.core.model.Priority;

/**
 * PriorityGroupScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultPriority: 우선순위를 생략한 Task의 값 (기본 500)</li>
 *   <li>maxParallelism: 한 그룹 안에서 동시에 실행할 최대 Task 수 (기본 0 = 제한 없음)</li>
 * </ul>
 *
 * <p><strong>주의:</strong> maxParallelism을 양수로 지정하면 같은 그룹의 일부 Task가
 * 앞선 형제 Task가 끝날 때까지 시작을 기다립니다. 그룹 간 barrier는 그대로 유지됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param defaultPriority 기본 우선순위
 * @param maxParallelism 그룹 내 최대 동시 실행 수 (0이면 제한 없음, 음수 불가)
 */
public record SchedulerConfig(int defaultPriority, int maxParallelism) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultPriority=500, maxParallelism=0 (제한 없음)</p>
     */
    public SchedulerConfig() {
        this(Priority.DEFAULT_VALUE, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SchedulerConfig {
        if (maxParallelism < 0) {
            throw new IllegalArgumentException(
                "maxParallelism must be zero or positive (current: " + maxParallelism + ")"
            );
        }
    }

    /**
     * 동시 실행 수 제한 여부.
     *
     * @return maxParallelism이 양수이면 true
     */
    public boolean isBounded() {
        return maxParallelism > 0;
    }

    /**
     * defaultPriority만 변경한 새 인스턴스 생성.
     *
     * @param defaultPriority 새로운 기본 우선순위
     * @return 새 SchedulerConfig 인스턴스
     */
    public SchedulerConfig withDefaultPriority(int defaultPriority) {
        return new SchedulerConfig(defaultPriority, this.maxParallelism);
    }

    /**
     * maxParallelism만 변경한 새 인스턴스 생성.
     *
     * @param maxParallelism 새로운 최대 동시 실행 수
     * @return 새 SchedulerConfig 인스턴스
     */
    public SchedulerConfig withMaxParallelism(int maxParallelism) {
        return new SchedulerConfig(this.defaultPriority, maxParallelism);
    }
}
