package com.ryuqq.taskorchestrator.core.exception;

import java.util.List;

/**
 * 명시적으로 선택한 Task 이름이 맵에 없음.
 *
 * <p>어떤 Task도 실행되기 전에 발생합니다. 선택 조건이 전혀 없어서 아무 Task도
 * 실행하지 않은 경우에도 {@link #nothingSelected(List)}로 같은 타입을 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TaskNotFoundException extends OrchestratorException {

    private final List<String> missingNames;
    private final List<String> availableNames;

    /**
     * 생성자.
     *
     * @param missingNames 맵에 없는 이름
     * @param availableNames 맵에 있는 이름
     */
    public TaskNotFoundException(List<String> missingNames, List<String> availableNames) {
        this("Unknown task(s) " + missingNames + "; available: " + availableNames, missingNames, availableNames);
    }

    private TaskNotFoundException(String message, List<String> missingNames, List<String> availableNames) {
        super(message);
        this.missingNames = List.copyOf(missingNames);
        this.availableNames = List.copyOf(availableNames);
    }

    /**
     * 아무 Task도 선택되지 않음.
     *
     * @param availableNames 맵에 있는 이름
     * @return TaskNotFoundException 인스턴스 (missingNames는 비어 있음)
     */
    public static TaskNotFoundException nothingSelected(List<String> availableNames) {
        return new TaskNotFoundException("No task selected; available: " + availableNames, List.of(), availableNames);
    }

    /**
     * 맵에 없는 이름.
     *
     * @return 요청했으나 존재하지 않는 Task 이름
     */
    public List<String> getMissingNames() {
        return missingNames;
    }

    /**
     * 맵에 있는 이름.
     *
     * @return 선택 가능한 Task 이름
     */
    public List<String> getAvailableNames() {
        return availableNames;
    }
}
