package com.ryuqq.taskorchestrator.application.orchestrator;

import com.ryuqq.taskorchestrator.core.exception.SchedulingAbortedException;
import com.ryuqq.taskorchestrator.core.exception.TaskNotFoundException;
import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;
import com.ryuqq.taskorchestrator.core.statemachine.RunState;
import com.ryuqq.taskorchestrator.core.statemachine.TaskState;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 한 번의 오케스트레이션 호출 결과.
 *
 * <p>세 가지 가능한 형태:</p>
 * <ul>
 *   <li><strong>성공:</strong> 선택된 모든 그룹이 성공 (state = SETTLED_SUCCESS)</li>
 *   <li><strong>실패:</strong> 어떤 그룹에서 Task가 실패, 이후 그룹은 skipped (state = SETTLED_FAILURE)</li>
 *   <li><strong>선택 없음:</strong> 아무 Task도 선택되지 않아 실행하지 않음, availableTasks 제공 (state = SETTLED_FAILURE)</li>
 * </ul>
 *
 * <p><strong>결과 순서:</strong> 우선순위 그룹 오름차순, 그룹 내에서는 맵 선언 순서</p>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunOutcome outcome = context.start(tasks);
 * if (!outcome.isSuccess()) {
 *     outcome.getFailedTasks().forEach(name -&gt; console.error("failed: " + name));
 * }
 *
 * // 또는 예외로 변환
 * context.start(tasks).orThrow();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunOutcome {

    private final RunState state;
    private final List<ExecutionResult> results;
    private final List<TaskName> skipped;
    private final List<TaskName> availableTasks;
    private final boolean nothingSelected;

    private RunOutcome(RunState state, List<ExecutionResult> results, List<TaskName> skipped,
                       List<TaskName> availableTasks, boolean nothingSelected) {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("state must be terminal (current: " + state + ")");
        }
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        if (skipped == null) {
            throw new IllegalArgumentException("skipped cannot be null");
        }
        this.state = state;
        this.results = List.copyOf(results);
        this.skipped = List.copyOf(skipped);
        this.availableTasks = availableTasks == null ? List.of() : List.copyOf(availableTasks);
        this.nothingSelected = nothingSelected;
    }

    /**
     * 실행이 끝난 호출의 결과 생성.
     *
     * <p>실패한 결과가 하나라도 있으면 SETTLED_FAILURE, 아니면 SETTLED_SUCCESS입니다.</p>
     *
     * @param results 실행된 Task 결과 (그룹 순서)
     * @param skipped 시작되지 않은 Task
     * @return RunOutcome 인스턴스
     * @throws IllegalArgumentException results 또는 skipped가 null인 경우
     */
    public static RunOutcome settled(List<ExecutionResult> results, List<TaskName> skipped) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        boolean failed = results.stream().anyMatch(result -> !result.isSuccess());
        return new RunOutcome(failed ? RunState.SETTLED_FAILURE : RunState.SETTLED_SUCCESS,
            results, skipped, List.of(), false);
    }

    /**
     * 아무 Task도 선택되지 않은 호출의 결과 생성.
     *
     * @param availableTasks 선택 가능한 Task 이름
     * @return RunOutcome 인스턴스 (isSuccess = false)
     */
    public static RunOutcome nothingSelected(List<TaskName> availableTasks) {
        return new RunOutcome(RunState.SETTLED_FAILURE, List.of(), List.of(), availableTasks, true);
    }

    /**
     * 전체 성공 여부.
     *
     * @return 선택된 Task가 있고 모두 성공했으면 true (빈 맵을 전체 실행한 경우도 true)
     */
    public boolean isSuccess() {
        return state == RunState.SETTLED_SUCCESS;
    }

    /**
     * 선택된 Task가 없어 아무것도 실행하지 않았는지 확인.
     *
     * @return 선택 없음이면 true
     */
    public boolean isNothingSelected() {
        return nothingSelected;
    }

    /**
     * 종료 상태.
     *
     * @return SETTLED_SUCCESS 또는 SETTLED_FAILURE
     */
    public RunState getState() {
        return state;
    }

    /**
     * 실행된 Task 결과 (그룹 오름차순, 그룹 내 선언 순서).
     *
     * @return 결과 목록 (수정 불가)
     */
    public List<ExecutionResult> getResults() {
        return results;
    }

    /**
     * 실패한 Task 결과.
     *
     * @return 실패 결과 목록
     */
    public List<ExecutionResult> getFailures() {
        return results.stream()
            .filter(result -> !result.isSuccess())
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 실패한 Task 이름.
     *
     * @return 실패한 Task 이름 목록
     */
    public List<TaskName> getFailedTasks() {
        return results.stream()
            .filter(result -> !result.isSuccess())
            .map(ExecutionResult::taskName)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 앞선 그룹 실패로 시작되지 않은 Task.
     *
     * @return Task 이름 목록 (수정 불가)
     */
    public List<TaskName> getSkipped() {
        return skipped;
    }

    /**
     * 선택 가능한 Task 이름 (선택 없음일 때만 채워짐).
     *
     * @return Task 이름 목록 (수정 불가)
     */
    public List<TaskName> getAvailableTasks() {
        return availableTasks;
    }

    /**
     * 이름으로 결과 조회.
     *
     * @param name Task 이름
     * @return 결과 (실행되지 않았으면 empty)
     */
    public Optional<ExecutionResult> getResult(String name) {
        return results.stream()
            .filter(result -> result.taskName().getValue().equals(name))
            .findFirst();
    }

    /**
     * 이름으로 Task 최종 상태 조회.
     *
     * @param name Task 이름
     * @return SUCCEEDED, FAILED, SKIPPED 중 하나 (선택되지 않은 Task는 empty)
     */
    public Optional<TaskState> getTaskState(String name) {
        Optional<ExecutionResult> result = getResult(name);
        if (result.isPresent()) {
            return Optional.of(result.get().isSuccess() ? TaskState.SUCCEEDED : TaskState.FAILED);
        }
        boolean wasSkipped = skipped.stream().anyMatch(taskName -> taskName.getValue().equals(name));
        return wasSkipped ? Optional.of(TaskState.SKIPPED) : Optional.empty();
    }

    /**
     * 실패한 호출을 예외로 변환.
     *
     * @return 성공이면 this
     * @throws SchedulingAbortedException Task가 실패한 경우
     * @throws TaskNotFoundException 아무 Task도 선택되지 않은 경우
     */
    public RunOutcome orThrow() {
        if (isSuccess()) {
            return this;
        }
        if (nothingSelected) {
            throw TaskNotFoundException.nothingSelected(names(availableTasks));
        }
        throw new SchedulingAbortedException(getFailures(), skipped);
    }

    private static List<String> names(List<TaskName> taskNames) {
        return taskNames.stream().map(TaskName::getValue).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        if (nothingSelected) {
            return "RunOutcome{state=" + state + ", nothingSelected=true, available=" + availableTasks + "}";
        }
        return "RunOutcome{state=" + state + ", executed=" + results.size()
            + ", failed=" + getFailedTasks() + ", skipped=" + skipped + "}";
    }
}
