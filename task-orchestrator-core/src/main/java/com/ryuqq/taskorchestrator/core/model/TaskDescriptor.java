package com.ryuqq.taskorchestrator.core.model;

/**
 * 정규화된 Task 정의.
 *
 * <p>문자열, 함수, 구조화된 객체 등 다양한 형태의 Task 정의는
 * 모두 이 하나의 형태로 변환된 뒤 선택/스케줄링/실행 단계로 전달됩니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>name:</strong> 호출 내에서 유일한 Task 이름</li>
 *   <li><strong>command:</strong> Shell, Callable, No-op 중 하나</li>
 *   <li><strong>priority:</strong> 실행 순서 (작을수록 먼저)</li>
 *   <li><strong>parameters:</strong> Callable에 전달할 파라미터 (Shell에서는 무시)</li>
 * </ul>
 *
 * @param name Task 이름
 * @param command 실행할 명령
 * @param priority 우선순위
 * @param parameters Callable 파라미터
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskDescriptor(
    TaskName name,
    TaskCommand command,
    Priority priority,
    TaskParameters parameters
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name, command, priority가 null인 경우
     */
    public TaskDescriptor {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (parameters == null) {
            parameters = TaskParameters.empty();
        }
    }

    /**
     * Shell Task 생성.
     *
     * @param name Task 이름
     * @param commandLine 명령줄
     * @param priority 우선순위
     * @return TaskDescriptor 인스턴스
     */
    public static TaskDescriptor shell(String name, String commandLine, int priority) {
        return new TaskDescriptor(TaskName.of(name), ShellCommand.of(commandLine), Priority.of(priority), TaskParameters.empty());
    }

    /**
     * Callable Task 생성.
     *
     * @param name Task 이름
     * @param action 호출할 동작
     * @param priority 우선순위
     * @return TaskDescriptor 인스턴스
     */
    public static TaskDescriptor callable(String name, TaskAction action, int priority) {
        return new TaskDescriptor(TaskName.of(name), CallableCommand.of(action), Priority.of(priority), TaskParameters.empty());
    }
}
