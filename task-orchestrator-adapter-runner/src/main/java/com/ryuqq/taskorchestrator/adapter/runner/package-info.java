/**
 * Runner Adapter Layer - TaskOrchestrator 구현체.
 *
 * <p>이 패키지는 정규화, 선택, 우선순위 그룹 스케줄링, 명령 실행의 구체적인 구현을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.adapter.runner.PriorityGroupScheduler} - 우선순위 그룹 단위 동시 실행 + barrier</li>
 *   <li>{@link com.ryuqq.taskorchestrator.adapter.runner.TaskDescriptorNormalizer} - 맵 값 → TaskDescriptor</li>
 *   <li>{@link com.ryuqq.taskorchestrator.adapter.runner.TaskSelector} - 호출 인자 → run-set</li>
 *   <li>{@link com.ryuqq.taskorchestrator.adapter.runner.DispatchingCommandExecutor} - Shell / Callable / No-op 분기</li>
 * </ul>
 *
 * <h2>설정</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.adapter.runner.SchedulerConfig} - 기본 우선순위, 최대 동시 실행 수</li>
 *   <li>{@link com.ryuqq.taskorchestrator.adapter.runner.SelectorConfig} - 전체 실행 플래그, 선택 키</li>
 *   <li>{@link com.ryuqq.taskorchestrator.adapter.runner.ShellConfig} - 셸 명령, 출력 로그 echo</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (PriorityGroupScheduler)
 *   ↓ implements
 * application (TaskOrchestrator interface)
 *   ↓ depends on
 * core (TaskDescriptor, InvocationContext, Outcome, RunState)
 *   ↓ depends on
 * core/executor (CommandExecutor interface)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.taskorchestrator.adapter.runner;
