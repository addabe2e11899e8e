/**
 * CLI Layer - 명령줄 진입점.
 *
 * <p>picocli 기반 {@code task-orchestrator} 명령으로 Task 모듈을 찾아 실행하고,
 * {@link com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome}을 종료 코드로 변환합니다.</p>
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.cli.TaskOrchestratorCommand} - 옵션 해석, 모듈 조회, 종료 코드</li>
 *   <li>{@link com.ryuqq.taskorchestrator.cli.module.DoctorModule} - 기본 제공 모듈 (ServiceLoader 등록)</li>
 * </ul>
 *
 * <h2>로깅</h2>
 * <p>진행 상황은 표준 출력, 로그는 표준 에러로 출력됩니다.
 * {@code TASK_ORCHESTRATOR_LOG_LEVEL} 환경 변수로 로그 레벨을 지정할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.taskorchestrator.cli;
