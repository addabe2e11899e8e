/**
 * Orchestrator Application Layer - 오케스트레이션 진입 API.
 *
 * <p>이 패키지는 Task 맵을 받아 실행하고 집계 결과를 돌려주는 포트를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.application.orchestrator.TaskOrchestrator} - 실행 조정자</li>
 *   <li>{@link com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome} - 집계 결과</li>
 *   <li>{@link com.ryuqq.taskorchestrator.application.orchestrator.SchedulerListener} - 진행 상황 수신자</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>무상태:</strong> 호출 사이에 상태를 보관하지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.taskorchestrator.application.orchestrator;
