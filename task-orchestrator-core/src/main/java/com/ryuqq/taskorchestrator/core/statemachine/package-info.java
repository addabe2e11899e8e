/**
 * Run and task lifecycle states.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.core.statemachine.RunState} - Per-invocation states</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.statemachine.RunStateTransition} - Transition validation</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.statemachine.TaskState} - Per-task states reported to listeners</li>
 * </ul>
 *
 * <h2>Run State Transition Rules</h2>
 * <pre>
 * IDLE → SELECTING
 * SELECTING → GROUPING | SETTLED_FAILURE
 * GROUPING → RUNNING | SETTLED_SUCCESS
 * RUNNING → SETTLED_SUCCESS | SETTLED_FAILURE
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.taskorchestrator.core.statemachine;
