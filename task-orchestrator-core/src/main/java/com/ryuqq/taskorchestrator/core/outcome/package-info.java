/**
 * Task execution outcome package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.core.outcome.Ok} - Successful completion, optional return value</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.outcome.Fail} - Failure with error code, message and cause</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.taskorchestrator.core.outcome.ExecutionResult} wraps an outcome with the
 * task name, captured output and exit code, so shell and callable tasks report the same shape.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.taskorchestrator.core.outcome;
