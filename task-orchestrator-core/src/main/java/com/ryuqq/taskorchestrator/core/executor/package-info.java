/**
 * Executor port - runs one task to completion.
 *
 * <p>Implementations live in the adapter-runner module.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.taskorchestrator.core.executor;
