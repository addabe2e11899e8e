/**
 * Task definition value types.
 *
 * <p>This package defines the uniform task shape every orchestration map entry is
 * normalized into, plus the structured input form consumers may register.</p>
 *
 * <h2>Descriptor</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.core.model.TaskDescriptor} - Normalized task (name, command, priority, parameters)</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.model.TaskName} - Unique name within one call</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.model.Priority} - Ascending run order; equal values run concurrently</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.model.TaskParameters} - Immutable parameter bag for callables</li>
 * </ul>
 *
 * <h2>Command Variants</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.core.model.ShellCommand} - Command line run as a subprocess</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.model.CallableCommand} - {@link com.ryuqq.taskorchestrator.core.model.TaskAction} invoked directly</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.model.NoOpCommand} - Always succeeds</li>
 * </ul>
 *
 * <h2>Input Form</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.core.model.TaskSpec} - Structured definition with explicit priority and options</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.taskorchestrator.core.model;
