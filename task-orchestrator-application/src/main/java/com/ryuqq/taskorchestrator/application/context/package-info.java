/**
 * Capability object injected into task modules.
 *
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.application.context.TaskContext} - Lookup helpers, argument array builder, scheduler entry point, capability bindings</li>
 *   <li>{@link com.ryuqq.taskorchestrator.application.context.TaskContextBuilder} - Assembles a context from raw tokens</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.taskorchestrator.application.context;
