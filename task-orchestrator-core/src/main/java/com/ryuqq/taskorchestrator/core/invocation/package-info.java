/**
 * Invocation token parsing and the read-only invocation context.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.core.invocation.ArgumentParser} - Permissive tokenizer (positional, named, flags)</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.invocation.ParsedArguments} - Parse result</li>
 *   <li>{@link com.ryuqq.taskorchestrator.core.invocation.InvocationContext} - Parsed tokens, environment snapshot, working directory</li>
 * </ul>
 *
 * <h2>Token Rules</h2>
 * <pre>
 * key=value, --key=value  → named (last occurrence wins)
 * --key                   → flag
 * anything else           → positional (order preserved)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.taskorchestrator.core.invocation;
