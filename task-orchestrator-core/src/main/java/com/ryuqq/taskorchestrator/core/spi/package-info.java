/**
 * Service Provider Interface for external collaborators.
 *
 * <ul>
 *   <li>{@link com.ryuqq.taskorchestrator.core.spi.Capability} - Opaque binding called with an options bag</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.taskorchestrator.core.spi;
