/**
 * Task 모듈 SPI와 검색.
 *
 * <p>모듈은 {@link java.util.ServiceLoader}로 발견되며 CLI 첫 번째 인자로 선택됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.taskorchestrator.application.module;
