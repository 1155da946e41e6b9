/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interface that infrastructure adapters implement
 * to store registered enumerations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.enumkit.core.spi.EnumRegistry} - Write-once enum name → Enumeration store</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., enumkit-adapter-inmemory) provide concrete implementations.
 * Every implementation should pass the contract tests in enumkit-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Write-Once:</strong> No update or delete operation exists</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.enumkit.core.spi;
