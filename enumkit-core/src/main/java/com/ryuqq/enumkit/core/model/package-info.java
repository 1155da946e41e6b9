/**
 * Core enum model package containing the identity-compared value types.
 *
 * <p>This package defines the immutable values that make up a runtime enumeration:</p>
 *
 * <h2>Value Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.enumkit.core.model.IdentityToken} - Opaque per-instance identity marker</li>
 *   <li>{@link com.ryuqq.enumkit.core.model.EnumItem} - Single enum member with auxiliary data</li>
 *   <li>{@link com.ryuqq.enumkit.core.model.Enumeration} - Named, closed set of members</li>
 * </ul>
 *
 * <h2>Factories</h2>
 * <ul>
 *   <li>{@link com.ryuqq.enumkit.core.model.EnumItemFactory} - Validated EnumItem creation</li>
 *   <li>{@link com.ryuqq.enumkit.core.model.Enumeration.Builder} - Per-member validated assembly</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Final fields, unmodifiable collections, no setters</li>
 *   <li><strong>Identity Equality:</strong> equals/hashCode compare tokens, never field contents</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.enumkit.core.model;
