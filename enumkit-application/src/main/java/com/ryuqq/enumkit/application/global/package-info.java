/**
 * Process-wide enum accessor.
 *
 * <p>{@link com.ryuqq.enumkit.application.global.Enums} wires the default in-memory
 * registry to an {@link com.ryuqq.enumkit.application.factory.EnumFactory} and exposes
 * creation and lookup as static methods.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.enumkit.application.global;
