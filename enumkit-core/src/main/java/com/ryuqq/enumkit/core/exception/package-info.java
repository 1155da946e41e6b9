/**
 * Error taxonomy for enum construction.
 *
 * <p>Every failure is an unchecked {@link com.ryuqq.enumkit.core.exception.EnumException}
 * carrying an {@link com.ryuqq.enumkit.core.exception.EnumErrorCode}. Failures are
 * programmer errors surfaced synchronously; the caller decides what to do with them.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.enumkit.core.exception;
