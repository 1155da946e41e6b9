package com.ryuqq.enumkit.core.exception;

/**
 * 멤버 보조 데이터에 예약 키(Name, EnumType)가 포함됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReservedKeyException extends EnumException {

    public ReservedKeyException(String message) {
        super(EnumErrorCode.RESERVED_KEY, message);
    }
}
