package com.ryuqq.enumkit.core.exception;

/**
 * 멤버의 EnumType이 조립 중인 Enum 이름과 다름 (다른 Enum용으로 생성된 멤버).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnumTypeMismatchException extends EnumException {

    public EnumTypeMismatchException(String message) {
        super(EnumErrorCode.ENUM_TYPE_MISMATCH, message);
    }
}
