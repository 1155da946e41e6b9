package com.ryuqq.enumkit.core.exception;

/**
 * 멤버 이름이 Enum 자체의 공개 표면(Name, GetEnumItems)과 충돌함.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReservedItemNameException extends EnumException {

    public ReservedItemNameException(String message) {
        super(EnumErrorCode.RESERVED_ITEM_NAME, message);
    }
}
