package com.ryuqq.enumkit.core.exception;

/**
 * 하나의 Enum 안에서 두 멤버가 같은 이름을 가짐.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DuplicateItemException extends EnumException {

    public DuplicateItemException(String message) {
        super(EnumErrorCode.DUPLICATE_ITEM, message);
    }
}
