package com.ryuqq.enumkit.core.exception;

/**
 * 같은 이름의 Enum이 이미 Registry에 등록되어 있음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DuplicateEnumException extends EnumException {

    public DuplicateEnumException(String message) {
        super(EnumErrorCode.DUPLICATE_ENUM, message);
    }
}
