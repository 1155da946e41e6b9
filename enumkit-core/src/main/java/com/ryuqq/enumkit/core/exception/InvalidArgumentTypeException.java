package com.ryuqq.enumkit.core.exception;

/**
 * 공개 연산에 잘못된 종류의 인자가 전달됨 (null, 빈 이름, null 원소/키/값).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InvalidArgumentTypeException extends EnumException {

    public InvalidArgumentTypeException(String message) {
        super(EnumErrorCode.INVALID_ARGUMENT_TYPE, message);
    }
}
