package com.ryuqq.enumkit.core.exception;

/**
 * Enum 생성/검증 실패의 공통 상위 예외.
 *
 * <p>모든 오류는 동기적으로 즉시 발생하며(fail-fast), 라이브러리가 복구하지 않습니다.
 * 실패한 호출은 Registry를 전혀 변경하지 않습니다.</p>
 *
 * <p>Sealed class로 정의되어 오류 종류가 닫혀 있습니다:</p>
 * <ul>
 *   <li>{@link InvalidArgumentTypeException}</li>
 *   <li>{@link ReservedKeyException}</li>
 *   <li>{@link ReservedItemNameException}</li>
 *   <li>{@link DuplicateItemException}</li>
 *   <li>{@link DuplicateEnumException}</li>
 *   <li>{@link EnumTypeMismatchException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract sealed class EnumException extends RuntimeException
        permits InvalidArgumentTypeException,
                ReservedKeyException,
                ReservedItemNameException,
                DuplicateItemException,
                DuplicateEnumException,
                EnumTypeMismatchException {

    private final EnumErrorCode errorCode;

    protected EnumException(EnumErrorCode errorCode, String message) {
        super("[" + errorCode.code() + "] " + message);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public EnumErrorCode getErrorCode() {
        return errorCode;
    }
}
