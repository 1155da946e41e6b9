package com.ryuqq.enumkit.core.exception;

/**
 * Enum 정의 오류 코드.
 *
 * <p>모든 {@link EnumException}은 이 코드 중 하나를 가지며,
 * 호출자는 메시지 문자열 대신 코드로 오류 종류를 판별할 수 있습니다.</p>
 *
 * <p><strong>코드 체계:</strong></p>
 * <ul>
 *   <li>ENUM-001: 잘못된 인자 (null, 빈 이름, null 원소)</li>
 *   <li>ENUM-002: 예약된 데이터 키 사용</li>
 *   <li>ENUM-003: 예약된 멤버 이름 사용</li>
 *   <li>ENUM-004: 멤버 이름 중복</li>
 *   <li>ENUM-005: Enum 이름 중복 (이미 등록됨)</li>
 *   <li>ENUM-006: 멤버의 EnumType 불일치</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EnumErrorCode {

    INVALID_ARGUMENT_TYPE("ENUM-001"),
    RESERVED_KEY("ENUM-002"),
    RESERVED_ITEM_NAME("ENUM-003"),
    DUPLICATE_ITEM("ENUM-004"),
    DUPLICATE_ENUM("ENUM-005"),
    ENUM_TYPE_MISMATCH("ENUM-006");

    private final String code;

    EnumErrorCode(String code) {
        this.code = code;
    }

    /**
     * 외부 노출용 코드 조회.
     *
     * @return 코드 문자열 (예: ENUM-005)
     */
    public String code() {
        return code;
    }
}
