package com.ryuqq.enumkit.core.model;

import com.ryuqq.enumkit.core.exception.InvalidArgumentTypeException;
import com.ryuqq.enumkit.core.exception.ReservedKeyException;

import java.util.Map;

/**
 * EnumItem 생성 팩토리.
 *
 * <p>Registry에 의존하지 않는 말단(leaf) 컴포넌트로, 인자를 검증한 뒤
 * 새 {@link IdentityToken}을 가진 불변 {@link EnumItem}을 만듭니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>enumType: null 또는 빈 문자열 불가 → {@link InvalidArgumentTypeException}</li>
 *   <li>name: null 불가 (빈 문자열과 공백은 허용) → {@link InvalidArgumentTypeException}</li>
 *   <li>data: null 불가, null 키/값 불가 → {@link InvalidArgumentTypeException}</li>
 *   <li>data에 예약 키(Name, EnumType) 불가 → {@link ReservedKeyException}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EnumItem small = EnumItemFactory.createItem("Size", "Small");
 * EnumItem large = EnumItemFactory.createItem("Size", "Large", Map.of("order", 2));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnumItemFactory {

    private EnumItemFactory() {
    }

    /**
     * 보조 데이터 없이 EnumItem 생성.
     *
     * @param enumType 소속 Enum 이름
     * @param name 멤버 이름
     * @return 새 EnumItem
     * @throws InvalidArgumentTypeException enumType이 null이거나 빈 문자열인 경우, 또는 name이 null인 경우
     */
    public static EnumItem createItem(String enumType, String name) {
        return createItem(enumType, name, Map.of());
    }

    /**
     * 보조 데이터를 포함한 EnumItem 생성.
     *
     * <p>data는 얕은 복사되므로 호출 후 원본 Map을 변경해도 EnumItem에는 영향이 없습니다.</p>
     *
     * @param enumType 소속 Enum 이름
     * @param name 멤버 이름
     * @param data 보조 데이터
     * @return 새 EnumItem
     * @throws InvalidArgumentTypeException 인자가 유효하지 않은 경우
     * @throws ReservedKeyException data에 예약 키가 포함된 경우
     */
    public static EnumItem createItem(String enumType, String name, Map<String, ?> data) {
        requireEnumName(enumType, "enumType");
        if (name == null) {
            throw new InvalidArgumentTypeException("name must be a string, but was null (enumType: " + enumType + ")");
        }
        if (data == null) {
            throw new InvalidArgumentTypeException("data must be a mapping, but was null (item: " + enumType + "." + name + ")");
        }

        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            if (key == null) {
                throw new InvalidArgumentTypeException("data keys cannot be null (item: " + enumType + "." + name + ")");
            }
            if (entry.getValue() == null) {
                throw new InvalidArgumentTypeException("data value for key '" + key + "' cannot be null (item: " + enumType + "." + name + ")");
            }
            if (EnumItem.RESERVED_KEYS.contains(key)) {
                throw new ReservedKeyException("data key '" + key + "' is reserved (item: " + enumType + "." + name + ")");
            }
        }

        return EnumItem.create(enumType, name, data);
    }

    static void requireEnumName(String value, String argument) {
        if (value == null) {
            throw new InvalidArgumentTypeException(argument + " must be a string, but was null");
        }
        if (value.isEmpty()) {
            throw new InvalidArgumentTypeException(argument + " cannot be empty");
        }
    }
}
