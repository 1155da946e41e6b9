package com.ryuqq.enumkit.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Enum의 단일 멤버 (불변 값).
 *
 * <p>EnumItem은 멤버 이름, 소속 Enum 이름, 그리고 호출자가 생성 시 전달한
 * 보조 데이터를 가집니다. 생성은 {@code EnumItemFactory}를 통해서만 이루어집니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * EnumItem red = EnumItemFactory.createItem("Color", "Red", Map.of("hex", "#FF0000"));
 * red.getName();      // "Red"
 * red.getEnumType();  // "Color"
 * red.get("hex");     // "#FF0000"
 * red.toString();     // "Enum.Color.Red"
 * </pre>
 *
 * <p><strong>불변성:</strong> 모든 필드는 final이며 보조 데이터는 수정 불가 Map으로 노출됩니다.</p>
 * <p><strong>동등성:</strong></p>
 * <ul>
 *   <li>{@link IdentityToken}만 비교 (필드 값 비교 안 함)</li>
 *   <li>따로 생성된 두 멤버는 필드가 같아도 서로 다름</li>
 *   <li>{@link #copy()}로 만든 복제본은 원본과 같음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnumItem {

    /**
     * 멤버 이름 필드의 예약 키.
     */
    public static final String NAME_KEY = "Name";

    /**
     * 소속 Enum 이름 필드의 예약 키.
     */
    public static final String ENUM_TYPE_KEY = "EnumType";

    /**
     * 보조 데이터에 사용할 수 없는 키 목록.
     */
    public static final Set<String> RESERVED_KEYS = Set.of(NAME_KEY, ENUM_TYPE_KEY);

    private final String enumType;
    private final String name;
    private final Map<String, Object> data;
    private final IdentityToken token;

    private EnumItem(String enumType, String name, Map<String, Object> data, IdentityToken token) {
        this.enumType = enumType;
        this.name = name;
        this.data = data;
        this.token = token;
    }

    /**
     * 새 토큰으로 EnumItem 생성.
     *
     * <p>인자 검증은 호출자(EnumItemFactory)의 책임이며, 여기서는 data의 얕은 복사만 수행합니다.</p>
     *
     * @param enumType 소속 Enum 이름
     * @param name 멤버 이름
     * @param data 보조 데이터 (검증 완료된 상태)
     * @return 새 EnumItem
     */
    static EnumItem create(String enumType, String name, Map<String, ?> data) {
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        return new EnumItem(enumType, name, copy, IdentityToken.mint());
    }

    /**
     * 멤버 이름 조회.
     *
     * @return 멤버 이름
     */
    public String getName() {
        return name;
    }

    /**
     * 소속 Enum 이름 조회.
     *
     * @return Enum 이름
     */
    public String getEnumType() {
        return enumType;
    }

    /**
     * 보조 데이터 조회.
     *
     * @return 수정 불가 Map (삽입 순서 유지, 예약 키 미포함)
     */
    public Map<String, Object> getData() {
        return data;
    }

    /**
     * 키로 필드 조회.
     *
     * <p>{@code Name}, {@code EnumType} 예약 키와 보조 데이터 키를 동일하게 조회합니다.</p>
     *
     * @param key 조회할 키
     * @return 값, 없으면 null
     */
    public Object get(String key) {
        if (NAME_KEY.equals(key)) return name;
        if (ENUM_TYPE_KEY.equals(key)) return enumType;
        return data.get(key);
    }

    /**
     * 키 존재 여부 확인.
     *
     * @param key 확인할 키
     * @return 예약 키이거나 보조 데이터에 있으면 true, key가 null이면 false
     */
    public boolean has(String key) {
        if (key == null) return false;
        return RESERVED_KEYS.contains(key) || data.containsKey(key);
    }

    /**
     * 저장용 복제본 생성.
     *
     * <p>복제본은 원본의 토큰을 공유하므로 원본과 {@code equals}가 true입니다.</p>
     *
     * @return 원본과 동일한 멤버를 나타내는 복제본
     */
    public EnumItem copy() {
        return new EnumItem(enumType, name, data, token);
    }

    /**
     * 동일성 토큰 조회.
     *
     * @return 생성 시 발급된 토큰
     */
    public IdentityToken getToken() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnumItem other)) return false;
        return token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return "Enum." + enumType + '.' + name;
    }
}
