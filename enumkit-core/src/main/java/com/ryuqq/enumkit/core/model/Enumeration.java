package com.ryuqq.enumkit.core.model;

import com.ryuqq.enumkit.core.exception.DuplicateItemException;
import com.ryuqq.enumkit.core.exception.EnumTypeMismatchException;
import com.ryuqq.enumkit.core.exception.InvalidArgumentTypeException;
import com.ryuqq.enumkit.core.exception.ReservedItemNameException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 이름을 가진 닫힌 멤버 집합 (불변 값).
 *
 * <p>Enumeration은 {@link EnumItem}들을 멤버 이름으로 조회할 수 있게 묶은 것으로,
 * 생성 후 멤버를 추가/삭제/변경할 수 없습니다. 애플리케이션 코드는 보통
 * {@code EnumFactory}를 통해 생성하며, 팩토리가 Registry 등록까지 수행합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Enumeration color = factory.createEnum("Color", List.of(red, blue));
 * color.get("Red");        // red
 * color.getEnumItems();    // [red, blue] (독립 복사본)
 * color.toString();        // "Enum.Color"
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>모든 멤버의 EnumType == Enumeration 이름</li>
 *   <li>멤버 이름 중복 없음</li>
 *   <li>멤버 이름은 예약어(Name, GetEnumItems) 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Enumeration {

    /**
     * 멤버 이름으로 사용할 수 없는 이름 목록 (Enumeration 자체의 공개 표면과 충돌).
     */
    public static final Set<String> RESERVED_ITEM_NAMES = Set.of("Name", "GetEnumItems");

    private final String name;
    private final Map<String, EnumItem> members;
    private final List<EnumItem> items;
    private final IdentityToken token;

    private Enumeration(String name, Map<String, EnumItem> members, List<EnumItem> items) {
        this.name = name;
        this.members = members;
        this.items = items;
        this.token = IdentityToken.mint();
    }

    /**
     * Builder 생성.
     *
     * <p>Builder로 만든 Enumeration은 Registry에 등록되지 않으며, 이미 등록된 Enum과
     * 같은 이름을 가질 수도 있습니다. 이름의 유일성과 등록은 {@code EnumFactory}가 보장하므로
     * 애플리케이션 코드는 {@code EnumFactory.createEnum}(또는 {@code Enums.createEnum})을 사용하고,
     * Builder는 Registry 구현체 테스트처럼 등록되지 않은 값이 필요한 경우에만 사용합니다.</p>
     *
     * @param name Enum 이름
     * @return 빈 Builder
     * @throws InvalidArgumentTypeException name이 null이거나 빈 문자열인 경우
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Enum 이름 조회.
     *
     * @return Enum 이름
     */
    public String getName() {
        return name;
    }

    /**
     * 멤버 조회.
     *
     * @param memberName 멤버 이름
     * @return 멤버, 없으면 null
     */
    public EnumItem get(String memberName) {
        return members.get(memberName);
    }

    /**
     * 멤버 조회 (없으면 예외).
     *
     * @param memberName 멤버 이름
     * @return 멤버
     * @throws IllegalArgumentException 해당 이름의 멤버가 없는 경우
     */
    public EnumItem valueOf(String memberName) {
        EnumItem item = members.get(memberName);
        if (item == null) {
            throw new IllegalArgumentException("No member " + memberName + " in " + this);
        }
        return item;
    }

    /**
     * 멤버 포함 여부 확인 (동일성 기준).
     *
     * <p>이름이 같더라도 다른 토큰을 가진 멤버는 포함되지 않은 것으로 판단합니다.</p>
     *
     * @param item 확인할 멤버
     * @return 이 Enumeration의 멤버이면 true
     */
    public boolean contains(EnumItem item) {
        if (item == null) return false;
        return item.equals(members.get(item.getName()));
    }

    /**
     * 전체 멤버 목록 조회.
     *
     * <p>호출할 때마다 생성 순서를 유지한 새 목록을 반환하며,
     * 반환된 목록을 변경해도 Enumeration에는 영향이 없습니다.</p>
     *
     * @return 멤버 목록 복사본
     */
    public List<EnumItem> getEnumItems() {
        return new ArrayList<>(items);
    }

    /**
     * 멤버 수 조회.
     *
     * @return 멤버 수
     */
    public int size() {
        return items.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Enumeration other)) return false;
        return token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return "Enum." + name;
    }

    /**
     * Enumeration 조립기.
     *
     * <p>{@link #add(EnumItem)} 시점에 멤버를 검증하므로,
     * 오류 메시지는 삽입 순서상 첫 번째 위반 멤버를 가리킵니다.</p>
     *
     * <p><strong>멤버별 검증 순서:</strong></p>
     * <ol>
     *   <li>예약 이름 → {@link ReservedItemNameException}</li>
     *   <li>이름 중복 → {@link DuplicateItemException}</li>
     *   <li>EnumType 불일치 → {@link EnumTypeMismatchException}</li>
     * </ol>
     */
    public static final class Builder {

        private final String name;
        private final Map<String, EnumItem> members = new LinkedHashMap<>();
        private final List<EnumItem> items = new ArrayList<>();

        private Builder(String name) {
            EnumItemFactory.requireEnumName(name, "enumName");
            this.name = name;
        }

        /**
         * 멤버 추가.
         *
         * @param item 추가할 멤버
         * @return this
         * @throws InvalidArgumentTypeException item이 null인 경우
         * @throws ReservedItemNameException 멤버 이름이 예약어인 경우
         * @throws DuplicateItemException 같은 이름의 멤버가 이미 추가된 경우
         * @throws EnumTypeMismatchException 멤버의 EnumType이 Enum 이름과 다른 경우
         */
        public Builder add(EnumItem item) {
            if (item == null) {
                throw new InvalidArgumentTypeException("items cannot contain null (enum: " + name + ", index: " + items.size() + ")");
            }
            String itemName = item.getName();
            if (RESERVED_ITEM_NAMES.contains(itemName)) {
                throw new ReservedItemNameException("item name '" + itemName + "' is reserved in enum " + name);
            }
            if (members.containsKey(itemName)) {
                throw new DuplicateItemException("duplicate item '" + itemName + "' in enum " + name);
            }
            if (!name.equals(item.getEnumType())) {
                throw new EnumTypeMismatchException(
                    "item " + item + " belongs to enum type '" + item.getEnumType() + "', not '" + name + "'");
            }

            members.put(itemName, item);
            items.add(item);
            return this;
        }

        /**
         * 여러 멤버를 순서대로 추가.
         *
         * @param items 추가할 멤버 목록
         * @return this
         * @throws InvalidArgumentTypeException items가 null인 경우
         */
        public Builder addAll(List<EnumItem> items) {
            if (items == null) {
                throw new InvalidArgumentTypeException("items must be a sequence, but was null (enum: " + name + ")");
            }
            for (EnumItem item : items) {
                add(item);
            }
            return this;
        }

        /**
         * 불변 Enumeration 생성.
         *
         * @return 새 Enumeration (새 토큰 발급)
         */
        public Enumeration build() {
            return new Enumeration(
                name,
                Collections.unmodifiableMap(new LinkedHashMap<>(members)),
                List.copyOf(items)
            );
        }
    }
}
