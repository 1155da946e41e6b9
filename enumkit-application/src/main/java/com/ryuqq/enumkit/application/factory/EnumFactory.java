package com.ryuqq.enumkit.application.factory;

import com.ryuqq.enumkit.core.exception.DuplicateEnumException;
import com.ryuqq.enumkit.core.exception.EnumException;
import com.ryuqq.enumkit.core.exception.InvalidArgumentTypeException;
import com.ryuqq.enumkit.core.model.EnumItem;
import com.ryuqq.enumkit.core.model.EnumItemFactory;
import com.ryuqq.enumkit.core.model.Enumeration;
import com.ryuqq.enumkit.core.spi.EnumRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Enum 조립 및 등록 컴포넌트.
 *
 * <p>미리 생성된 {@link EnumItem}들을 검증하여 불변 {@link Enumeration}으로 조립하고,
 * {@link EnumRegistry}에 등록한 뒤 반환합니다.</p>
 *
 * <p><strong>처리 흐름 (첫 번째 실패에서 중단):</strong></p>
 * <pre>
 * 1. 인자 검증 (enumName, items, null 원소) → InvalidArgumentType
 * 2. registry.contains(enumName) → DuplicateEnum
 * 3. 멤버별 검증 (삽입 순서):
 *    a. 예약 이름 → ReservedItemName
 *    b. 이름 중복 → DuplicateItem
 *    c. EnumType 불일치 → EnumTypeMismatch
 * 4. 불변 Enumeration 생성
 * 5. registry.register() → 원자적 write-once (동시 경합 패자는 DuplicateEnum)
 * </pre>
 *
 * <p><strong>원자성:</strong> 등록은 마지막 단계에서 한 번만 일어나므로,
 * 어느 단계에서 실패하더라도 Registry는 변경되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EnumFactory factory = new EnumFactory(new InMemoryEnumRegistry());
 *
 * Enumeration color = factory.createEnum("Color", List.of(
 *     EnumItemFactory.createItem("Color", "Red"),
 *     EnumItemFactory.createItem("Color", "Blue")
 * ));
 *
 * Enumeration size = factory.createEnumFromMapping("Size", Map.of(
 *     "Small", Map.of(),
 *     "Large", Map.of("order", 2)
 * ));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnumFactory {

    private static final Logger log = LoggerFactory.getLogger(EnumFactory.class);
    private final EnumRegistry registry;
    private final EnumFactoryConfig config;

    /**
     * 기본 설정 생성자.
     *
     * @param registry 등록 대상 Registry
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public EnumFactory(EnumRegistry registry) {
        this(registry, new EnumFactoryConfig());
    }

    /**
     * 생성자.
     *
     * @param registry 등록 대상 Registry
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EnumFactory(EnumRegistry registry, EnumFactoryConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
    }

    /**
     * 멤버 목록으로 Enum 생성 및 등록.
     *
     * @param enumName Enum 이름
     * @param items 멤버 목록 (순서는 getEnumItems()에 유지됨)
     * @return 등록된 Enumeration
     * @throws InvalidArgumentTypeException enumName이 null이거나 빈 문자열이거나 items가 null이거나 null 원소를 포함한 경우
     * @throws DuplicateEnumException 같은 이름의 Enum이 이미 등록된 경우
     * @throws com.ryuqq.enumkit.core.exception.ReservedItemNameException 멤버 이름이 예약어인 경우
     * @throws com.ryuqq.enumkit.core.exception.DuplicateItemException 멤버 이름이 중복된 경우
     * @throws com.ryuqq.enumkit.core.exception.EnumTypeMismatchException 멤버의 EnumType이 다른 경우
     */
    public Enumeration createEnum(String enumName, List<EnumItem> items) {
        try {
            validateArguments(enumName, items);

            if (registry.contains(enumName)) {
                throw new DuplicateEnumException("enum " + enumName + " is already registered");
            }

            Enumeration enumeration = Enumeration.builder(enumName)
                .addAll(items)
                .build();

            registry.register(enumeration);
            log.debug("Created {} from {} items", enumeration, items.size());
            return enumeration;

        } catch (EnumException e) {
            log.debug("Rejected enum {}: {}", enumName, e.getMessage());
            throw e;
        }
    }

    /**
     * 이름 → 데이터 매핑으로 Enum 생성 및 등록.
     *
     * <p>항목마다 {@link EnumItemFactory#createItem(String, String, Map)}을 호출한 뒤
     * {@link #createEnum(String, List)}에 위임하므로 두 팩토리의 검증이 모두 적용됩니다.
     * 멤버 순서는 {@link EnumFactoryConfig#mappingOrder()}를 따릅니다.</p>
     *
     * @param enumName Enum 이름
     * @param rawItems 멤버 이름 → 보조 데이터 매핑
     * @return 등록된 Enumeration
     * @throws InvalidArgumentTypeException rawItems가 null이거나 null 키/데이터를 포함한 경우
     * @throws com.ryuqq.enumkit.core.exception.ReservedKeyException 데이터에 예약 키가 포함된 경우
     * @throws DuplicateEnumException 같은 이름의 Enum이 이미 등록된 경우
     */
    public Enumeration createEnumFromMapping(String enumName, Map<String, ? extends Map<String, ?>> rawItems) {
        List<EnumItem> items;
        try {
            items = toItems(enumName, rawItems);
        } catch (EnumException e) {
            log.debug("Rejected enum {}: {}", enumName, e.getMessage());
            throw e;
        }

        return createEnum(enumName, items);
    }

    /**
     * 현재 설정 조회.
     *
     * @return 설정
     */
    public EnumFactoryConfig getConfig() {
        return config;
    }

    private List<EnumItem> toItems(String enumName, Map<String, ? extends Map<String, ?>> rawItems) {
        if (rawItems == null) {
            throw new InvalidArgumentTypeException("rawItems must be a mapping, but was null (enum: " + enumName + ")");
        }

        List<EnumItem> items = new ArrayList<>(rawItems.size());
        for (String memberName : orderedMemberNames(enumName, rawItems)) {
            Map<String, ?> data = rawItems.get(memberName);
            if (data == null) {
                throw new InvalidArgumentTypeException(
                    "data for member '" + memberName + "' must be a mapping, but was null (enum: " + enumName + ")");
            }
            items.add(EnumItemFactory.createItem(enumName, memberName, data));
        }
        return items;
    }

    private List<String> orderedMemberNames(String enumName, Map<String, ?> rawItems) {
        List<String> names = new ArrayList<>(rawItems.keySet());
        if (names.contains(null)) {
            throw new InvalidArgumentTypeException("member names cannot be null (enum: " + enumName + ")");
        }
        if (config.mappingOrder() == MappingOrder.SORTED) {
            Collections.sort(names);
        }
        return names;
    }

    private static void validateArguments(String enumName, List<EnumItem> items) {
        if (enumName == null) {
            throw new InvalidArgumentTypeException("enumName must be a string, but was null");
        }
        if (enumName.isEmpty()) {
            throw new InvalidArgumentTypeException("enumName cannot be empty");
        }
        if (items == null) {
            throw new InvalidArgumentTypeException("items must be a sequence, but was null (enum: " + enumName + ")");
        }
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == null) {
                throw new InvalidArgumentTypeException("items cannot contain null (enum: " + enumName + ", index: " + i + ")");
            }
        }
    }
}
