package com.ryuqq.enumkit.application.global;

import com.ryuqq.enumkit.adapter.inmemory.registry.InMemoryEnumRegistry;
import com.ryuqq.enumkit.application.factory.EnumFactory;
import com.ryuqq.enumkit.application.factory.EnumFactoryConfig;
import com.ryuqq.enumkit.core.model.EnumItem;
import com.ryuqq.enumkit.core.model.EnumItemFactory;
import com.ryuqq.enumkit.core.model.Enumeration;
import com.ryuqq.enumkit.core.spi.EnumRegistry;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 프로세스 전역 Enum 접근점.
 *
 * <p>하나의 {@link InMemoryEnumRegistry}와 그 위의 {@link EnumFactory}(기본 설정)를 묶어
 * 정적 메서드로 노출합니다. Registry는 클래스 로딩 시 비어 있는 상태로 초기화되며,
 * 이후 {@link #createEnum}/{@link #createEnumFromMapping} 성공 시에만 항목이 추가됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Enumeration color = Enums.createEnum("Color", List.of(
 *     Enums.createItem("Color", "Red"),
 *     Enums.createItem("Color", "Blue")
 * ));
 *
 * Enums.get("Color").get("Red");   // Enum.Color.Red
 * Enums.getEnums().keySet();       // [Color, ...]
 * </pre>
 *
 * <p><strong>주의:</strong> 초기화/삭제 연산이 없으므로 같은 JVM에서 실행되는 테스트들은
 * 서로 다른 Enum 이름을 사용해야 합니다. 격리가 필요하면 {@link EnumFactory}를
 * 별도 Registry로 직접 생성하세요.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Enums {

    private static final EnumRegistry REGISTRY = new InMemoryEnumRegistry();
    private static final EnumFactory FACTORY = new EnumFactory(REGISTRY, new EnumFactoryConfig());

    private Enums() {
    }

    /**
     * 보조 데이터 없이 EnumItem 생성.
     *
     * @see EnumItemFactory#createItem(String, String)
     */
    public static EnumItem createItem(String enumType, String name) {
        return EnumItemFactory.createItem(enumType, name);
    }

    /**
     * 보조 데이터를 포함한 EnumItem 생성.
     *
     * @see EnumItemFactory#createItem(String, String, Map)
     */
    public static EnumItem createItem(String enumType, String name, Map<String, ?> data) {
        return EnumItemFactory.createItem(enumType, name, data);
    }

    /**
     * 전역 Registry에 Enum 생성 및 등록.
     *
     * @see EnumFactory#createEnum(String, List)
     */
    public static Enumeration createEnum(String enumName, List<EnumItem> items) {
        return FACTORY.createEnum(enumName, items);
    }

    /**
     * 이름 → 데이터 매핑으로 전역 Registry에 Enum 생성 및 등록.
     *
     * @see EnumFactory#createEnumFromMapping(String, Map)
     */
    public static Enumeration createEnumFromMapping(String enumName, Map<String, ? extends Map<String, ?>> rawItems) {
        return FACTORY.createEnumFromMapping(enumName, rawItems);
    }

    /**
     * 이름으로 등록된 Enum 조회.
     *
     * @param enumName Enum 이름
     * @return Enumeration, 없으면 null
     */
    public static Enumeration get(String enumName) {
        return REGISTRY.get(enumName);
    }

    /**
     * 이름으로 등록된 Enum 조회 (Optional).
     *
     * @param enumName Enum 이름
     * @return Enumeration (존재하는 경우), 빈 Optional (없는 경우)
     */
    public static Optional<Enumeration> find(String enumName) {
        return REGISTRY.find(enumName);
    }

    /**
     * 등록 여부 확인.
     *
     * @param enumName Enum 이름
     * @return 등록되어 있으면 true
     */
    public static boolean contains(String enumName) {
        return REGISTRY.contains(enumName);
    }

    /**
     * 전체 등록 목록 스냅샷 조회.
     *
     * @return 이름 → Enumeration 매핑의 독립 복사본
     */
    public static Map<String, Enumeration> getEnums() {
        return REGISTRY.getEnums();
    }
}
