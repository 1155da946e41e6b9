package com.ryuqq.enumkit.application.factory;

/**
 * 이름 → 데이터 매핑으로 Enum을 만들 때의 멤버 순서 정책.
 *
 * <p>{@code getEnumItems()}가 반환하는 순서를 결정하며, 이름 기반 조회에는 영향이 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MappingOrder {

    /**
     * 전달된 Map의 반복 순서를 그대로 사용.
     *
     * <p>LinkedHashMap이면 삽입 순서, HashMap이면 순서가 정해지지 않습니다.</p>
     */
    INSERTION,

    /**
     * 멤버 이름의 자연 순서로 정렬.
     */
    SORTED
}
