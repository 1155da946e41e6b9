package com.ryuqq.enumkit.application.factory;

/**
 * EnumFactory 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>mappingOrder: createEnumFromMapping의 멤버 순서 (기본 INSERTION)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param mappingOrder 매핑 기반 생성 시 멤버 순서 정책 (null이 아니어야 함)
 */
public record EnumFactoryConfig(
    MappingOrder mappingOrder
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: mappingOrder=INSERTION</p>
     */
    public EnumFactoryConfig() {
        this(MappingOrder.INSERTION);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EnumFactoryConfig {
        if (mappingOrder == null) {
            throw new IllegalArgumentException("mappingOrder cannot be null");
        }
    }

    /**
     * mappingOrder만 변경한 새 인스턴스 생성.
     */
    public EnumFactoryConfig withMappingOrder(MappingOrder mappingOrder) {
        return new EnumFactoryConfig(mappingOrder);
    }
}
