package com.ryuqq.enumkit.core.spi;

import com.ryuqq.enumkit.core.exception.DuplicateEnumException;
import com.ryuqq.enumkit.core.model.Enumeration;

import java.util.Map;
import java.util.Optional;

/**
 * Enum Registry SPI (Service Provider Interface).
 *
 * <p>Enum 이름 → {@link Enumeration} 매핑을 보관하는 프로세스 전역 저장소입니다.
 * 이름별로 한 번만 쓸 수 있으며(write-once), 등록된 Enum은 제거되거나 교체되지 않습니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>중복 이름 거부: 확인과 삽입이 원자적으로 수행되어야 함</li>
 *   <li>안전한 공개: 등록된 Enumeration은 모든 스레드에서 즉시 조회 가능해야 함</li>
 *   <li>스냅샷 반환: {@link #getEnums()}의 결과로 내부 상태를 변경할 수 없어야 함</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * public class InMemoryEnumRegistry implements EnumRegistry {
 *     private final ConcurrentHashMap&lt;String, Enumeration&gt; enums = new ConcurrentHashMap&lt;&gt;();
 *
 *     {@literal @}Override
 *     public void register(Enumeration enumeration) {
 *         if (enums.putIfAbsent(enumeration.getName(), enumeration) != null) {
 *             throw new DuplicateEnumException(...);
 *         }
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EnumRegistry {

    /**
     * Enumeration 등록.
     *
     * @param enumeration 등록할 Enumeration
     * @throws DuplicateEnumException 같은 이름이 이미 등록된 경우
     * @throws com.ryuqq.enumkit.core.exception.InvalidArgumentTypeException enumeration이 null인 경우
     */
    void register(Enumeration enumeration);

    /**
     * 이름으로 Enumeration 조회.
     *
     * @param name Enum 이름
     * @return Enumeration, 없으면 null
     */
    Enumeration get(String name);

    /**
     * 이름으로 Enumeration 조회 (Optional).
     *
     * @param name Enum 이름
     * @return Enumeration (존재하는 경우), 빈 Optional (없는 경우)
     */
    default Optional<Enumeration> find(String name) {
        return Optional.ofNullable(get(name));
    }

    /**
     * 등록 여부 확인.
     *
     * @param name Enum 이름
     * @return 등록되어 있으면 true
     */
    default boolean contains(String name) {
        return get(name) != null;
    }

    /**
     * 전체 등록 목록 스냅샷 조회.
     *
     * <p>반환된 Map은 호출 시점의 독립 복사본이며, 변경해도 Registry에 영향이 없습니다.</p>
     *
     * @return 이름 → Enumeration 매핑 복사본
     */
    Map<String, Enumeration> getEnums();

    /**
     * 등록된 Enum 수 조회.
     *
     * @return 등록된 Enum 수
     */
    int size();
}
