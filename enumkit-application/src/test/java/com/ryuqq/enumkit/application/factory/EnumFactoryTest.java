package com.ryuqq.enumkit.application.factory;

import com.ryuqq.enumkit.core.exception.DuplicateEnumException;
import com.ryuqq.enumkit.core.exception.DuplicateItemException;
import com.ryuqq.enumkit.core.exception.EnumTypeMismatchException;
import com.ryuqq.enumkit.core.exception.InvalidArgumentTypeException;
import com.ryuqq.enumkit.core.exception.ReservedItemNameException;
import com.ryuqq.enumkit.core.model.EnumItem;
import com.ryuqq.enumkit.core.model.EnumItemFactory;
import com.ryuqq.enumkit.core.model.Enumeration;
import com.ryuqq.enumkit.core.spi.EnumRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * EnumFactory 유닛 테스트.
 *
 * <p>Registry를 Mock으로 대체하여 다음을 검증합니다:</p>
 * <ul>
 *   <li>성공 시 정확히 한 번 등록</li>
 *   <li>검증 순서 (인자 → 중복 Enum → 멤버별 검증)</li>
 *   <li>실패 시 등록 호출 없음 (원자성)</li>
 *   <li>등록 단계의 동시 경합 패배가 DuplicateEnum으로 전달됨</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class EnumFactoryTest {

    @Mock
    private EnumRegistry registry;

    private EnumFactory factory;

    @BeforeEach
    void setUp() {
        factory = new EnumFactory(registry);
    }

    // ============================================================
    // 1. 성공 경로
    // ============================================================

    @Test
    void createEnum_유효한_멤버면_한번_등록하고_반환함() {
        // given
        EnumItem red = EnumItemFactory.createItem("Color", "Red");
        EnumItem blue = EnumItemFactory.createItem("Color", "Blue");

        // when
        Enumeration color = factory.createEnum("Color", List.of(red, blue));

        // then
        ArgumentCaptor<Enumeration> captor = ArgumentCaptor.forClass(Enumeration.class);
        verify(registry).contains("Color");
        verify(registry, times(1)).register(captor.capture());
        assertThat(captor.getValue()).isSameAs(color);
        assertThat(color.getEnumItems()).containsExactly(red, blue);
    }

    @Test
    void createEnum_빈_멤버_목록도_허용함() {
        // when
        Enumeration empty = factory.createEnum("Empty", List.of());

        // then
        verify(registry).register(empty);
        assertThat(empty.size()).isZero();
    }

    // ============================================================
    // 2. 검증 실패 시 등록 없음
    // ============================================================

    @Test
    void createEnum_이미_등록된_이름이면_DuplicateEnum() {
        // given
        when(registry.contains("Color")).thenReturn(true);
        List<EnumItem> items = List.of(EnumItemFactory.createItem("Color", "Red"));

        // when & then
        assertThatThrownBy(() -> factory.createEnum("Color", items))
            .isInstanceOf(DuplicateEnumException.class)
            .hasMessageContaining("Color");
        verify(registry, never()).register(any());
    }

    @Test
    void createEnum_중복_Enum_검사가_멤버_검증보다_먼저임() {
        // given
        when(registry.contains("Color")).thenReturn(true);
        List<EnumItem> items = List.of(EnumItemFactory.createItem("Other", "Name"));

        // when & then
        assertThatThrownBy(() -> factory.createEnum("Color", items))
            .isInstanceOf(DuplicateEnumException.class);
    }

    @Test
    void createEnum_인자가_잘못되면_Registry를_조회하지_않음() {
        // when & then
        assertThatThrownBy(() -> factory.createEnum(null, List.of()))
            .isInstanceOf(InvalidArgumentTypeException.class);
        assertThatThrownBy(() -> factory.createEnum("", List.of()))
            .isInstanceOf(InvalidArgumentTypeException.class);
        assertThatThrownBy(() -> factory.createEnum("Color", null))
            .isInstanceOf(InvalidArgumentTypeException.class);
        assertThatThrownBy(() -> factory.createEnum("Color", Arrays.asList(EnumItemFactory.createItem("Color", "Red"), null)))
            .isInstanceOf(InvalidArgumentTypeException.class)
            .hasMessageContaining("index: 1");

        verify(registry, never()).contains(anyString());
        verify(registry, never()).register(any());
    }

    @Test
    void createEnum_공백_이름과_빈_멤버_이름은_허용함() {
        // given
        List<EnumItem> items = List.of(EnumItemFactory.createItem(" ", ""));

        // when
        Enumeration blank = factory.createEnum(" ", items);

        // then
        verify(registry).register(blank);
        assertThat(blank.getName()).isEqualTo(" ");
        assertThat(blank.get("")).isSameAs(items.get(0));
    }

    @Test
    void createEnum_멤버_이름_중복이면_DuplicateItem() {
        // given
        List<EnumItem> items = List.of(
            EnumItemFactory.createItem("Color", "Red"),
            EnumItemFactory.createItem("Color", "Red")
        );

        // when & then
        assertThatThrownBy(() -> factory.createEnum("Color", items))
            .isInstanceOf(DuplicateItemException.class);
        verify(registry, never()).register(any());
    }

    @Test
    void createEnum_다른_타입의_멤버면_EnumTypeMismatch() {
        // given
        List<EnumItem> items = List.of(EnumItemFactory.createItem("OtherType", "Red"));

        // when & then
        assertThatThrownBy(() -> factory.createEnum("Color", items))
            .isInstanceOf(EnumTypeMismatchException.class);
        verify(registry, never()).register(any());
    }

    @Test
    void createEnum_예약된_멤버_이름이면_ReservedItemName() {
        // given
        List<EnumItem> items = List.of(
            EnumItemFactory.createItem("Color", "Red"),
            EnumItemFactory.createItem("Color", "GetEnumItems")
        );

        // when & then
        assertThatThrownBy(() -> factory.createEnum("Color", items))
            .isInstanceOf(ReservedItemNameException.class)
            .hasMessageContaining("GetEnumItems");
        verify(registry, never()).register(any());
    }

    // ============================================================
    // 3. 등록 단계 경합
    // ============================================================

    @Test
    void createEnum_등록_시점에_선점되면_DuplicateEnum_전파() {
        // given: contains() 확인 이후 다른 스레드가 먼저 등록한 상황
        doThrow(new DuplicateEnumException("enum Color is already registered"))
            .when(registry).register(any());
        List<EnumItem> items = List.of(EnumItemFactory.createItem("Color", "Red"));

        // when & then
        assertThatThrownBy(() -> factory.createEnum("Color", items))
            .isInstanceOf(DuplicateEnumException.class);
    }

    // ============================================================
    // 4. 생성자 검증
    // ============================================================

    @Test
    void constructor_null_의존성이면_예외() {
        // when & then
        assertThatThrownBy(() -> new EnumFactory(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("registry");
        assertThatThrownBy(() -> new EnumFactory(registry, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }

    @Test
    void getConfig_기본값은_INSERTION() {
        // then
        assertThat(factory.getConfig().mappingOrder()).isEqualTo(MappingOrder.INSERTION);
    }
}
