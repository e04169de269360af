package com.zomato.order.service;

import com.zomato.common.exception.BusinessException;
import com.zomato.common.exception.ErrorCode;
import com.zomato.order.entity.Order;
import com.zomato.order.entity.OrderItem;
import com.zomato.order.entity.OrderStatus;
import com.zomato.order.repository.OrderRepository;
import com.zomato.restaurant.repository.MenuItemRepository;
import com.zomato.restaurant.repository.RestaurantRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderServiceTest {

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private RestaurantRepository restaurantRepository;
    @Mock
    private MenuItemRepository menuItemRepository;
    @Mock
    private OrderMetrics orderMetrics;

    @InjectMocks
    private OrderService orderService;

    private void givenSaveAssignsId(long id) {
        given(orderRepository.saveAndFlush(any(Order.class))).willAnswer(inv -> {
            Order order = inv.getArgument(0);
            ReflectionTestUtils.setField(order, "id", id);
            return order;
        });
    }

    @Test
    @DisplayName("Order total is price x quantity of the current menu price")
    void placeOrder_SingleLine_ComputesTotal() {
        // Given
        given(restaurantRepository.existsById(1L)).willReturn(true);
        given(menuItemRepository.findPriceById(1L)).willReturn(Optional.of(new BigDecimal("15.99")));
        givenSaveAssignsId(10L);

        // When
        OrderPlacement placement = orderService.placeOrder(
                1L, 1L, List.of(new OrderLine(1L, 2, null)), "A");

        // Then
        assertThat(placement.orderId()).isEqualTo(10L);
        assertThat(placement.totalAmount()).isEqualByComparingTo("31.98");
        verify(orderMetrics).recordPlaced(new BigDecimal("31.98"));
    }

    @Test
    @DisplayName("Each order item stores the price read for it, and the status starts as PENDING")
    void placeOrder_MultipleLines_SnapshotsPricePerItem() {
        // Given
        given(restaurantRepository.existsById(1L)).willReturn(true);
        given(menuItemRepository.findPriceById(1L)).willReturn(Optional.of(new BigDecimal("18.99")));
        given(menuItemRepository.findPriceById(2L)).willReturn(Optional.of(new BigDecimal("16.99")));
        givenSaveAssignsId(11L);

        // When
        OrderPlacement placement = orderService.placeOrder(1L, 1L, List.of(
                new OrderLine(1L, 1, "no onions"),
                new OrderLine(2L, 3, null)), "12 Park Lane");

        // Then
        ArgumentCaptor<Order> captor = ArgumentCaptor.forClass(Order.class);
        verify(orderRepository).saveAndFlush(captor.capture());
        Order saved = captor.getValue();

        assertThat(saved.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(saved.getUserId()).isEqualTo(1L);
        assertThat(saved.getRestaurantId()).isEqualTo(1L);
        assertThat(saved.getDeliveryAddress()).isEqualTo("12 Park Lane");
        assertThat(saved.getItems())
                .extracting(OrderItem::getMenuItemId, OrderItem::getQuantity, OrderItem::getPrice,
                        OrderItem::getSpecialInstructions)
                .containsExactly(
                        tuple(1L, 1, new BigDecimal("18.99"), "no onions"),
                        tuple(2L, 3, new BigDecimal("16.99"), null));
        // 18.99 + 3 * 16.99
        assertThat(placement.totalAmount()).isEqualByComparingTo("69.96");
    }

    @Test
    @DisplayName("Each menu item price is read exactly once")
    void placeOrder_ReadsEachPriceOnce() {
        given(restaurantRepository.existsById(1L)).willReturn(true);
        given(menuItemRepository.findPriceById(1L)).willReturn(Optional.of(new BigDecimal("10.00")));
        givenSaveAssignsId(12L);

        orderService.placeOrder(1L, 1L, List.of(new OrderLine(1L, 4, null)), "A");

        verify(menuItemRepository, times(1)).findPriceById(1L);
        verifyNoMoreInteractions(menuItemRepository);
    }

    @Test
    @DisplayName("Unknown menu item fails with MENU_ITEM_NOT_FOUND and nothing is saved")
    void placeOrder_UnknownMenuItem_ThrowsNotFound() {
        // Given
        given(restaurantRepository.existsById(1L)).willReturn(true);
        given(menuItemRepository.findPriceById(1L)).willReturn(Optional.of(new BigDecimal("15.99")));
        given(menuItemRepository.findPriceById(999L)).willReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> orderService.placeOrder(1L, 1L, List.of(
                new OrderLine(1L, 1, null),
                new OrderLine(999L, 1, null)), "A"))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("999")
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.MENU_ITEM_NOT_FOUND));

        verify(orderRepository, never()).saveAndFlush(any());
        verify(orderMetrics).recordFailed("menu_item_not_found");
    }

    @Test
    @DisplayName("Unknown restaurant fails before any price is read")
    void placeOrder_UnknownRestaurant_ThrowsNotFound() {
        given(restaurantRepository.existsById(42L)).willReturn(false);

        assertThatThrownBy(() -> orderService.placeOrder(
                1L, 42L, List.of(new OrderLine(1L, 1, null)), "A"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.RESTAURANT_NOT_FOUND));

        verifyNoInteractions(menuItemRepository);
        verify(orderRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("A database failure while saving surfaces as INTERNAL_ERROR with the cause attached")
    void placeOrder_PersistenceFailure_ThrowsInternalError() {
        // Given
        given(restaurantRepository.existsById(1L)).willReturn(true);
        given(menuItemRepository.findPriceById(1L)).willReturn(Optional.of(new BigDecimal("15.99")));
        DataIntegrityViolationException dbError = new DataIntegrityViolationException("constraint violated");
        given(orderRepository.saveAndFlush(any(Order.class))).willThrow(dbError);

        // When & Then
        assertThatThrownBy(() -> orderService.placeOrder(
                1L, 1L, List.of(new OrderLine(1L, 1, null)), "A"))
                .isInstanceOf(BusinessException.class)
                .hasCause(dbError)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INTERNAL_ERROR));

        verify(orderMetrics).recordFailed("internal_error");
        verify(orderMetrics, never()).recordPlaced(any());
    }

    @Test
    @DisplayName("A total above the column maximum fails with INVALID_INPUT and nothing is saved")
    void placeOrder_TotalAboveMaximum_ThrowsInvalidInput() {
        given(restaurantRepository.existsById(1L)).willReturn(true);
        given(menuItemRepository.findPriceById(1L)).willReturn(Optional.of(new BigDecimal("99999999.99")));

        assertThatThrownBy(() -> orderService.placeOrder(
                1L, 1L, List.of(new OrderLine(1L, 2, null)), "A"))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("exceeds the maximum")
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT));

        verify(orderRepository, never()).saveAndFlush(any());
        verify(orderMetrics).recordFailed("invalid_input");
    }

    @Test
    @DisplayName("Inside a transaction the placement is counted only after commit")
    void placeOrder_InTransaction_CountsAfterCommit() {
        given(restaurantRepository.existsById(1L)).willReturn(true);
        given(menuItemRepository.findPriceById(1L)).willReturn(Optional.of(new BigDecimal("15.99")));
        givenSaveAssignsId(13L);

        TransactionSynchronizationManager.initSynchronization();
        try {
            orderService.placeOrder(1L, 1L, List.of(new OrderLine(1L, 2, null)), "A");
            verify(orderMetrics, never()).recordPlaced(any());

            List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
            synchronizations.forEach(TransactionSynchronization::afterCommit);
            synchronizations.forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        verify(orderMetrics).recordPlaced(new BigDecimal("31.98"));
        verify(orderMetrics, never()).recordFailed(any());
    }

    @Test
    @DisplayName("A failed commit is counted as commit_failed, never as placed")
    void placeOrder_CommitFails_CountsFailure() {
        given(restaurantRepository.existsById(1L)).willReturn(true);
        given(menuItemRepository.findPriceById(1L)).willReturn(Optional.of(new BigDecimal("15.99")));
        givenSaveAssignsId(14L);

        TransactionSynchronizationManager.initSynchronization();
        try {
            orderService.placeOrder(1L, 1L, List.of(new OrderLine(1L, 1, null)), "A");
            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        verify(orderMetrics, never()).recordPlaced(any());
        verify(orderMetrics).recordFailed(OrderService.COMMIT_FAILED);
    }

    @Test
    @DisplayName("Empty item list is rejected without touching the database")
    void placeOrder_EmptyItems_ThrowsInvalidInput() {
        assertThatThrownBy(() -> orderService.placeOrder(1L, 1L, List.of(), "A"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT));

        verifyNoInteractions(restaurantRepository, menuItemRepository, orderRepository);
    }

    @Test
    @DisplayName("Order line rejects non-positive quantity")
    void orderLine_NonPositiveQuantity_Rejected() {
        assertThatThrownBy(() -> new OrderLine(1L, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Unknown order id fails with ORDER_NOT_FOUND")
    void getOrder_Unknown_ThrowsNotFound() {
        given(orderRepository.findWithItemsById(5L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> orderService.getOrder(5L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.ORDER_NOT_FOUND));
    }
}
