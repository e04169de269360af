package com.zomato.order.service;

import com.zomato.common.exception.BusinessException;
import com.zomato.common.exception.ErrorCode;
import com.zomato.order.entity.Order;
import com.zomato.order.entity.OrderItem;
import com.zomato.order.repository.OrderRepository;
import com.zomato.restaurant.repository.MenuItemRepository;
import com.zomato.restaurant.repository.RestaurantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.List;

/**
 * Order placement and lookup.
 *
 * <p>{@link #placeOrder} runs as one transaction on one pooled connection:
 * <pre>
 *   1. check the restaurant exists
 *   2. read the current price of every requested menu item (unknown id -> MENU_ITEM_NOT_FOUND)
 *   3. total = sum(price * quantity), capped at {@link Order#MAX_TOTAL_AMOUNT}
 *   4. insert the order (status PENDING) and one order item per line,
 *      each carrying the price read in step 2
 *   5. commit
 * </pre>
 * Any exception in steps 1-4 rolls the whole transaction back, so either the
 * order and all its items exist or none of them do. Database failures surface
 * as INTERNAL_ERROR with the original exception as cause.</p>
 *
 * <p>Prices are read without locking: they are never decremented or reserved,
 * and the captured value is the one stored, so a concurrent price change cannot
 * make an item disagree with the order total.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderService {

    static final String COMMIT_FAILED = "commit_failed";

    private final OrderRepository orderRepository;
    private final RestaurantRepository restaurantRepository;
    private final MenuItemRepository menuItemRepository;
    private final OrderMetrics orderMetrics;

    @Transactional
    public OrderPlacement placeOrder(Long userId, Long restaurantId, List<OrderLine> lines,
                                     String deliveryAddress) {
        if (lines == null || lines.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "items must not be empty");
        }
        log.info("Placing order: userId={}, restaurantId={}, lines={}", userId, restaurantId, lines.size());

        try {
            if (!restaurantRepository.existsById(restaurantId)) {
                throw new BusinessException(ErrorCode.RESTAURANT_NOT_FOUND,
                        "Restaurant " + restaurantId + " not found");
            }

            Order order = Order.builder()
                    .userId(userId)
                    .restaurantId(restaurantId)
                    .deliveryAddress(deliveryAddress)
                    .build();

            for (OrderLine line : lines) {
                BigDecimal price = currentPrice(line.menuItemId());
                order.addItem(OrderItem.builder()
                        .menuItemId(line.menuItemId())
                        .quantity(line.quantity())
                        .price(price)
                        .specialInstructions(line.specialInstructions())
                        .build());
            }

            if (order.exceedsMaxTotal()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Order total " + order.getTotalAmount() + " exceeds the maximum of " + Order.MAX_TOTAL_AMOUNT);
            }

            order = orderRepository.saveAndFlush(order);

            recordPlacedOnCommit(order.getTotalAmount());
            log.info("Order placed: orderId={}, total={}", order.getId(), order.getTotalAmount());
            return new OrderPlacement(order.getId(), order.getTotalAmount());
        } catch (BusinessException e) {
            orderMetrics.recordFailed(e.getErrorCode().name().toLowerCase());
            throw e;
        } catch (DataAccessException e) {
            orderMetrics.recordFailed(ErrorCode.INTERNAL_ERROR.name().toLowerCase());
            throw new BusinessException(ErrorCode.INTERNAL_ERROR,
                    "Failed to persist order for user " + userId, e);
        }
    }

    public Order getOrder(Long orderId) {
        return orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND,
                        "Order " + orderId + " not found"));
    }

    private BigDecimal currentPrice(Long menuItemId) {
        return menuItemRepository.findPriceById(menuItemId)
                .orElseThrow(() -> new BusinessException(ErrorCode.MENU_ITEM_NOT_FOUND,
                        "Menu item " + menuItemId + " not found"));
    }

    // counted once the commit has succeeded; a failed commit counts as commit_failed
    private void recordPlacedOnCommit(BigDecimal totalAmount) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            orderMetrics.recordPlaced(totalAmount);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                orderMetrics.recordPlaced(totalAmount);
            }

            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    log.warn("Order commit did not complete: status={}, total={}", status, totalAmount);
                    orderMetrics.recordFailed(COMMIT_FAILED);
                }
            }
        });
    }
}
