package com.zomato.order.dto;

import com.zomato.order.entity.Order;
import com.zomato.order.entity.OrderItem;
import com.zomato.order.entity.OrderStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record OrderResponse(
        Long id,
        Long userId,
        Long restaurantId,
        BigDecimal totalAmount,
        OrderStatus status,
        String deliveryAddress,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        List<Item> items
) {

    public record Item(Long id, Long menuItemId, int quantity, BigDecimal price, String specialInstructions) {
        static Item from(OrderItem item) {
            return new Item(item.getId(), item.getMenuItemId(), item.getQuantity(),
                    item.getPrice(), item.getSpecialInstructions());
        }
    }

    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.getId(),
                order.getUserId(),
                order.getRestaurantId(),
                order.getTotalAmount(),
                order.getStatus(),
                order.getDeliveryAddress(),
                order.getCreatedAt(),
                order.getUpdatedAt(),
                order.getItems().stream().map(Item::from).toList());
    }
}
