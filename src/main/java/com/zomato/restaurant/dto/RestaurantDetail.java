package com.zomato.restaurant.dto;

import com.zomato.restaurant.entity.Restaurant;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record RestaurantDetail(
        Long id,
        String name,
        String cuisine,
        BigDecimal rating,
        Integer deliveryTime,
        BigDecimal minOrder,
        String address,
        String phone,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        List<MenuItemResponse> menu
) {
    /** Must be called while the menu collection is loaded (inside the read transaction). */
    public static RestaurantDetail from(Restaurant restaurant) {
        List<MenuItemResponse> menu = restaurant.getMenuItems().stream()
                .map(MenuItemResponse::from)
                .toList();
        return new RestaurantDetail(
                restaurant.getId(),
                restaurant.getName(),
                restaurant.getCuisine(),
                restaurant.getRating(),
                restaurant.getDeliveryTime(),
                restaurant.getMinOrder(),
                restaurant.getAddress(),
                restaurant.getPhone(),
                restaurant.getCreatedAt(),
                restaurant.getUpdatedAt(),
                menu);
    }
}
