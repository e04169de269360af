package com.zomato.restaurant.dto;

import com.zomato.restaurant.entity.Restaurant;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Restaurant row as returned by the list and search endpoints (no menu).
 */
public record RestaurantSummary(
        Long id,
        String name,
        String cuisine,
        BigDecimal rating,
        Integer deliveryTime,
        BigDecimal minOrder,
        String address,
        String phone,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static RestaurantSummary from(Restaurant restaurant) {
        return new RestaurantSummary(
                restaurant.getId(),
                restaurant.getName(),
                restaurant.getCuisine(),
                restaurant.getRating(),
                restaurant.getDeliveryTime(),
                restaurant.getMinOrder(),
                restaurant.getAddress(),
                restaurant.getPhone(),
                restaurant.getCreatedAt(),
                restaurant.getUpdatedAt());
    }
}
