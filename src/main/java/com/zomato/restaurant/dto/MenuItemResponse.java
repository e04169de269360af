package com.zomato.restaurant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.zomato.restaurant.entity.MenuItem;

import java.math.BigDecimal;

public record MenuItemResponse(
        Long id,
        String name,
        String description,
        BigDecimal price,
        String category,
        @JsonProperty("is_vegetarian") boolean vegetarian,
        @JsonProperty("is_available") boolean available
) {
    public static MenuItemResponse from(MenuItem menuItem) {
        return new MenuItemResponse(
                menuItem.getId(),
                menuItem.getName(),
                menuItem.getDescription(),
                menuItem.getPrice(),
                menuItem.getCategory(),
                menuItem.isVegetarian(),
                menuItem.isAvailable());
    }
}
