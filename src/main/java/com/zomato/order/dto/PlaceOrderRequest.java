package com.zomato.order.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Order placement request. Validated before the order transaction starts.
 *
 * <pre>{@code
 * {
 *   "user_id": 1,
 *   "restaurant_id": 1,
 *   "items": [{"menu_item_id": 1, "quantity": 2, "special_instructions": "extra spicy"}],
 *   "delivery_address": "12 Park Lane"
 * }
 * }</pre>
 */
@Schema(description = "Order placement request")
public record PlaceOrderRequest(
        @Schema(description = "Ordering user", example = "1")
        @NotNull(message = "user_id is required")
        @Positive(message = "user_id must be positive")
        Long userId,

        @Schema(description = "Restaurant the order is placed with", example = "1")
        @NotNull(message = "restaurant_id is required")
        @Positive(message = "restaurant_id must be positive")
        Long restaurantId,

        @Schema(description = "Ordered menu items, at least one")
        @NotEmpty(message = "items must not be empty")
        List<@Valid @NotNull OrderLineRequest> items,

        @Schema(description = "Delivery address", example = "12 Park Lane")
        @NotBlank(message = "delivery_address is required")
        String deliveryAddress
) {

    public static final int MAX_QUANTITY = 1000;

    @Schema(description = "One ordered menu item")
    public record OrderLineRequest(
            @Schema(description = "Menu item id", example = "1")
            @NotNull(message = "menu_item_id is required")
            Long menuItemId,

            @Schema(description = "Quantity, a whole number", example = "2")
            @NotNull(message = "quantity is required")
            @Positive(message = "quantity must be a positive integer")
            @Max(value = MAX_QUANTITY, message = "quantity must be at most " + MAX_QUANTITY)
            Integer quantity,

            @Schema(description = "Free-text note for the kitchen", example = "extra spicy")
            String specialInstructions
    ) {}
}
