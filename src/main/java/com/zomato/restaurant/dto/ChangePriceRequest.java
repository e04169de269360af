package com.zomato.restaurant.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record ChangePriceRequest(
        @NotNull(message = "price is required")
        @Positive(message = "price must be positive")
        @Digits(integer = 8, fraction = 2, message = "price must have at most 2 decimal places")
        BigDecimal price
) {}
