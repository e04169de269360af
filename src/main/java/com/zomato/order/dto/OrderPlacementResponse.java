package com.zomato.order.dto;

import java.math.BigDecimal;

public record OrderPlacementResponse(Long orderId, BigDecimal totalAmount) {
}
