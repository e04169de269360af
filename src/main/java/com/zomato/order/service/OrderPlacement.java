package com.zomato.order.service;

import java.math.BigDecimal;

/** Result of a committed order placement. */
public record OrderPlacement(Long orderId, BigDecimal totalAmount) {
}
