package com.zomato.order.entity;

/**
 * Order lifecycle. Orders are created as {@code PENDING}; later transitions
 * (confirmation, delivery) belong to downstream systems.
 */
public enum OrderStatus {
    PENDING
}
