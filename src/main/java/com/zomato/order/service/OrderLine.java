package com.zomato.order.service;

/**
 * One requested line of an order, already validated at the API boundary.
 */
public record OrderLine(Long menuItemId, int quantity, String specialInstructions) {

    public OrderLine {
        if (menuItemId == null) {
            throw new IllegalArgumentException("menuItemId is required");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
    }
}
