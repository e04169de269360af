package com.zomato.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes shared by every API endpoint.
 *
 * <p>Each constant carries the HTTP status returned to the client and a default
 * message. {@link GlobalExceptionHandler} turns them into ProblemDetail bodies.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    ROUTE_NOT_FOUND(HttpStatus.NOT_FOUND, "Route not found"),
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests, please try again later"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),

    // Restaurant
    RESTAURANT_NOT_FOUND(HttpStatus.NOT_FOUND, "Restaurant not found"),
    MENU_ITEM_NOT_FOUND(HttpStatus.NOT_FOUND, "Menu item not found"),

    // Order
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found");

    private final HttpStatus status;   // HTTP status sent to the client
    private final String message;      // default detail when no custom message is given
}
