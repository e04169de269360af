package com.zomato.order.controller;

import com.zomato.common.dto.ApiResponse;
import com.zomato.order.dto.OrderPlacementResponse;
import com.zomato.order.dto.OrderResponse;
import com.zomato.order.dto.PlaceOrderRequest;
import com.zomato.order.service.OrderLine;
import com.zomato.order.service.OrderPlacement;
import com.zomato.order.service.OrderService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    /**
     * Places an order. The body is validated first; the total is always
     * computed server-side from current menu prices.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RateLimiter(name = "api")
    public ApiResponse<OrderPlacementResponse> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        List<OrderLine> lines = request.items().stream()
                .map(item -> new OrderLine(item.menuItemId(), item.quantity(), item.specialInstructions()))
                .toList();

        OrderPlacement placement = orderService.placeOrder(
                request.userId(), request.restaurantId(), lines, request.deliveryAddress());

        return ApiResponse.ok(new OrderPlacementResponse(placement.orderId(), placement.totalAmount()),
                "Order created successfully");
    }

    @GetMapping("/{id}")
    @RateLimiter(name = "api")
    public ApiResponse<OrderResponse> getOrder(@PathVariable Long id) {
        return ApiResponse.ok(OrderResponse.from(orderService.getOrder(id)));
    }
}
