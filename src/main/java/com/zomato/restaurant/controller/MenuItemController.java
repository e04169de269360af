package com.zomato.restaurant.controller;

import com.zomato.common.dto.ApiResponse;
import com.zomato.restaurant.dto.ChangePriceRequest;
import com.zomato.restaurant.dto.MenuItemResponse;
import com.zomato.restaurant.service.MenuItemService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/menu-items")
@RequiredArgsConstructor
public class MenuItemController {

    private final MenuItemService menuItemService;

    @GetMapping("/{id}")
    @RateLimiter(name = "api")
    public ApiResponse<MenuItemResponse> getMenuItem(@PathVariable Long id) {
        return ApiResponse.ok(MenuItemResponse.from(menuItemService.getMenuItem(id)));
    }

    /** Admin: reprice a menu item. Orders already placed keep their captured price. */
    @PatchMapping("/{id}/price")
    @RateLimiter(name = "api")
    public ApiResponse<MenuItemResponse> changePrice(@PathVariable Long id,
                                                     @Valid @RequestBody ChangePriceRequest request) {
        return ApiResponse.ok(menuItemService.changePrice(id, request.price()));
    }
}
