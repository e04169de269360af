package com.zomato.restaurant.controller;

import com.zomato.common.dto.ApiResponse;
import com.zomato.restaurant.dto.RestaurantDetail;
import com.zomato.restaurant.dto.RestaurantSummary;
import com.zomato.restaurant.service.RestaurantService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

/**
 * Restaurant catalog API.
 *
 * <ul>
 *   <li>GET /api/restaurants : all restaurants, best rated first</li>
 *   <li>GET /api/restaurants/{id} : one restaurant with its menu</li>
 *   <li>GET /api/search : filter by text, cuisine, minimum rating, maximum minimum order</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RestaurantController {

    private final RestaurantService restaurantService;

    @GetMapping("/restaurants")
    @RateLimiter(name = "api")
    public ApiResponse<List<RestaurantSummary>> getRestaurants() {
        return ApiResponse.ok(restaurantService.getRestaurants());
    }

    @GetMapping("/restaurants/{id}")
    @RateLimiter(name = "api")
    public ApiResponse<RestaurantDetail> getRestaurant(@PathVariable Long id) {
        return ApiResponse.ok(restaurantService.getRestaurantWithMenu(id));
    }

    // max_price filters on the restaurant's minimum order amount
    @GetMapping("/search")
    @RateLimiter(name = "api")
    public ApiResponse<List<RestaurantSummary>> search(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) String cuisine,
            @RequestParam(name = "min_rating", required = false) BigDecimal minRating,
            @RequestParam(name = "max_price", required = false) BigDecimal maxPrice) {
        return ApiResponse.ok(restaurantService.search(query, cuisine, minRating, maxPrice));
    }
}
