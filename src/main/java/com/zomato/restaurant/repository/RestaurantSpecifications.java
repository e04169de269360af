package com.zomato.restaurant.repository;

import com.zomato.restaurant.entity.Restaurant;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Search filters for restaurants. Each filter is optional; present filters are
 * combined with AND.
 */
public final class RestaurantSpecifications {

    private RestaurantSpecifications() {
    }

    public static Specification<Restaurant> matching(String query, String cuisine,
                                                     BigDecimal minRating, BigDecimal maxMinOrder) {
        List<Specification<Restaurant>> filters = new ArrayList<>();
        if (hasText(query)) {
            filters.add(nameOrAddressContains(query));
        }
        if (hasText(cuisine)) {
            filters.add(cuisineContains(cuisine));
        }
        if (minRating != null) {
            filters.add(ratingAtLeast(minRating));
        }
        if (maxMinOrder != null) {
            filters.add(minOrderAtMost(maxMinOrder));
        }
        return Specification.allOf(filters);
    }

    public static Specification<Restaurant> nameOrAddressContains(String query) {
        String pattern = likePattern(query);
        return (root, cq, cb) -> cb.or(
                cb.like(cb.lower(root.get("name")), pattern),
                cb.like(cb.lower(root.get("address")), pattern));
    }

    public static Specification<Restaurant> cuisineContains(String cuisine) {
        String pattern = likePattern(cuisine);
        return (root, cq, cb) -> cb.like(cb.lower(root.get("cuisine")), pattern);
    }

    public static Specification<Restaurant> ratingAtLeast(BigDecimal minRating) {
        return (root, cq, cb) -> cb.greaterThanOrEqualTo(root.get("rating"), minRating);
    }

    public static Specification<Restaurant> minOrderAtMost(BigDecimal maxMinOrder) {
        return (root, cq, cb) -> cb.lessThanOrEqualTo(root.get("minOrder"), maxMinOrder);
    }

    private static String likePattern(String value) {
        return "%" + value.trim().toLowerCase(Locale.ROOT) + "%";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
