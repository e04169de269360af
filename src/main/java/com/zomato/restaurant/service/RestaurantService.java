package com.zomato.restaurant.service;

import com.zomato.common.config.CacheConfig;
import com.zomato.common.exception.BusinessException;
import com.zomato.common.exception.ErrorCode;
import com.zomato.restaurant.dto.RestaurantDetail;
import com.zomato.restaurant.dto.RestaurantSummary;
import com.zomato.restaurant.repository.RestaurantRepository;
import com.zomato.restaurant.repository.RestaurantSpecifications;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read side of the restaurant catalog.
 *
 * <p>The list and detail views are cached in Redis (see {@link CacheConfig});
 * restaurants only change through the seed path, so a TTL is enough. Search
 * results are not cached because the parameter space is open-ended.</p>
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RestaurantService {

    private static final Sort BY_RATING = Sort.by(Sort.Order.desc("rating"), Sort.Order.asc("id"));

    private final RestaurantRepository restaurantRepository;

    @Cacheable(value = CacheConfig.RESTAURANTS, key = "'all'")
    public List<RestaurantSummary> getRestaurants() {
        return restaurantRepository.findAllByOrderByRatingDescIdAsc().stream()
                .map(RestaurantSummary::from)
                .toList();
    }

    @Cacheable(value = CacheConfig.RESTAURANT_MENUS, key = "#id")
    public RestaurantDetail getRestaurantWithMenu(Long id) {
        return restaurantRepository.findWithMenuItemsById(id)
                .map(RestaurantDetail::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.RESTAURANT_NOT_FOUND));
    }

    public List<RestaurantSummary> search(String query, String cuisine,
                                          BigDecimal minRating, BigDecimal maxMinOrder) {
        return restaurantRepository.findAll(
                        RestaurantSpecifications.matching(query, cuisine, minRating, maxMinOrder), BY_RATING)
                .stream()
                .map(RestaurantSummary::from)
                .toList();
    }
}
