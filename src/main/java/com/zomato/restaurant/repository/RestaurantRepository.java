package com.zomato.restaurant.repository;

import com.zomato.restaurant.entity.Restaurant;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;
import java.util.Optional;

public interface RestaurantRepository extends JpaRepository<Restaurant, Long>,
        JpaSpecificationExecutor<Restaurant> {

    List<Restaurant> findAllByOrderByRatingDescIdAsc();

    /**
     * Fetches the menu in the same query (LEFT JOIN) so the detail view
     * doesn't issue one select per menu item.
     */
    @EntityGraph(attributePaths = {"menuItems"})
    Optional<Restaurant> findWithMenuItemsById(Long id);
}
