package com.zomato.restaurant.repository;

import com.zomato.restaurant.entity.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {

    List<MenuItem> findByRestaurantIdOrderByIdAsc(Long restaurantId);

    /**
     * Current price of a menu item, read inside the caller's transaction.
     * Plain read: no row lock, prices are never reserved or decremented.
     */
    @Query("SELECT m.price FROM MenuItem m WHERE m.id = :id")
    Optional<BigDecimal> findPriceById(@Param("id") Long id);
}
