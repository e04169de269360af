package com.zomato.order.repository;

import com.zomato.order.entity.Order;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    // items fetched with the order (LEFT JOIN) so the response can be built outside the transaction
    @EntityGraph(attributePaths = {"items"})
    Optional<Order> findWithItemsById(Long id);
}
