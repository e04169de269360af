package com.zomato.restaurant.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A priced, orderable dish. {@link #price} is the authoritative price used when
 * an order is placed; order items copy it rather than referencing it.
 */
@Entity
@Table(name = "menu_items", indexes = {
        @Index(name = "idx_menu_item_restaurant", columnList = "restaurant_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class MenuItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "restaurant_id")
    @Setter(AccessLevel.PACKAGE)
    private Restaurant restaurant;

    @Column(nullable = false)
    private String name;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(length = 100)
    private String category;

    @Column(name = "is_vegetarian", nullable = false)
    private boolean vegetarian;

    @Column(name = "is_available", nullable = false)
    private boolean available;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public MenuItem(String name, String description, BigDecimal price, String category,
                    boolean vegetarian, Boolean available) {
        this.name = name;
        this.description = description;
        this.price = price;
        this.category = category;
        this.vegetarian = vegetarian;
        this.available = available == null || available;
    }

    public void changePrice(BigDecimal newPrice) {
        this.price = newPrice;
    }
}
