package com.zomato.restaurant.seed;

import com.zomato.restaurant.entity.MenuItem;
import com.zomato.restaurant.entity.Restaurant;
import com.zomato.restaurant.repository.RestaurantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Seeds two demo restaurants with their menus on an empty database.
 * Disable with {@code zomato.sample-data.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "zomato.sample-data.enabled", havingValue = "true", matchIfMissing = true)
public class SampleDataInitializer implements CommandLineRunner {

    private final RestaurantRepository restaurantRepository;

    @Override
    @Transactional
    public void run(String... args) {
        if (restaurantRepository.count() > 0) {
            log.debug("Restaurants already present, skipping sample data");
            return;
        }

        Restaurant spiceGarden = Restaurant.builder()
                .name("Spice Garden")
                .cuisine("Indian")
                .rating(new BigDecimal("4.5"))
                .deliveryTime(30)
                .minOrder(new BigDecimal("15.00"))
                .address("123 Main St, Downtown")
                .phone("+1-555-0101")
                .build();
        spiceGarden.addMenuItem(menuItem("Butter Chicken",
                "Creamy tomato-based curry with tender chicken", "18.99", "Main Course", false));
        spiceGarden.addMenuItem(menuItem("Paneer Tikka",
                "Grilled cottage cheese with Indian spices", "16.99", "Appetizer", true));

        Restaurant pizzaPalace = Restaurant.builder()
                .name("Pizza Palace")
                .cuisine("Italian")
                .rating(new BigDecimal("4.2"))
                .deliveryTime(25)
                .minOrder(new BigDecimal("20.00"))
                .address("456 Oak Ave, Midtown")
                .phone("+1-555-0102")
                .build();
        pizzaPalace.addMenuItem(menuItem("Margherita Pizza",
                "Classic tomato and mozzarella pizza", "22.99", "Pizza", true));
        pizzaPalace.addMenuItem(menuItem("Chicken Alfredo",
                "Creamy pasta with grilled chicken", "24.99", "Pasta", false));

        restaurantRepository.save(spiceGarden);
        restaurantRepository.save(pizzaPalace);
        log.info("Sample data inserted: 2 restaurants, 4 menu items");
    }

    private MenuItem menuItem(String name, String description, String price,
                              String category, boolean vegetarian) {
        return MenuItem.builder()
                .name(name)
                .description(description)
                .price(new BigDecimal(price))
                .category(category)
                .vegetarian(vegetarian)
                .available(true)
                .build();
    }
}
