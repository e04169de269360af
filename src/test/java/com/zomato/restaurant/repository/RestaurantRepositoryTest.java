package com.zomato.restaurant.repository;

import com.zomato.common.config.JpaConfig;
import com.zomato.restaurant.entity.MenuItem;
import com.zomato.restaurant.entity.Restaurant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Sort;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import(JpaConfig.class)
class RestaurantRepositoryTest {

    private static final Sort BY_RATING = Sort.by(Sort.Order.desc("rating"), Sort.Order.asc("id"));

    @Autowired
    private RestaurantRepository restaurantRepository;
    @Autowired
    private MenuItemRepository menuItemRepository;
    @Autowired
    private TestEntityManager entityManager;

    private Restaurant spiceGarden;
    private Restaurant pizzaPalace;

    @BeforeEach
    void setUp() {
        spiceGarden = Restaurant.builder()
                .name("Spice Garden").cuisine("Indian").rating(new BigDecimal("4.5"))
                .deliveryTime(30).minOrder(new BigDecimal("15.00")).address("123 Main St, Downtown")
                .build();
        spiceGarden.addMenuItem(MenuItem.builder().name("Butter Chicken").price(new BigDecimal("18.99")).build());
        spiceGarden.addMenuItem(MenuItem.builder().name("Paneer Tikka").price(new BigDecimal("16.99")).vegetarian(true).build());

        pizzaPalace = Restaurant.builder()
                .name("Pizza Palace").cuisine("Italian").rating(new BigDecimal("4.2"))
                .deliveryTime(25).minOrder(new BigDecimal("20.00")).address("456 Oak Ave, Midtown")
                .build();

        restaurantRepository.save(pizzaPalace);
        restaurantRepository.save(spiceGarden);
        entityManager.flush();
        entityManager.clear();
    }

    private List<String> search(String query, String cuisine, String minRating, String maxMinOrder) {
        return restaurantRepository.findAll(RestaurantSpecifications.matching(query, cuisine,
                        minRating == null ? null : new BigDecimal(minRating),
                        maxMinOrder == null ? null : new BigDecimal(maxMinOrder)), BY_RATING)
                .stream()
                .map(Restaurant::getName)
                .toList();
    }

    @Test
    @DisplayName("Restaurants are listed best rated first with audit timestamps set")
    void findAllByOrderByRating() {
        List<Restaurant> restaurants = restaurantRepository.findAllByOrderByRatingDescIdAsc();

        assertThat(restaurants).extracting(Restaurant::getName)
                .containsExactly("Spice Garden", "Pizza Palace");
        assertThat(restaurants.get(0).getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Menu items are fetched with the restaurant in id order")
    void findWithMenuItemsById() {
        Restaurant found = restaurantRepository.findWithMenuItemsById(spiceGarden.getId()).orElseThrow();

        assertThat(found.getMenuItems()).extracting(MenuItem::getName)
                .containsExactly("Butter Chicken", "Paneer Tikka");
    }

    @Test
    @DisplayName("Price lookup returns the current price or empty for unknown ids")
    void findPriceById() {
        Long curryId = menuItemRepository.findByRestaurantIdOrderByIdAsc(spiceGarden.getId()).get(0).getId();

        assertThat(menuItemRepository.findPriceById(curryId)).hasValueSatisfying(
                price -> assertThat(price).isEqualByComparingTo("18.99"));
        assertThat(menuItemRepository.findPriceById(999_999L)).isEmpty();
    }

    @Test
    @DisplayName("Text search matches name or address, case-insensitively")
    void search_ByText() {
        assertThat(search("SPICE", null, null, null)).containsExactly("Spice Garden");
        assertThat(search("oak ave", null, null, null)).containsExactly("Pizza Palace");
    }

    @Test
    @DisplayName("Filters combine with AND")
    void search_CombinedFilters() {
        assertThat(search(null, "ital", null, null)).containsExactly("Pizza Palace");
        assertThat(search(null, null, "4.3", null)).containsExactly("Spice Garden");
        assertThat(search(null, null, null, "15")).containsExactly("Spice Garden");
        assertThat(search(null, "italian", "4.3", null)).isEmpty();
    }

    @Test
    @DisplayName("No filters returns everything")
    void search_NoFilters() {
        assertThat(search(null, " ", null, null)).containsExactly("Spice Garden", "Pizza Palace");
    }
}
