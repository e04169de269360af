package com.zomato.common.config;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.zomato.restaurant.dto.RestaurantDetail;
import com.zomato.restaurant.dto.RestaurantSummary;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.cache.RedisCacheManagerBuilderCustomizer;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;

import java.time.Duration;
import java.util.List;

/**
 * Redis cache configuration for the read-only catalog endpoints.
 *
 * <p>Two caches, both with a TTL (default 300 seconds):
 * <ul>
 *   <li>{@value #RESTAURANTS}: the rating-ordered restaurant list</li>
 *   <li>{@value #RESTAURANT_MENUS}: one restaurant with its menu, keyed by restaurant id</li>
 * </ul>
 * Each cache gets a serializer bound to its value type so cached records come
 * back as records rather than maps. Only applied when {@code spring.cache.type=redis}.</p>
 *
 * <p>Cache errors never fail a request: see {@link FallbackCacheErrorHandler}.</p>
 */
@Configuration
public class CacheConfig implements CachingConfigurer {

    public static final String RESTAURANTS = "restaurants";
    public static final String RESTAURANT_MENUS = "restaurantMenus";

    @Override
    public CacheErrorHandler errorHandler() {
        return new FallbackCacheErrorHandler();
    }

    @Bean
    public RedisCacheManagerBuilderCustomizer redisCacheManagerCustomizer(
            ObjectMapper objectMapper,
            @Value("${zomato.cache.ttl:300s}") Duration ttl) {
        TypeFactory typeFactory = objectMapper.getTypeFactory();
        JavaType restaurantList = typeFactory.constructCollectionType(List.class, RestaurantSummary.class);
        JavaType restaurantDetail = typeFactory.constructType(RestaurantDetail.class);

        return builder -> builder
                .withCacheConfiguration(RESTAURANTS, cacheConfiguration(objectMapper, restaurantList, ttl))
                .withCacheConfiguration(RESTAURANT_MENUS, cacheConfiguration(objectMapper, restaurantDetail, ttl));
    }

    private RedisCacheConfiguration cacheConfiguration(ObjectMapper objectMapper, JavaType valueType, Duration ttl) {
        Jackson2JsonRedisSerializer<Object> serializer = new Jackson2JsonRedisSerializer<>(objectMapper, valueType);
        return RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(ttl)
                .disableCachingNullValues()
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(serializer));
    }
}
