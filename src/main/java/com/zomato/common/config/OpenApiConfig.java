package com.zomato.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document at /v3/api-docs, Swagger UI at /api-docs.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI zomatoOpenApi() {
        return new OpenAPI().info(new Info()
                .title("Zomato API")
                .version("1.0.0")
                .description("Restaurants, menus and order placement"));
    }
}
