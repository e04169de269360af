package com.zomato.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Enables JPA auditing so {@code @CreatedDate} and {@code @LastModifiedDate}
 * fields on Restaurant, MenuItem and Order are filled on persist and update.
 *
 * <p>Kept out of the application class so web-slice tests can start without JPA.</p>
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
