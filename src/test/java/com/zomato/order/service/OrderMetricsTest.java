package com.zomato.order.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class OrderMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final OrderMetrics orderMetrics = new OrderMetrics(registry);

    @Test
    void recordPlaced_CountsAndRecordsAmount() {
        orderMetrics.recordPlaced(new BigDecimal("31.98"));
        orderMetrics.recordPlaced(new BigDecimal("10.00"));

        assertThat(registry.get("orders.placed").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("orders.amount").summary().totalAmount()).isEqualTo(41.98, offset(0.001));
    }

    @Test
    void recordFailed_TagsByReason() {
        orderMetrics.recordFailed("menu_item_not_found");
        orderMetrics.recordFailed("menu_item_not_found");
        orderMetrics.recordFailed("internal_error");

        assertThat(registry.get("orders.failed").tag("reason", "menu_item_not_found").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("orders.failed").tag("reason", "internal_error").counter().count())
                .isEqualTo(1.0);
    }
}
