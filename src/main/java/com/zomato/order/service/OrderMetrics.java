package com.zomato.order.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Order placement meters, exported at /metrics:
 * <pre>
 *   orders_placed_total          committed placements
 *   orders_failed_total{reason}  rejected, rolled back or commit_failed placements
 *   orders_amount                distribution of order totals
 * </pre>
 */
@Component
public class OrderMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter placed;
    private final DistributionSummary amount;

    public OrderMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.placed = Counter.builder("orders.placed")
                .description("Orders committed")
                .register(meterRegistry);
        this.amount = DistributionSummary.builder("orders.amount")
                .description("Order total amount")
                .register(meterRegistry);
    }

    public void recordPlaced(BigDecimal totalAmount) {
        placed.increment();
        amount.record(totalAmount.doubleValue());
    }

    public void recordFailed(String reason) {
        Counter.builder("orders.failed")
                .description("Order placements rolled back")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }
}
