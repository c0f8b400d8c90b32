package com.sitemonitor.service.notify;

import java.util.List;

public record DeliveryReport(List<Delivery> deliveries) {
    public DeliveryReport {
        deliveries = List.copyOf(deliveries);
    }

    public long delivered() {
        return deliveries.stream().filter(d -> d.outcome() != DeliveryOutcome.FAILED).count();
    }

    public long failed() {
        return deliveries.size() - delivered();
    }

    public record Delivery(String recipient, DeliveryOutcome outcome, String error) {
    }
}
