package com.exohunt.inference;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports which model the service is loaded with.
 */
@Component("inference")
public class InferenceHealthIndicator implements HealthIndicator {

    private final InferenceContext context;

    public InferenceHealthIndicator(InferenceContext context) {
        this.context = context;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("modelVersion", context.modelVersion())
                .withDetail("features", context.scaler().featureCount())
                .withDetail("sequenceLength", context.sequenceLength())
                .build();
    }
}
