package com.pokerplatform.common.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Verdict of one health check on one monitoring tick.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthStatus(
    @JsonProperty("component")           String component,
    @JsonProperty("state")               HealthState state,
    @JsonProperty("checkedAt")           Instant checkedAt,
    @JsonProperty("details")             String details,
    @JsonProperty("metrics")             Map<String, Double> metrics,
    @JsonProperty("consecutiveFailures") int consecutiveFailures
) {
    public HealthStatus {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static HealthStatus healthy(String component, Instant checkedAt) {
        return new HealthStatus(component, HealthState.HEALTHY, checkedAt, null, Map.of(), 0);
    }

    /** Status recorded when the check itself threw. */
    public static HealthStatus checkFailed(String component, Instant checkedAt, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new HealthStatus(component, HealthState.FAILED, checkedAt, message, Map.of(), 1);
    }

    public HealthStatus withDefaults(String fallbackComponent, Instant fallbackCheckedAt) {
        return new HealthStatus(
            component != null ? component : fallbackComponent,
            state != null ? state : HealthState.FAILED,
            checkedAt != null ? checkedAt : fallbackCheckedAt,
            details, metrics, consecutiveFailures);
    }
}
