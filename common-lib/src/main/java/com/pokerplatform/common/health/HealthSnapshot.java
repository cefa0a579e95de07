package com.pokerplatform.common.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Result of one monitoring tick. {@code panicStop} is {@code null} while no panic is latched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthSnapshot(
    @JsonProperty("id")        String id,
    @JsonProperty("overall")   HealthState overall,
    @JsonProperty("statuses")  List<HealthStatus> statuses,
    @JsonProperty("safeMode")  SafeModeState safeMode,
    @JsonProperty("panicStop") PanicStopReason panicStop,
    @JsonProperty("issuedAt")  Instant issuedAt
) {
    public HealthSnapshot {
        statuses = statuses == null ? List.of() : List.copyOf(statuses);
    }
}
