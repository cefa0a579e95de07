package com.pokerplatform.common.consistency;

import java.util.List;

/**
 * Violations found when a frame was compared with the previous frame of the same hand.
 * An empty list means the frame is consistent (or is the first frame of its hand).
 */
public record ConsistencyReport(
    String handId,
    List<String> violations
) {
    public ConsistencyReport {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ConsistencyReport clean(String handId) {
        return new ConsistencyReport(handId, List.of());
    }

    public boolean consistent() {
        return violations.isEmpty();
    }
}
