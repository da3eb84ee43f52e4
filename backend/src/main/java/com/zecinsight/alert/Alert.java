package com.zecinsight.alert;

import java.time.Instant;
import java.util.Map;

/**
 * A triggered threshold alert. {@code data} keys are snake_case wire names.
 */
public record Alert(
        AlertType type,
        AlertSeverity severity,
        String title,
        String message,
        Map<String, Object> data,
        Instant detectedAt
) {
}
