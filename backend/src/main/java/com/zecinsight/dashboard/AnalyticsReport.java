package com.zecinsight.dashboard;

import java.time.Instant;

/**
 * Exported report. data is the {@link ProjectDashboard} for json and the rendered text table for csv.
 */
public record AnalyticsReport(ExportFormat format, Object data, Instant exportedAt) {
}
