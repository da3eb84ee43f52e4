package com.zecinsight.task;

import java.time.Instant;
import java.util.List;

public record MonitoringSummary(
        int totalMonitored,
        int completed,
        int stillPending,
        int errors,
        List<TaskStatusReport> details,
        Instant monitoredAt
) {

    static MonitoringSummary of(List<TaskStatusReport> reports) {
        int completed = 0;
        int errors = 0;
        for (TaskStatusReport r : reports) {
            if (r.error() != null) {
                errors++;
            } else if (r.isCompleted()) {
                completed++;
            }
        }
        return new MonitoringSummary(reports.size(), completed, reports.size() - completed - errors, errors,
                reports, Instant.now());
    }
}
