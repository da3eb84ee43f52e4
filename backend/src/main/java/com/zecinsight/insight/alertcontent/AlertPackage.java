package com.zecinsight.insight.alertcontent;

import com.zecinsight.alert.AlertSummary;

import java.time.Instant;
import java.util.List;

/**
 * Enriched alerts of a project, highest priority score first.
 */
public record AlertPackage(String projectId, AlertSummary summary, List<EnrichedAlert> alerts, Instant generatedAt) {
}
