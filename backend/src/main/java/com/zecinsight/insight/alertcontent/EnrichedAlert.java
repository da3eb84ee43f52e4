package com.zecinsight.insight.alertcontent;

import com.zecinsight.alert.Alert;
import com.zecinsight.alert.AlertSeverity;
import com.zecinsight.alert.AlertType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record EnrichedAlert(
        AlertType type,
        AlertSeverity severity,
        String title,
        String message,
        Map<String, Object> data,
        Instant detectedAt,
        List<Suggestion> aiSuggestions,
        List<ActionItem> actionItems,
        Urgency urgency,
        int priorityScore,
        ImpactEstimate estimatedImpact,
        ResolutionTimeline timeline
) {

    static EnrichedAlert of(Alert a, List<Suggestion> suggestions, List<ActionItem> actions, Urgency urgency,
                            int priorityScore, ImpactEstimate impact, ResolutionTimeline timeline) {
        return new EnrichedAlert(a.type(), a.severity(), a.title(), a.message(), a.data(), a.detectedAt(),
                suggestions, actions, urgency, priorityScore, impact, timeline);
    }
}
