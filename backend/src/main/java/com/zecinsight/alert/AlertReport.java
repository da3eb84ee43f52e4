package com.zecinsight.alert;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record AlertReport(
        String projectId,
        List<Alert> retentionAlerts,
        List<Alert> churnAlerts,
        List<Alert> funnelAlerts,
        List<Alert> shieldedAlerts,
        AlertSummary summary,
        Instant checkedAt
) {

    @JsonIgnore
    public List<Alert> all() {
        List<Alert> all = new ArrayList<>(retentionAlerts);
        all.addAll(churnAlerts);
        all.addAll(funnelAlerts);
        all.addAll(shieldedAlerts);
        return all;
    }
}
