package com.zecinsight.alert;

import java.util.List;

public record AlertSummary(int total, int critical, int warning, int info) {

    public static AlertSummary of(List<Alert> alerts) {
        int critical = 0;
        int warning = 0;
        int info = 0;
        for (Alert a : alerts) {
            switch (a.severity()) {
                case CRITICAL -> critical++;
                case WARNING -> warning++;
                case INFO -> info++;
            }
        }
        return new AlertSummary(alerts.size(), critical, warning, info);
    }
}
