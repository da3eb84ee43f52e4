package com.zecinsight.insight.alertcontent;

import com.zecinsight.alert.AlertReport;
import com.zecinsight.alert.AlertService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
@RequiredArgsConstructor
public class AlertContentService {

    private final AlertService alertService;

    public AlertPackage getEnrichedAlerts(String projectId, AlertContext context) {
        AlertReport report = alertService.checkProjectAlerts(projectId);
        return new AlertPackage(projectId, report.summary(),
                AlertContentGenerator.generateAlertPackages(report.all(), context), Instant.now());
    }
}
