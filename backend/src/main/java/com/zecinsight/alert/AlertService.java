package com.zecinsight.alert;

import com.zecinsight.alert.config.AlertProperties;
import com.zecinsight.analytics.ProjectMetricsService;
import com.zecinsight.common.ValidationException;
import com.zecinsight.domain.AlertConfiguration;
import com.zecinsight.domain.AlertConfigurationRepository;
import com.zecinsight.domain.AlertRecord;
import com.zecinsight.domain.AlertRecordRepository;
import com.zecinsight.domain.AlertThresholds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the threshold rules against a project's current metrics and keeps the per-project threshold overrides.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    static final int DEFAULT_HISTORY_LIMIT = 50;
    static final int MAX_HISTORY_LIMIT = 500;

    private final ProjectMetricsService metricsService;
    private final AlertConfigurationRepository configurationRepository;
    private final AlertRecordRepository recordRepository;
    private final AlertProperties properties;

    /**
     * Evaluates and records every alert that fires.
     */
    public AlertReport checkProjectAlerts(String projectId) {
        AlertReport report = evaluateProjectAlerts(projectId);
        List<Alert> all = report.all();
        if (!all.isEmpty()) {
            recordRepository.saveAll(all.stream().map(a -> toRecord(projectId, a)).toList());
            log.info("Project {} raised {} alerts ({} critical)", projectId, all.size(), report.summary().critical());
        }
        return report;
    }

    /** Same evaluation without writing history; used by read-only views. */
    public AlertReport evaluateProjectAlerts(String projectId) {
        metricsService.getProject(projectId);
        AlertThresholds thresholds = getAlertConfiguration(projectId);
        Instant now = Instant.now();

        List<Alert> retention = AlertEngine.checkRetention(
                metricsService.getRetentionCohorts(projectId), thresholds.getRetention(), now);
        List<Alert> churn = AlertEngine.checkChurn(
                metricsService.getChurnSnapshot(projectId), thresholds.getChurn(), now);
        List<Alert> funnel = AlertEngine.checkFunnel(
                metricsService.getAdoptionFunnel(projectId), thresholds.getFunnel(), now);
        List<Alert> shielded = AlertEngine.checkShielded(
                metricsService.getShieldedActivity(projectId, properties.getShieldedWindowDays()),
                thresholds.getShielded(), now);

        List<Alert> all = new ArrayList<>(retention);
        all.addAll(churn);
        all.addAll(funnel);
        all.addAll(shielded);
        return new AlertReport(projectId, retention, churn, funnel, shielded, AlertSummary.of(all), now);
    }

    /** Project override when stored, otherwise the platform defaults. */
    public AlertThresholds getAlertConfiguration(String projectId) {
        return configurationRepository.findByProjectId(projectId)
                .map(AlertConfiguration::getThresholds)
                .orElseGet(properties::toThresholds);
    }

    public AlertThresholds updateAlertConfiguration(String projectId, AlertThresholds thresholds) {
        metricsService.getProject(projectId);
        validate(thresholds);
        AlertConfiguration config = configurationRepository.findByProjectId(projectId).orElseGet(() -> {
            AlertConfiguration c = new AlertConfiguration();
            c.setProjectId(projectId);
            return c;
        });
        config.setThresholds(thresholds.copy());
        config.setUpdatedAt(Instant.now());
        configurationRepository.save(config);
        log.info("Alert thresholds updated for project {}", projectId);
        return config.getThresholds();
    }

    public List<AlertRecord> getAlertHistory(String projectId, Integer limit) {
        int size = limit == null ? DEFAULT_HISTORY_LIMIT : limit;
        if (size < 1 || size > MAX_HISTORY_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        return recordRepository.findByProjectIdOrderByDetectedAtDesc(projectId, PageRequest.of(0, size));
    }

    static void validate(AlertThresholds t) {
        if (t == null || t.getRetention() == null || t.getChurn() == null
                || t.getFunnel() == null || t.getShielded() == null) {
            throw new ValidationException("Thresholds must include retention, churn, funnel and shielded sections");
        }
        percentage("retention.drop_percentage", t.getRetention().getDropPercentage());
        percentage("retention.critical_level", t.getRetention().getCriticalLevel());
        percentage("retention.warning_level", t.getRetention().getWarningLevel());
        percentage("churn.critical_rate", t.getChurn().getCriticalRate());
        percentage("churn.high_risk_percentage", t.getChurn().getHighRiskPercentage());
        percentage("funnel.stage_drop_threshold", t.getFunnel().getStageDropThreshold());
        percentage("funnel.critical_stage_drop", t.getFunnel().getCriticalStageDrop());
        percentage("funnel.critical_conversion", t.getFunnel().getCriticalConversion());
        positive("shielded.spike_multiplier", t.getShielded().getSpikeMultiplier());
        positive("shielded.drop_multiplier", t.getShielded().getDropMultiplier());
        if (t.getShielded().getVolumeThreshold() < 0) {
            throw new ValidationException("shielded.volume_threshold must not be negative");
        }
    }

    private static void percentage(String name, double v) {
        if (v < 0 || v > 100) {
            throw new ValidationException(name + " must be between 0 and 100");
        }
    }

    private static void positive(String name, double v) {
        if (v <= 0) {
            throw new ValidationException(name + " must be greater than 0");
        }
    }

    private static AlertRecord toRecord(String projectId, Alert a) {
        AlertRecord r = new AlertRecord();
        r.setProjectId(projectId);
        r.setType(a.type().getValue());
        r.setSeverity(a.severity().getValue());
        r.setMessage(a.message());
        r.setData(a.data());
        r.setDetectedAt(a.detectedAt());
        return r;
    }
}
