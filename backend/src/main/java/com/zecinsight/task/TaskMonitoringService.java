package com.zecinsight.task;

import com.zecinsight.common.NotFoundException;
import com.zecinsight.domain.MetricSnapshot;
import com.zecinsight.domain.Recommendation;
import com.zecinsight.domain.RecommendationRepository;
import com.zecinsight.domain.RecommendationStatus;
import com.zecinsight.domain.RecommendationTask;
import com.zecinsight.domain.RecommendationTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens a task for each stored recommendation and closes it once enough completion indicators are met.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskMonitoringService {

    private final RecommendationRepository recommendationRepository;
    private final RecommendationTaskRepository taskRepository;
    private final MetricSnapshotService snapshotService;

    /** Creates the pending task for a saved recommendation, with the current metrics as baseline. */
    public RecommendationTask createTask(Recommendation recommendation) {
        RecommendationTask task = new RecommendationTask();
        task.setRecommendationId(recommendation.getId());
        task.setWalletId(recommendation.getWalletId());
        task.setProjectId(recommendation.getProjectId());
        task.setRecommendationType(recommendation.getType());
        task.setBaseline(snapshotService.capture(recommendation.getWalletId(), recommendation.getProjectId()));
        task.setCreatedAt(Instant.now());
        RecommendationTask saved = taskRepository.save(task);
        recommendation.setTaskId(saved.getId());
        recommendationRepository.save(recommendation);
        return saved;
    }

    public TaskStatusReport monitorTask(String recommendationId) {
        Recommendation rec = recommendationRepository.findById(recommendationId)
                .orElseThrow(() -> new NotFoundException("Recommendation not found: " + recommendationId));
        RecommendationTask task = taskRepository.findByRecommendationId(recommendationId)
                .orElseGet(() -> createTask(rec));

        MetricSnapshot current = snapshotService.capture(rec.getWalletId(), rec.getProjectId());
        CompletionStatus status = TaskCompletionMonitor.checkCompletionIndicators(
                rec.getCompletionIndicators(), task.getBaseline(), current, LocalDate.now(ZoneOffset.UTC));

        Instant now = Instant.now();
        task.setCompletionPercentage(status.completionPercentage());
        task.setLastCheckedAt(now);
        Effectiveness effectiveness = null;
        if (status.isCompleted() && task.getStatus() != RecommendationStatus.COMPLETED) {
            effectiveness = TaskCompletionMonitor.calculateEffectiveness(task.getBaseline(), current, rec.getType());
            task.setStatus(RecommendationStatus.COMPLETED);
            task.setEffectivenessScore(effectiveness.score());
            task.setEffectivenessLevel(effectiveness.level());
            task.setCompletedAt(now);
            rec.setStatus(RecommendationStatus.COMPLETED);
            rec.setCompletedAt(now);
            recommendationRepository.save(rec);
            log.info("Recommendation {} completed, effectiveness {} ({})",
                    recommendationId, effectiveness.score(), effectiveness.level().getValue());
        }
        taskRepository.save(task);
        return new TaskStatusReport(recommendationId, status.isCompleted(), status.completionPercentage(),
                status.indicatorsMet(), status.indicatorsPending(), effectiveness, current, now, null);
    }

    public MonitoringSummary monitorWalletRecommendations(String walletId) {
        return monitorAll(taskRepository.findByWalletIdAndStatus(walletId, RecommendationStatus.PENDING));
    }

    public MonitoringSummary monitorProjectRecommendations(String projectId) {
        return monitorAll(taskRepository.findByProjectIdAndStatus(projectId, RecommendationStatus.PENDING));
    }

    /** Recaptures the baseline of a recommendation's task, creating the task if it does not exist yet. */
    public MetricSnapshot setBaselineMetrics(String recommendationId) {
        Recommendation rec = recommendationRepository.findById(recommendationId)
                .orElseThrow(() -> new NotFoundException("Recommendation not found: " + recommendationId));
        RecommendationTask task = taskRepository.findByRecommendationId(recommendationId).orElse(null);
        if (task == null) {
            return createTask(rec).getBaseline();
        }
        task.setBaseline(snapshotService.capture(rec.getWalletId(), rec.getProjectId()));
        taskRepository.save(task);
        return task.getBaseline();
    }

    public MonitoringSummary runPeriodicMonitoring() {
        List<RecommendationTask> pending = taskRepository.findByStatus(RecommendationStatus.PENDING);
        log.info("Monitoring {} pending recommendation tasks", pending.size());
        MonitoringSummary summary = monitorAll(pending);
        log.info("Task monitoring done: {} completed, {} pending, {} errors",
                summary.completed(), summary.stillPending(), summary.errors());
        return summary;
    }

    private MonitoringSummary monitorAll(List<RecommendationTask> tasks) {
        List<TaskStatusReport> reports = new ArrayList<>(tasks.size());
        for (RecommendationTask task : tasks) {
            try {
                reports.add(monitorTask(task.getRecommendationId()));
            } catch (RuntimeException e) {
                log.warn("Monitoring recommendation {} failed: {}", task.getRecommendationId(), e.getMessage());
                reports.add(TaskStatusReport.failed(task.getRecommendationId(), e.getMessage()));
            }
        }
        return MonitoringSummary.of(reports);
    }
}
