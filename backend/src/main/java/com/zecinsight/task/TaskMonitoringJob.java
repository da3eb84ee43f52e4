package com.zecinsight.task;

import com.zecinsight.config.AsyncConfig;
import com.zecinsight.task.config.TaskMonitoringProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic sweep over pending tasks. Runs on the monitoring pool; a sweep still in flight skips the next tick.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskMonitoringJob {

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final TaskMonitoringService taskMonitoringService;
    private final TaskMonitoringProperties properties;
    @Qualifier(AsyncConfig.MONITORING_EXECUTOR)
    private final Executor monitoringExecutor;

    @Scheduled(
            fixedDelayString = "${zecinsight.tasks.monitoring-interval-ms:86400000}",
            initialDelayString = "${zecinsight.tasks.monitoring-interval-ms:86400000}")
    public void runScheduled() {
        if (!properties.isMonitoringEnabled()) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.debug("Task monitoring sweep still running, skipping");
            return;
        }
        monitoringExecutor.execute(() -> {
            try {
                taskMonitoringService.runPeriodicMonitoring();
            } catch (RuntimeException e) {
                log.error("Task monitoring sweep failed", e);
            } finally {
                running.set(false);
            }
        });
    }
}
