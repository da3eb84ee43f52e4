package com.zecinsight.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Tracks whether a recommendation was acted on. Baseline is captured at creation; monitoring
 * compares current metrics against it and closes the task once indicators are met.
 */
@Document(collection = "recommendation_tasks")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RecommendationTask {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String recommendationId;
    private String walletId;
    private String projectId;
    private RecommendationType recommendationType;
    private MetricSnapshot baseline;
    @Indexed
    private RecommendationStatus status = RecommendationStatus.PENDING;
    private double completionPercentage;
    private Double effectivenessScore;
    private EffectivenessLevel effectivenessLevel;
    private Instant lastCheckedAt;
    private Instant completedAt;
    private Instant createdAt;
}
