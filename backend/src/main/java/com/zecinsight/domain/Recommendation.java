package com.zecinsight.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted recommendation for a wallet or project. Priority is 0..10; churn prevention is always 10.
 * {@code completionIndicators} maps indicator name to its threshold (number, boolean or frequency label).
 */
@Document(collection = "recommendations")
@CompoundIndexes({
    @CompoundIndex(name = "wallet_status", def = "{'walletId': 1, 'status': 1}"),
    @CompoundIndex(name = "project_status", def = "{'projectId': 1, 'status': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Recommendation {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String walletId;
    private String projectId;
    private RecommendationType type;
    private String title;
    private String description;
    private int priority;
    private String currentState;
    private String targetState;
    private String timeline;
    private String expectedImpact;
    private String effortLevel;
    private List<String> actions = new ArrayList<>();
    private Map<String, Object> completionIndicators = new LinkedHashMap<>();
    private RecommendationStatus status = RecommendationStatus.PENDING;
    private String taskId;
    private Instant createdAt;
    private Instant completedAt;
}
