package com.zecinsight.insight;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zecinsight.domain.Recommendation;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectRecommendations(
        String projectId,
        int totalWallets,
        ProjectHealth projectHealth,
        List<Recommendation> recommendations,
        String message,
        Instant generatedAt
) {
}
