package com.zecinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface RecommendationTaskRepository extends MongoRepository<RecommendationTask, String> {

    Optional<RecommendationTask> findByRecommendationId(String recommendationId);

    List<RecommendationTask> findByStatus(RecommendationStatus status);

    List<RecommendationTask> findByWalletIdAndStatus(String walletId, RecommendationStatus status);

    List<RecommendationTask> findByProjectIdAndStatus(String projectId, RecommendationStatus status);
}
