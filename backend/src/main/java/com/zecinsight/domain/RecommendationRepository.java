package com.zecinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface RecommendationRepository extends MongoRepository<Recommendation, String> {

    List<Recommendation> findByWalletIdOrderByPriorityDescCreatedAtDesc(String walletId);

    List<Recommendation> findByWalletIdAndStatusOrderByPriorityDescCreatedAtDesc(String walletId, RecommendationStatus status);

    List<Recommendation> findByProjectIdOrderByPriorityDescCreatedAtDesc(String projectId);

    List<Recommendation> findByProjectIdAndStatusOrderByPriorityDescCreatedAtDesc(String projectId, RecommendationStatus status);
}
