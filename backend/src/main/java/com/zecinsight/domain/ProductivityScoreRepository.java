package com.zecinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ProductivityScoreRepository extends MongoRepository<ProductivityScore, String>,
        ProductivityScoreRepositoryCustom {

    Optional<ProductivityScore> findFirstByWalletIdOrderByCalculatedAtDesc(String walletId);

    List<ProductivityScore> findByProjectIdAndCalculatedAtGreaterThanEqual(String projectId, Instant from);
}
