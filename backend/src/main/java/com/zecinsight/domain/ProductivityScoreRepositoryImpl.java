package com.zecinsight.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Aggregation-backed "latest per wallet" lookup for productivity_scores.
 */
@Repository
@RequiredArgsConstructor
public class ProductivityScoreRepositoryImpl implements ProductivityScoreRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<ProductivityScore> findLatestByWalletIds(Collection<String> walletIds) {
        if (walletIds == null || walletIds.isEmpty()) {
            return List.of();
        }
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(where("walletId").in(walletIds)),
                Aggregation.sort(Sort.Direction.DESC, "calculatedAt"),
                Aggregation.group("walletId").first(Aggregation.ROOT).as("latest"),
                Aggregation.replaceRoot("latest"));
        return mongoTemplate.aggregate(aggregation, ProductivityScore.class, ProductivityScore.class)
                .getMappedResults();
    }
}
