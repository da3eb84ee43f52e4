package com.zecinsight.domain;

import com.mongodb.bulk.BulkWriteResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Unordered bulk upsert for wallet_metric_samples.
 */
@Repository
@RequiredArgsConstructor
public class WalletMetricSampleRepositoryImpl implements WalletMetricSampleRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public int upsertAll(List<WalletMetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return 0;
        }
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, WalletMetricSample.class);
        for (WalletMetricSample s : samples) {
            Query query = new Query(where("walletId").is(s.getWalletId()).and("date").is(s.getDate()));
            Update update = new Update()
                    .set("projectId", s.getProjectId())
                    .set("transactionCount", s.getTransactionCount())
                    .set("volumeZatoshi", s.getVolumeZatoshi())
                    .set("feesZatoshi", s.getFeesZatoshi())
                    .set("shieldedTxCount", s.getShieldedTxCount())
                    .set("transparentTxCount", s.getTransparentTxCount())
                    .set("shieldedVolumeZatoshi", s.getShieldedVolumeZatoshi())
                    .set("featureTypeCount", s.getFeatureTypeCount())
                    .set("active", s.isActive());
            ops.upsert(query, update);
        }
        BulkWriteResult result = ops.execute();
        return result.getInsertedCount() + result.getModifiedCount() + result.getUpserts().size();
    }
}
