package com.zecinsight.domain;

import java.util.List;

/**
 * Bulk write path for indexer rollups.
 */
public interface WalletMetricSampleRepositoryCustom {

    /**
     * Upsert samples keyed by (walletId, date). Returns the number of documents inserted or modified.
     */
    int upsertAll(List<WalletMetricSample> samples);
}
