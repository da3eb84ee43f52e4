package com.zecinsight.privacy;

import com.zecinsight.domain.WalletType;

/**
 * Anonymized view. Carries no address or identity field by construction.
 */
public record AggregatedWalletData(
        WalletType walletType,
        BehavioralMetrics behavioralMetrics,
        String note
) implements WalletData {

    static final String NOTE = "Aggregated data only. Individual wallet identity is not disclosed.";

    @Override
    public DataLevel dataLevel() {
        return DataLevel.AGGREGATED;
    }
}
