package com.zecinsight.privacy;

import com.zecinsight.domain.PrivacyMode;
import com.zecinsight.domain.WalletType;

/**
 * Raw wallet fields, address included. Only for owners and paid monetizable access.
 */
public record FullWalletData(
        String walletId,
        String address,
        WalletType type,
        PrivacyMode privacyMode,
        int activeDays,
        long totalTransactions,
        long totalVolumeZatoshi,
        Integer productivityScore
) implements WalletData {

    @Override
    public DataLevel dataLevel() {
        return DataLevel.FULL;
    }
}
