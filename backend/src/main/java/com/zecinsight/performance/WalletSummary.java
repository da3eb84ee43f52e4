package com.zecinsight.performance;

import com.zecinsight.domain.PrivacyMode;
import com.zecinsight.domain.WalletType;

/**
 * Owner-facing wallet row. totalScore is null for wallets never scored.
 */
public record WalletSummary(
        String walletId,
        String address,
        WalletType type,
        PrivacyMode privacyMode,
        Integer totalScore,
        int activeDays
) {
}
