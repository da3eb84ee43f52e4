package com.zecinsight.privacy;

import com.zecinsight.domain.WalletType;

/**
 * Anonymized listing entry for a monetizable wallet. No address.
 */
public record MonetizableWallet(
        String walletId,
        WalletType walletType,
        String projectCategory,
        Integer productivityScore,
        int activeDays,
        long totalTransactions
) {
}
