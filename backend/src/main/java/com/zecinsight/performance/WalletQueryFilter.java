package com.zecinsight.performance;

import com.zecinsight.domain.PrivacyMode;
import com.zecinsight.domain.WalletType;

/**
 * Optional filters for the project wallet listing. Null means "no filter"; limit defaults to 100.
 */
public record WalletQueryFilter(Integer minScore, WalletType walletType, PrivacyMode privacyMode, Integer limit) {

    public static final int DEFAULT_LIMIT = 100;

    public int effectiveLimit() {
        return limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
    }

    public static WalletQueryFilter none() {
        return new WalletQueryFilter(null, null, null, null);
    }
}
