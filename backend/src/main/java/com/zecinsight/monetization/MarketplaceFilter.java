package com.zecinsight.monetization;

import com.zecinsight.domain.WalletType;

/**
 * All fields optional. limit falls back to the configured marketplace default.
 */
public record MarketplaceFilter(Integer minProductivityScore, WalletType walletType, Integer limit) {

    public static MarketplaceFilter none() {
        return new MarketplaceFilter(null, null, null);
    }
}
