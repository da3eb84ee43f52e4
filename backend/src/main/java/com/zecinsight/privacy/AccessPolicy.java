package com.zecinsight.privacy;

import com.zecinsight.domain.PrivacyMode;

/**
 * Privacy mode x ownership x payment access matrix.
 */
public final class AccessPolicy {

    private AccessPolicy() {
    }

    public static AccessDecision decide(PrivacyMode mode, String ownerId, String requesterId, boolean hasPaid) {
        PrivacyMode m = mode == null ? PrivacyMode.PRIVATE : mode;
        if (requesterId != null && requesterId.equals(ownerId)) {
            return AccessDecision.allow("Owner access", DataLevel.FULL, m);
        }
        return switch (m) {
            case PRIVATE -> AccessDecision.deny("Wallet data is private", false, m);
            case PUBLIC -> AccessDecision.allow("Public wallet, aggregated data only", DataLevel.AGGREGATED, m);
            case MONETIZABLE -> hasPaid
                    ? AccessDecision.allow("Paid access", DataLevel.FULL, m)
                    : AccessDecision.deny("Payment required for access to this wallet's data", true, m);
        };
    }
}
