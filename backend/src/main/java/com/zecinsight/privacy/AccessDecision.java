package com.zecinsight.privacy;

import com.zecinsight.domain.PrivacyMode;

/**
 * Outcome of an access check. dataLevel is null when access is denied.
 */
public record AccessDecision(
        boolean allowed,
        String reason,
        DataLevel dataLevel,
        boolean requiresPayment,
        PrivacyMode privacyMode
) {

    static AccessDecision allow(String reason, DataLevel level, PrivacyMode mode) {
        return new AccessDecision(true, reason, level, false, mode);
    }

    static AccessDecision deny(String reason, boolean requiresPayment, PrivacyMode mode) {
        return new AccessDecision(false, reason, null, requiresPayment, mode);
    }
}
