package com.zecinsight.privacy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wallet counts per privacy mode for one project.
 */
public record PrivacyStats(
        @JsonProperty("private") int privateWallets,
        @JsonProperty("public") int publicWallets,
        @JsonProperty("monetizable") int monetizableWallets,
        @JsonProperty("total") int total
) {
}
