package com.zecinsight.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record WalletIdsRequest(
        @NotEmpty(message = "wallet_ids is required")
        List<String> walletIds
) {
}
