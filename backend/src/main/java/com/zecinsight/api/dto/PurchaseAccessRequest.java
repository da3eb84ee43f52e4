package com.zecinsight.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of a data access purchase. email is optional and only used for the receipt.
 */
public record PurchaseAccessRequest(
        @NotBlank(message = "wallet_id is required")
        String walletId,

        @Email(message = "email must be a valid address")
        String email
) {
}
