package com.zecinsight.api.dto;

import com.zecinsight.api.validation.ZcashAddress;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record WithdrawalRequest(
        @ZcashAddress
        String toAddress,

        @NotNull(message = "amount_zec is required")
        @DecimalMin(value = "0", inclusive = false, message = "amount_zec must be greater than 0")
        BigDecimal amountZec
) {
}
