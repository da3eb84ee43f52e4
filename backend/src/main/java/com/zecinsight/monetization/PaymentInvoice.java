package com.zecinsight.monetization;

import java.math.BigDecimal;
import java.time.Instant;

public record PaymentInvoice(
        String invoiceId,
        String walletId,
        String paymentAddress,
        BigDecimal amountZec,
        String qrCode,
        String paymentUri,
        Instant expiresAt
) {
}
