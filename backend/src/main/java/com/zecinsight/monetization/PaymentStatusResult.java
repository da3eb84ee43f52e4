package com.zecinsight.monetization;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentStatusResult(String invoiceId, String walletId, boolean paid, Instant paidAt, String paidTxid) {
}
