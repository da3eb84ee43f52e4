package com.zecinsight.monetization.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayPaymentCheck(
        @JsonProperty("paid") boolean paid,
        @JsonProperty("invoice") InvoiceState invoice
) {

    public String txid() {
        return invoice == null ? null : invoice.paidTxid();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InvoiceState(
            @JsonProperty("paid_txid") String paidTxid,
            @JsonProperty("paid_at") Instant paidAt
    ) {
    }
}
