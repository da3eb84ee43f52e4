package com.zecinsight.monetization.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayInvoice(
        @JsonProperty("id") String invoiceId,
        @JsonProperty("z_address") String address,
        @JsonProperty("amount_zec") BigDecimal amountZec,
        @JsonProperty("qr_code") String qrCode,
        @JsonProperty("payment_uri") String paymentUri,
        @JsonProperty("expires_at") Instant expiresAt
) {
}
