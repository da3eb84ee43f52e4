package com.zecinsight.monetization.gateway;

import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/**
 * External Zcash paywall. Implementations signal failures and timeouts with
 * {@link com.zecinsight.common.UpstreamException}.
 */
public interface PaymentGateway {

    Mono<GatewayInvoice> createInvoice(String userId, BigDecimal amountZec, String itemId);

    Mono<GatewayPaymentCheck> checkPayment(String invoiceId);

    Mono<GatewayWithdrawal> createWithdrawal(String userId, String toAddress, BigDecimal amountZec);
}
