package com.zecinsight.monetization.gateway;

import com.zecinsight.common.UpstreamException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Paywall REST client using WebClient. Every call is bounded by the configured timeout.
 */
public class WebClientPaymentGateway implements PaymentGateway {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientPaymentGateway(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<GatewayInvoice> createInvoice(String userId, BigDecimal amountZec, String itemId) {
        Map<String, Object> body = Map.of(
                "user_id", userId,
                "type", "one_time",
                "amount_zec", amountZec,
                "item_id", itemId
        );
        return webClient.post()
                .uri("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(GatewayInvoice.class)
                .timeout(timeout)
                .onErrorMap(WebClientPaymentGateway::isUpstreamFailure, e -> upstream("createInvoice", e));
    }

    @Override
    public Mono<GatewayPaymentCheck> checkPayment(String invoiceId) {
        return webClient.get()
                .uri("/api/invoices/{id}/check", invoiceId)
                .retrieve()
                .bodyToMono(GatewayPaymentCheck.class)
                .timeout(timeout)
                .onErrorMap(WebClientPaymentGateway::isUpstreamFailure, e -> upstream("checkPayment", e));
    }

    @Override
    public Mono<GatewayWithdrawal> createWithdrawal(String userId, String toAddress, BigDecimal amountZec) {
        Map<String, Object> body = Map.of(
                "user_id", userId,
                "to_address", toAddress,
                "amount_zec", amountZec
        );
        return webClient.post()
                .uri("/api/withdrawals")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(GatewayWithdrawal.class)
                .timeout(timeout)
                .onErrorMap(WebClientPaymentGateway::isUpstreamFailure, e -> upstream("createWithdrawal", e));
    }

    private static boolean isUpstreamFailure(Throwable e) {
        return e instanceof WebClientResponseException
                || e instanceof WebClientRequestException
                || e instanceof TimeoutException;
    }

    private static UpstreamException upstream(String operation, Throwable cause) {
        return new UpstreamException("Payment gateway " + operation + " failed: " + cause.getMessage(), cause);
    }
}
