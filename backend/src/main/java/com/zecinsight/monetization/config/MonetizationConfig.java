package com.zecinsight.monetization.config;

import com.zecinsight.monetization.gateway.PaymentGateway;
import com.zecinsight.monetization.gateway.WebClientPaymentGateway;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(MonetizationProperties.class)
public class MonetizationConfig {

    @Bean
    public PaymentGateway paymentGateway(WebClient.Builder webClientBuilder, MonetizationProperties properties) {
        validateSplit(properties);
        MonetizationProperties.Gateway gw = properties.getGateway();
        WebClient.Builder builder = webClientBuilder.clone().baseUrl(gw.getBaseUrl());
        if (gw.getApiKey() != null && !gw.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + gw.getApiKey());
        }
        return new WebClientPaymentGateway(builder, gw.getTimeout());
    }

    static void validateSplit(MonetizationProperties properties) {
        int owner = properties.getOwnerSharePercentage();
        int platform = properties.getPlatformFeePercentage();
        if (owner < 0 || platform < 0 || owner + platform != 100) {
            throw new IllegalStateException("zecinsight.monetization owner-share-percentage (" + owner
                    + ") and platform-fee-percentage (" + platform + ") must be non-negative and sum to 100");
        }
    }
}
