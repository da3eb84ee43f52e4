package com.zecinsight.monetization.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Pricing, earnings split and Payment Gateway connection. Owner share and platform fee must sum to 100.
 */
@ConfigurationProperties(prefix = "zecinsight.monetization")
@Getter
@Setter
public class MonetizationProperties {

    /** Price of full data access to one wallet, in ZEC. */
    private BigDecimal priceZec = new BigDecimal("0.001");

    private int ownerSharePercentage = 70;
    private int platformFeePercentage = 30;

    private int marketplaceDefaultLimit = 50;

    private Gateway gateway = new Gateway();

    @Getter
    @Setter
    public static class Gateway {
        private String baseUrl = "http://localhost:3000";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);
    }
}
