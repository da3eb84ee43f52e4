package com.zecinsight.monetization.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonetizationConfigTest {

    @Test
    void validateSplit_defaultsSumTo100() {
        assertThatCode(() -> MonetizationConfig.validateSplit(new MonetizationProperties())).doesNotThrowAnyException();
    }

    @Test
    void validateSplit_notSummingTo100_fails() {
        MonetizationProperties p = new MonetizationProperties();
        p.setOwnerSharePercentage(80);
        assertThatThrownBy(() -> MonetizationConfig.validateSplit(p))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sum to 100");
    }
}
