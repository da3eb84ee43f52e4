package com.zecinsight.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NumbersTest {

    @Test
    void round2_halfUp() {
        assertThat(Numbers.round2(21.4286)).isEqualTo(21.43);
        assertThat(Numbers.round2(-56.9231)).isEqualTo(-56.92);
    }

    @Test
    void percentage_zeroTotal_returnsZero() {
        assertThat(Numbers.percentage(5, 0)).isZero();
        assertThat(Numbers.percentage(1, 4)).isEqualTo(25.0);
    }

    @Test
    void clamp_boundsValue() {
        assertThat(Numbers.clamp(120, 0, 100)).isEqualTo(100);
        assertThat(Numbers.clamp(-3, 0, 100)).isEqualTo(0);
        assertThat(Numbers.clamp(42, 0, 100)).isEqualTo(42);
    }
}
