package com.zecinsight.benchmark;

import com.zecinsight.common.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetPercentileTest {

    @Test
    void fromValue_blankDefaultsToP50() {
        assertThat(TargetPercentile.fromValue(null)).isEqualTo(TargetPercentile.P50);
        assertThat(TargetPercentile.fromValue(" ")).isEqualTo(TargetPercentile.P50);
        assertThat(TargetPercentile.fromValue("P75")).isEqualTo(TargetPercentile.P75);
    }

    @Test
    void fromValue_unknownKey_throws() {
        assertThatThrownBy(() -> TargetPercentile.fromValue("p99"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("p99");
    }
}
