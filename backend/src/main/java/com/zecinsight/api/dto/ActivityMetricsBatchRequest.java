package com.zecinsight.api.dto;

import com.zecinsight.domain.WalletMetricSample;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record ActivityMetricsBatchRequest(
        @NotEmpty(message = "records is required")
        List<WalletMetricSample> records
) {
}
