package com.zecinsight.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record MultiProjectComparisonRequest(
        @NotEmpty(message = "project_ids is required")
        @Size(max = 10, message = "At most 10 projects can be compared")
        List<String> projectIds,

        String targetPercentile
) {
}
