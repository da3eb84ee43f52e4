package com.zecinsight.insight.alertcontent;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Suggestion(String category, String suggestion, String rationale, String expectedOutcome) {
}
