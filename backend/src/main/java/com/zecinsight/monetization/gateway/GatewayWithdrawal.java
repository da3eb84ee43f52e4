package com.zecinsight.monetization.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayWithdrawal(@JsonProperty("id") String withdrawalId, @JsonProperty("status") String status) {
}
