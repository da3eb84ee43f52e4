package com.zecinsight.insight.alertcontent;

public record ResolutionTimeline(String investigation, String planning, String implementation, String validation,
                                 String total) {
}
