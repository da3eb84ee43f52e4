package com.zecinsight.insight.alertcontent;

/**
 * priority is P0 (do now), P1 or P2.
 */
public record ActionItem(String action, String owner, String timeline, String priority) {
}
