package com.zecinsight.task;

public record Improvement(String metric, int baseline, int current, int improvement) {
}
