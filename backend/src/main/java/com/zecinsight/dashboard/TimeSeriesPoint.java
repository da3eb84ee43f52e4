package com.zecinsight.dashboard;

import java.time.LocalDate;

public record TimeSeriesPoint(LocalDate date, double value) {
}
