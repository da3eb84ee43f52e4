package com.zecinsight.analytics;

import java.time.LocalDate;

public record ShieldedDailyActivity(LocalDate date, int shieldedTxCount, long shieldedVolumeZatoshi) {
}
