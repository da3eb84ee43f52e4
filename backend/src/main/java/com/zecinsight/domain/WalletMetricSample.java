package com.zecinsight.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

/**
 * Daily per-wallet activity rollup written by the indexer. One document per (walletId, date).
 * Amounts are zatoshi (1 ZEC = 100,000,000 zatoshi).
 */
@Document(collection = "wallet_metric_samples")
@CompoundIndexes({
    @CompoundIndex(name = "wallet_date", def = "{'walletId': 1, 'date': 1}", unique = true),
    @CompoundIndex(name = "project_date", def = "{'projectId': 1, 'date': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WalletMetricSample {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String walletId;
    private String projectId;
    private LocalDate date;
    private int transactionCount;
    private long volumeZatoshi;
    private long feesZatoshi;
    private int shieldedTxCount;
    private int transparentTxCount;
    private long shieldedVolumeZatoshi;
    /** Distinct feature types touched that day (transfer, shield, deshield, memo, ...). */
    private int featureTypeCount;
    private boolean active;
}
