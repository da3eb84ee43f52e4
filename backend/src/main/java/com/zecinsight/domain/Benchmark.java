package com.zecinsight.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Dated percentile snapshot for one (benchmarkType, category). Append-only time series;
 * "latest" is the greatest asOfDate per (benchmarkType, category).
 */
@Document(collection = "benchmarks")
@CompoundIndex(name = "type_category_date", def = "{'benchmarkType': 1, 'category': 1, 'asOfDate': -1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Benchmark {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String benchmarkType;
    private String category;
    private LocalDate asOfDate;
    private double p25;
    private double p50;
    private double p75;
    private double p90;
    private int sampleSize;
    private Instant createdAt;
}
