package com.zecinsight.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Point-in-time productivity score for one wallet. All component scores are 0..100.
 * Latest document per wallet wins; older ones are kept as history.
 */
@Document(collection = "productivity_scores")
@CompoundIndexes({
    @CompoundIndex(name = "wallet_calculated", def = "{'walletId': 1, 'calculatedAt': -1}"),
    @CompoundIndex(name = "project_calculated", def = "{'projectId': 1, 'calculatedAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ProductivityScore {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String walletId;
    private String projectId;
    private int totalScore;
    private int retentionScore;
    private int adoptionScore;
    private int activityScore;
    private int diversityScore;
    private int churnScore;
    private WalletHealthStatus status;
    private RiskLevel riskLevel;
    private Instant calculatedAt;
}
