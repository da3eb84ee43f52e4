package com.zecinsight.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Owner's share of one paid data access. A withdrawal that needs only part of a row splits it:
 * the consumed part becomes its own withdrawn row and the remainder stays pending.
 */
@Document(collection = "earnings")
@CompoundIndex(name = "owner_status_created", def = "{'ownerId': 1, 'status': 1, 'createdAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Earnings {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String ownerId;
    private String walletId;
    @Indexed(unique = true)
    private String paymentId;
    private BigDecimal amountZec;
    private BigDecimal platformFeeZec;
    private EarningsStatus status = EarningsStatus.PENDING;
    private String withdrawalId;
    private Instant createdAt;
    private Instant withdrawnAt;

    public enum EarningsStatus {
        PENDING,
        WITHDRAWN
    }
}
