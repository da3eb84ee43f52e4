package com.zecinsight.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Payout of pending earnings to an owner-supplied address.
 * {@code amountZec} is the requested amount; {@code consumedZec} the sum of the earnings rows marked withdrawn.
 * The rows are reserved before the gateway is asked to pay, and released again only if the gateway refuses.
 */
@Document(collection = "withdrawals")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Withdrawal {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String ownerId;
    private String toAddress;
    private BigDecimal amountZec;
    private BigDecimal consumedZec;
    private String gatewayWithdrawalId;
    private List<String> earningIds = new ArrayList<>();
    private WithdrawalStatus status = WithdrawalStatus.RESERVED;
    private Instant createdAt;

    public enum WithdrawalStatus {
        /** Earnings rows are marked withdrawn; the gateway has not confirmed yet. */
        RESERVED,
        SUBMITTED,
        /** Gateway refused; the reserved rows were released. */
        FAILED
    }
}
