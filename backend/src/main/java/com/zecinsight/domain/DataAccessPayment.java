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
 * Purchase of full data access to one monetizable wallet. Created pending once the gateway invoice
 * exists; flips to PAID exactly once.
 */
@Document(collection = "data_access_payments")
@CompoundIndex(name = "requester_wallet_status", def = "{'requesterId': 1, 'walletId': 1, 'status': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DataAccessPayment {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String requesterId;
    @Indexed
    private String walletId;
    private String ownerId;
    @Indexed(unique = true)
    private String invoiceId;
    private BigDecimal amountZec;
    private String email;
    private String paymentAddress;
    private String paymentUri;
    private String qrCode;
    private PaymentStatus status = PaymentStatus.PENDING;
    private String txid;
    private Instant createdAt;
    private Instant paidAt;

    public enum PaymentStatus {
        PENDING,
        PAID
    }
}
