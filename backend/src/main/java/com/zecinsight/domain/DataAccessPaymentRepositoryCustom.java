package com.zecinsight.domain;

import java.time.Instant;
import java.util.Optional;

public interface DataAccessPaymentRepositoryCustom {

    /**
     * Atomically flips a PENDING payment to PAID. Returns the updated payment only for the caller
     * that performed the transition; empty if the payment was already paid or does not exist.
     */
    Optional<DataAccessPayment> markPaidIfPending(String invoiceId, String txid, Instant paidAt);
}
