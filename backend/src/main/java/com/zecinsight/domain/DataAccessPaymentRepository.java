package com.zecinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface DataAccessPaymentRepository extends MongoRepository<DataAccessPayment, String>,
        DataAccessPaymentRepositoryCustom {

    Optional<DataAccessPayment> findByInvoiceId(String invoiceId);

    boolean existsByRequesterIdAndWalletIdAndStatus(String requesterId, String walletId,
                                                     DataAccessPayment.PaymentStatus status);

    long countByWalletIdAndStatus(String walletId, DataAccessPayment.PaymentStatus status);
}
