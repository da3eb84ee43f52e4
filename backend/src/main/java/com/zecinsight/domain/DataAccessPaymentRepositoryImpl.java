package com.zecinsight.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * findAndModify-based status transition for data_access_payments.
 */
@Repository
@RequiredArgsConstructor
public class DataAccessPaymentRepositoryImpl implements DataAccessPaymentRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<DataAccessPayment> markPaidIfPending(String invoiceId, String txid, Instant paidAt) {
        Query query = new Query(where("invoiceId").is(invoiceId)
                .and("status").is(DataAccessPayment.PaymentStatus.PENDING));
        Update update = new Update()
                .set("status", DataAccessPayment.PaymentStatus.PAID)
                .set("txid", txid)
                .set("paidAt", paidAt);
        DataAccessPayment updated = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), DataAccessPayment.class);
        return Optional.ofNullable(updated);
    }
}
