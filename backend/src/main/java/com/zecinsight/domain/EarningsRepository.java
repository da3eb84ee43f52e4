package com.zecinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface EarningsRepository extends MongoRepository<Earnings, String> {

    List<Earnings> findByOwnerIdAndStatusOrderByCreatedAtAsc(String ownerId, Earnings.EarningsStatus status);

    List<Earnings> findByOwnerId(String ownerId);
}
