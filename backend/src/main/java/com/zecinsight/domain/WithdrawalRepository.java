package com.zecinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface WithdrawalRepository extends MongoRepository<Withdrawal, String> {

    List<Withdrawal> findByOwnerIdOrderByCreatedAtDesc(String ownerId);
}
