package com.zecinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PrivacyAuditEntryRepository extends MongoRepository<PrivacyAuditEntry, String> {

    List<PrivacyAuditEntry> findByWalletIdOrderByChangedAtDesc(String walletId);
}
