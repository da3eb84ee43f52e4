package com.zecinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface WalletRepository extends MongoRepository<Wallet, String> {

    List<Wallet> findByProjectId(String projectId);

    List<Wallet> findByPrivacyMode(PrivacyMode privacyMode);
}
