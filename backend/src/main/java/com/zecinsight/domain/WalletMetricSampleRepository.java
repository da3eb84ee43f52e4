package com.zecinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface WalletMetricSampleRepository extends MongoRepository<WalletMetricSample, String>,
        WalletMetricSampleRepositoryCustom {

    List<WalletMetricSample> findByWalletIdOrderByDateAsc(String walletId);

    List<WalletMetricSample> findByWalletIdAndDateGreaterThanEqualOrderByDateAsc(String walletId, LocalDate from);

    List<WalletMetricSample> findByProjectIdAndDateGreaterThanEqual(String projectId, LocalDate from);

    List<WalletMetricSample> findByWalletIdInAndDateGreaterThanEqual(Collection<String> walletIds, LocalDate from);
}
