package com.zecinsight.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AlertRecordRepository extends MongoRepository<AlertRecord, String> {

    List<AlertRecord> findByProjectIdOrderByDetectedAtDesc(String projectId, Pageable pageable);
}
