package com.zecinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface AlertConfigurationRepository extends MongoRepository<AlertConfiguration, String> {

    Optional<AlertConfiguration> findByProjectId(String projectId);
}
