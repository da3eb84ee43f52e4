package com.zecinsight.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate.findDistinct queries for benchmarks.
 */
@Repository
@RequiredArgsConstructor
public class BenchmarkRepositoryImpl implements BenchmarkRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<String> findDistinctCategories() {
        return mongoTemplate.findDistinct(new Query(), "category", Benchmark.class, String.class);
    }

    @Override
    public List<String> findDistinctBenchmarkTypesByCategory(String category) {
        Query query = new Query(where("category").is(category));
        return mongoTemplate.findDistinct(query, "benchmarkType", Benchmark.class, String.class);
    }
}
