package com.zecinsight.domain;

import java.util.List;

public interface BenchmarkRepositoryCustom {

    List<String> findDistinctCategories();

    List<String> findDistinctBenchmarkTypesByCategory(String category);
}
