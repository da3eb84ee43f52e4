package com.zecinsight.comparison.config;

import com.zecinsight.comparison.GapAnalyzer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ComparisonProperties.class)
public class ComparisonConfig {

    @Bean
    public GapAnalyzer gapAnalyzer(ComparisonProperties properties) {
        return new GapAnalyzer(properties);
    }
}
