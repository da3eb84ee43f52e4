package com.zecinsight.scoring;

import com.zecinsight.common.NotFoundException;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.ProductivityScoreRepository;
import com.zecinsight.domain.Wallet;
import com.zecinsight.domain.WalletMetricSample;
import com.zecinsight.domain.WalletMetricSampleRepository;
import com.zecinsight.domain.WalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Recomputes and appends productivity scores. Each call supersedes the previous score for the wallet;
 * earlier documents are kept as history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductivityScoringService {

    private final WalletRepository walletRepository;
    private final WalletMetricSampleRepository sampleRepository;
    private final ProductivityScoreRepository scoreRepository;

    public ProductivityScore calculate(String walletId) {
        Wallet wallet = walletRepository.findById(walletId)
                .orElseThrow(() -> new NotFoundException("Wallet not found: " + walletId));
        List<WalletMetricSample> samples = sampleRepository.findByWalletIdOrderByDateAsc(walletId);
        ScoreBreakdown breakdown = ProductivityScorer.score(samples, LocalDate.now(ZoneOffset.UTC));

        ProductivityScore score = new ProductivityScore();
        score.setWalletId(walletId);
        score.setProjectId(wallet.getProjectId());
        score.setTotalScore(breakdown.totalScore());
        score.setRetentionScore(breakdown.retentionScore());
        score.setAdoptionScore(breakdown.adoptionScore());
        score.setChurnScore(breakdown.churnScore());
        score.setDiversityScore(breakdown.diversityScore());
        score.setActivityScore(breakdown.activityScore());
        score.setStatus(breakdown.status());
        score.setRiskLevel(breakdown.riskLevel());
        score.setCalculatedAt(Instant.now());
        ProductivityScore saved = scoreRepository.save(score);
        log.debug("Scored wallet {}: total={} status={}", walletId, breakdown.totalScore(), breakdown.status());
        return saved;
    }

    public Optional<ProductivityScore> getLatestScore(String walletId) {
        return scoreRepository.findFirstByWalletIdOrderByCalculatedAtDesc(walletId);
    }
}
