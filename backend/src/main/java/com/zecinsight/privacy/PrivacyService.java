package com.zecinsight.privacy;

import com.zecinsight.common.AccessDeniedException;
import com.zecinsight.common.NotFoundException;
import com.zecinsight.domain.PrivacyAuditEntry;
import com.zecinsight.domain.PrivacyAuditEntryRepository;
import com.zecinsight.domain.PrivacyMode;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.ProductivityScoreRepository;
import com.zecinsight.domain.Project;
import com.zecinsight.domain.ProjectRepository;
import com.zecinsight.domain.Wallet;
import com.zecinsight.domain.WalletMetricSample;
import com.zecinsight.domain.WalletMetricSampleRepository;
import com.zecinsight.domain.WalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Privacy access gate: the only writer of {@link Wallet#getPrivacyMode()} and the single place access
 * decisions are made.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PrivacyService {

    private final WalletRepository walletRepository;
    private final ProjectRepository projectRepository;
    private final WalletMetricSampleRepository sampleRepository;
    private final ProductivityScoreRepository scoreRepository;
    private final PrivacyAuditEntryRepository auditRepository;

    public PrivacyMode getPrivacyMode(String walletId) {
        return requireWallet(walletId).getPrivacyMode();
    }

    /**
     * Sets the mode absolutely (any transition allowed) and appends an audit entry.
     *
     * @throws com.zecinsight.common.ValidationException if mode is not private, public or monetizable
     */
    public Wallet setPrivacyPreference(String walletId, String mode) {
        PrivacyMode target = PrivacyMode.fromValue(mode);
        Wallet wallet = requireWallet(walletId);
        PrivacyMode previous = wallet.getPrivacyMode();
        wallet.setPrivacyMode(target);
        wallet.setUpdatedAt(Instant.now());
        Wallet saved = walletRepository.save(wallet);
        audit(walletId, previous, target);
        log.info("Privacy mode of wallet {} changed {} -> {}", walletId, previous, target);
        return saved;
    }

    /** Applies one mode to every wallet of the project. Returns the number of wallets updated. */
    public int setProjectPrivacyPreference(String projectId, String mode) {
        PrivacyMode target = PrivacyMode.fromValue(mode);
        requireProject(projectId);
        List<Wallet> wallets = walletRepository.findByProjectId(projectId);
        Instant now = Instant.now();
        for (Wallet w : wallets) {
            PrivacyMode previous = w.getPrivacyMode();
            w.setPrivacyMode(target);
            w.setUpdatedAt(now);
            audit(w.getId(), previous, target);
        }
        walletRepository.saveAll(wallets);
        log.info("Privacy mode of {} wallet(s) in project {} set to {}", wallets.size(), projectId, target);
        return wallets.size();
    }

    public PrivacyStats getProjectPrivacyStats(String projectId) {
        requireProject(projectId);
        List<Wallet> wallets = walletRepository.findByProjectId(projectId);
        Map<PrivacyMode, Long> counts = wallets.stream()
                .collect(Collectors.groupingBy(w -> Optional.ofNullable(w.getPrivacyMode()).orElse(PrivacyMode.PRIVATE),
                        Collectors.counting()));
        return new PrivacyStats(
                counts.getOrDefault(PrivacyMode.PRIVATE, 0L).intValue(),
                counts.getOrDefault(PrivacyMode.PUBLIC, 0L).intValue(),
                counts.getOrDefault(PrivacyMode.MONETIZABLE, 0L).intValue(),
                wallets.size());
    }

    public AccessDecision checkDataAccess(String walletId, String requesterId, boolean hasPaid) {
        Wallet wallet = requireWallet(walletId);
        return AccessPolicy.decide(wallet.getPrivacyMode(), getOwnerId(wallet), requesterId, hasPaid);
    }

    /**
     * Returns wallet data at the given level. AGGREGATED never includes the address.
     */
    public WalletData getWalletData(String walletId, DataLevel level) {
        Wallet wallet = requireWallet(walletId);
        List<WalletMetricSample> samples = sampleRepository.findByWalletIdOrderByDateAsc(walletId);
        int activeDays = (int) samples.stream().filter(s -> s.isActive() || s.getTransactionCount() > 0).count();
        long totalTx = samples.stream().mapToLong(WalletMetricSample::getTransactionCount).sum();
        Optional<ProductivityScore> score = scoreRepository.findFirstByWalletIdOrderByCalculatedAtDesc(walletId);

        if (level == DataLevel.FULL) {
            long volume = samples.stream().mapToLong(WalletMetricSample::getVolumeZatoshi).sum();
            return new FullWalletData(wallet.getId(), wallet.getAddress(), wallet.getType(), wallet.getPrivacyMode(),
                    activeDays, totalTx, volume, score.map(ProductivityScore::getTotalScore).orElse(null));
        }
        BehavioralMetrics metrics = new BehavioralMetrics(activeDays, totalTx,
                score.map(ProductivityScore::getTotalScore).orElse(null),
                score.map(ProductivityScore::getRetentionScore).orElse(null),
                score.map(ProductivityScore::getAdoptionScore).orElse(null));
        return new AggregatedWalletData(wallet.getType(), metrics, AggregatedWalletData.NOTE);
    }

    /**
     * Access check plus data fetch in one step.
     *
     * @throws AccessDeniedException with a generic message when the decision denies access
     */
    public WalletData getAccessibleWalletData(String walletId, String requesterId, boolean hasPaid) {
        AccessDecision decision = checkDataAccess(walletId, requesterId, hasPaid);
        if (!decision.allowed()) {
            throw new AccessDeniedException("Access denied");
        }
        return getWalletData(walletId, decision.dataLevel());
    }

    /**
     * Anonymized summaries of every monetizable wallet.
     */
    public List<MonetizableWallet> getMonetizableWallets() {
        List<Wallet> wallets = walletRepository.findByPrivacyMode(PrivacyMode.MONETIZABLE);
        if (wallets.isEmpty()) {
            return List.of();
        }
        Map<String, ProductivityScore> scores = scoreRepository
                .findLatestByWalletIds(wallets.stream().map(Wallet::getId).toList())
                .stream()
                .collect(Collectors.toMap(ProductivityScore::getWalletId, Function.identity(), (a, b) -> a));
        Map<String, Project> projects = projectRepository
                .findAllById(wallets.stream().map(Wallet::getProjectId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(Project::getId, Function.identity()));
        return wallets.stream().map(w -> {
            List<WalletMetricSample> samples = sampleRepository.findByWalletIdOrderByDateAsc(w.getId());
            Project p = projects.get(w.getProjectId());
            ProductivityScore s = scores.get(w.getId());
            return new MonetizableWallet(w.getId(), w.getType(), p == null ? null : p.getCategory(),
                    s == null ? null : s.getTotalScore(),
                    (int) samples.stream().filter(x -> x.isActive() || x.getTransactionCount() > 0).count(),
                    samples.stream().mapToLong(WalletMetricSample::getTransactionCount).sum());
        }).toList();
    }

    public String getOwnerId(String walletId) {
        return getOwnerId(requireWallet(walletId));
    }

    /** @throws AccessDeniedException unless {@code userId} owns the wallet */
    public Wallet requireOwner(String walletId, String userId) {
        Wallet wallet = requireWallet(walletId);
        if (userId == null || !userId.equals(getOwnerId(wallet))) {
            throw new AccessDeniedException("Access denied");
        }
        return wallet;
    }

    /** @throws AccessDeniedException unless {@code userId} owns the project */
    public Project requireProjectOwner(String projectId, String userId) {
        Project project = requireProject(projectId);
        if (userId == null || !userId.equals(project.getUserId())) {
            throw new AccessDeniedException("Access denied");
        }
        return project;
    }

    public List<PrivacyAuditEntry> getAuditLog(String walletId) {
        requireWallet(walletId);
        return auditRepository.findByWalletIdOrderByChangedAtDesc(walletId);
    }

    public Wallet requireWallet(String walletId) {
        return walletRepository.findById(walletId)
                .orElseThrow(() -> new NotFoundException("Wallet not found: " + walletId));
    }

    private Project requireProject(String projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new NotFoundException("Project not found: " + projectId));
    }

    private String getOwnerId(Wallet wallet) {
        return projectRepository.findById(wallet.getProjectId())
                .map(Project::getUserId)
                .orElseThrow(() -> new NotFoundException("Project not found for wallet: " + wallet.getId()));
    }

    private void audit(String walletId, PrivacyMode previous, PrivacyMode mode) {
        PrivacyAuditEntry entry = new PrivacyAuditEntry();
        entry.setWalletId(walletId);
        entry.setPreviousMode(previous);
        entry.setPrivacyMode(mode);
        entry.setChangedAt(Instant.now());
        auditRepository.save(entry);
    }
}
