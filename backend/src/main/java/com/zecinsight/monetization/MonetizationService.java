package com.zecinsight.monetization;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.zecinsight.common.InsufficientBalanceException;
import com.zecinsight.common.NotFoundException;
import com.zecinsight.common.UpstreamException;
import com.zecinsight.common.ValidationException;
import com.zecinsight.domain.DataAccessPayment;
import com.zecinsight.domain.DataAccessPaymentRepository;
import com.zecinsight.domain.Earnings;
import com.zecinsight.domain.EarningsRepository;
import com.zecinsight.domain.PrivacyMode;
import com.zecinsight.domain.Wallet;
import com.zecinsight.domain.Withdrawal;
import com.zecinsight.domain.WithdrawalRepository;
import com.zecinsight.monetization.config.MonetizationProperties;
import com.zecinsight.monetization.gateway.GatewayInvoice;
import com.zecinsight.monetization.gateway.GatewayPaymentCheck;
import com.zecinsight.monetization.gateway.GatewayWithdrawal;
import com.zecinsight.monetization.gateway.PaymentGateway;
import com.zecinsight.privacy.AccessDecision;
import com.zecinsight.privacy.MonetizableWallet;
import com.zecinsight.privacy.PrivacyService;
import com.zecinsight.privacy.WalletData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pay-per-access for monetizable wallets: invoices through the Payment Gateway, owner earnings on payment and
 * withdrawals of pending earnings. Gateway calls block; callers on event-loop threads must offload.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonetizationService {

    static final int ZEC_SCALE = 8;
    static final int MAX_MARKETPLACE_LIMIT = 200;

    /**
     * Serializes balance read-then-reserve per owner. Weak values: a lock lives while some caller holds or
     * waits on it, then the entry is dropped.
     */
    private final LoadingCache<String, ReentrantLock> ownerLocks = Caffeine.newBuilder()
            .weakValues()
            .build(ownerId -> new ReentrantLock());

    private final PrivacyService privacyService;
    private final PaymentGateway paymentGateway;
    private final DataAccessPaymentRepository paymentRepository;
    private final EarningsRepository earningsRepository;
    private final WithdrawalRepository withdrawalRepository;
    private final MonetizationProperties properties;

    /**
     * @throws ValidationException if the wallet is not monetizable
     * @throws UpstreamException   if the gateway does not issue an invoice
     */
    public PaymentInvoice createDataAccessPayment(String requesterId, String walletId, String email) {
        Wallet wallet = privacyService.requireWallet(walletId);
        if (wallet.getPrivacyMode() != PrivacyMode.MONETIZABLE) {
            throw new ValidationException("Wallet is not available for monetization");
        }
        BigDecimal price = properties.getPriceZec();
        GatewayInvoice invoice = paymentGateway.createInvoice(requesterId, price, "wallet_data_" + walletId).block();
        if (invoice == null || invoice.invoiceId() == null) {
            throw new UpstreamException("Payment gateway returned no invoice");
        }

        DataAccessPayment payment = new DataAccessPayment();
        payment.setRequesterId(requesterId);
        payment.setWalletId(walletId);
        payment.setOwnerId(privacyService.getOwnerId(walletId));
        payment.setInvoiceId(invoice.invoiceId());
        payment.setAmountZec(price);
        payment.setEmail(email);
        payment.setPaymentAddress(invoice.address());
        payment.setPaymentUri(invoice.paymentUri());
        payment.setQrCode(invoice.qrCode());
        payment.setCreatedAt(Instant.now());
        paymentRepository.save(payment);
        log.info("Data access invoice {} created for wallet {} by {}", invoice.invoiceId(), walletId, requesterId);

        return new PaymentInvoice(invoice.invoiceId(), walletId, invoice.address(), price,
                invoice.qrCode(), invoice.paymentUri(), invoice.expiresAt());
    }

    /**
     * Polls the gateway for a recorded invoice. The first caller to observe the paid transition credits the
     * owner; later polls return the stored state without calling the gateway.
     */
    public PaymentStatusResult checkPaymentStatus(String invoiceId) {
        DataAccessPayment payment = paymentRepository.findByInvoiceId(invoiceId)
                .orElseThrow(() -> new NotFoundException("Invoice not found: " + invoiceId));
        if (payment.getStatus() == DataAccessPayment.PaymentStatus.PAID) {
            return new PaymentStatusResult(invoiceId, payment.getWalletId(), true, payment.getPaidAt(), payment.getTxid());
        }
        GatewayPaymentCheck check = paymentGateway.checkPayment(invoiceId).block();
        if (check == null || !check.paid()) {
            return new PaymentStatusResult(invoiceId, payment.getWalletId(), false, null, null);
        }
        Instant paidAt = Instant.now();
        return paymentRepository.markPaidIfPending(invoiceId, check.txid(), paidAt)
                .map(paid -> {
                    log.info("Invoice {} paid (txid {})", invoiceId, paid.getTxid());
                    creditEarnings(paid);
                    return new PaymentStatusResult(invoiceId, paid.getWalletId(), true, paid.getPaidAt(), paid.getTxid());
                })
                .orElseGet(() -> {
                    DataAccessPayment current = paymentRepository.findByInvoiceId(invoiceId).orElse(payment);
                    return new PaymentStatusResult(invoiceId, current.getWalletId(), true,
                            current.getPaidAt(), current.getTxid());
                });
    }

    Earnings creditEarnings(DataAccessPayment payment) {
        BigDecimal total = payment.getAmountZec();
        BigDecimal ownerShare = total.multiply(BigDecimal.valueOf(properties.getOwnerSharePercentage()))
                .divide(BigDecimal.valueOf(100), ZEC_SCALE, RoundingMode.HALF_DOWN);
        Earnings e = new Earnings();
        e.setOwnerId(payment.getOwnerId() != null ? payment.getOwnerId() : privacyService.getOwnerId(payment.getWalletId()));
        e.setWalletId(payment.getWalletId());
        e.setPaymentId(payment.getId());
        e.setAmountZec(ownerShare);
        e.setPlatformFeeZec(total.subtract(ownerShare));
        e.setCreatedAt(Instant.now());
        Earnings saved = earningsRepository.save(e);
        log.info("Credited {} ZEC to owner {} for wallet {}", ownerShare, saved.getOwnerId(), saved.getWalletId());
        return saved;
    }

    public boolean hasAccessToWallet(String requesterId, String walletId) {
        return requesterId != null && paymentRepository.existsByRequesterIdAndWalletIdAndStatus(
                requesterId, walletId, DataAccessPayment.PaymentStatus.PAID);
    }

    public AccessDecision checkDataAccess(String walletId, String requesterId) {
        return privacyService.checkDataAccess(walletId, requesterId, hasAccessToWallet(requesterId, walletId));
    }

    /** Wallet data at the level the requester's privacy and payment status allow. */
    public WalletData getWalletDataForRequester(String walletId, String requesterId) {
        return privacyService.getAccessibleWalletData(walletId, requesterId, hasAccessToWallet(requesterId, walletId));
    }

    public EarningsSummary getOwnerEarnings(String ownerId) {
        List<Earnings> all = earningsRepository.findByOwnerId(ownerId);
        BigDecimal earned = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        BigDecimal pending = BigDecimal.ZERO;
        BigDecimal withdrawn = BigDecimal.ZERO;
        long sales = all.stream().map(Earnings::getPaymentId).distinct().count();
        for (Earnings e : all) {
            earned = earned.add(e.getAmountZec());
            fees = fees.add(e.getPlatformFeeZec() == null ? BigDecimal.ZERO : e.getPlatformFeeZec());
            if (e.getStatus() == Earnings.EarningsStatus.PENDING) {
                pending = pending.add(e.getAmountZec());
            } else {
                withdrawn = withdrawn.add(e.getAmountZec());
            }
        }
        return new EarningsSummary((int) sales, earned, fees, pending, withdrawn, pending);
    }

    /**
     * Pays out {@code amountZec} from the owner's pending earnings, oldest first. Rows are marked withdrawn
     * only for the amount actually consumed; a row needed only in part is split and its remainder stays
     * pending. The rows are reserved before the gateway call, so a payout that went out can never be paid
     * again; a gateway refusal releases them.
     *
     * @throws InsufficientBalanceException if the amount exceeds pending earnings
     * @throws UpstreamException            if the gateway refuses the payout
     */
    public WithdrawalResult requestWithdrawal(String ownerId, String toAddress, BigDecimal amountZec) {
        if (amountZec == null || amountZec.signum() <= 0) {
            throw new ValidationException("Withdrawal amount must be greater than 0");
        }
        if (toAddress == null || toAddress.isBlank()) {
            throw new ValidationException("Withdrawal address is required");
        }
        ReentrantLock lock = ownerLocks.get(ownerId);
        lock.lock();
        try {
            List<Earnings> pending = new ArrayList<>(earningsRepository
                    .findByOwnerIdAndStatusOrderByCreatedAtAsc(ownerId, Earnings.EarningsStatus.PENDING));
            pending.sort(Comparator.comparing(Earnings::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
            BigDecimal available = pending.stream().map(Earnings::getAmountZec).reduce(BigDecimal.ZERO, BigDecimal::add);
            if (amountZec.compareTo(available) > 0) {
                throw new InsufficientBalanceException("Insufficient balance for withdrawal: requested "
                        + amountZec.toPlainString() + " ZEC, available " + available.toPlainString() + " ZEC");
            }

            Instant now = Instant.now();
            Withdrawal withdrawal = new Withdrawal();
            withdrawal.setOwnerId(ownerId);
            withdrawal.setToAddress(toAddress);
            withdrawal.setAmountZec(amountZec);
            withdrawal.setCreatedAt(now);
            withdrawal = withdrawalRepository.save(withdrawal);

            Reservation reservation = reserve(pending, amountZec, withdrawal.getId(), now);
            withdrawal.setEarningIds(reservation.consumed().stream().map(Earnings::getId).toList());
            withdrawal.setConsumedZec(reservation.consumed().stream().map(Earnings::getAmountZec)
                    .reduce(BigDecimal.ZERO, BigDecimal::add));

            GatewayWithdrawal gw = submitOrRelease(withdrawal, reservation, ownerId, toAddress, amountZec);

            withdrawal.setGatewayWithdrawalId(gw.withdrawalId());
            withdrawal.setStatus(Withdrawal.WithdrawalStatus.SUBMITTED);
            try {
                withdrawalRepository.save(withdrawal);
            } catch (RuntimeException e) {
                // payout is out and the rows stay reserved; only the gateway reference is missing
                log.error("Withdrawal {} paid out as gateway withdrawal {} but could not be marked submitted",
                        withdrawal.getId(), gw.withdrawalId(), e);
            }
            log.info("Withdrawal {} of {} ZEC for owner {} consumed {} earnings rows",
                    withdrawal.getId(), amountZec, ownerId, reservation.consumed().size());
            return new WithdrawalResult(withdrawal.getId(), gw.withdrawalId(), amountZec, toAddress,
                    reservation.consumed().size(), "pending", now);
        } finally {
            lock.unlock();
        }
    }

    private GatewayWithdrawal submitOrRelease(Withdrawal withdrawal, Reservation reservation, String ownerId,
                                              String toAddress, BigDecimal amountZec) {
        GatewayWithdrawal gw;
        try {
            gw = paymentGateway.createWithdrawal(ownerId, toAddress, amountZec).block();
        } catch (RuntimeException e) {
            release(withdrawal, reservation);
            throw e;
        }
        if (gw == null || gw.withdrawalId() == null) {
            release(withdrawal, reservation);
            throw new UpstreamException("Payment gateway returned no withdrawal");
        }
        return gw;
    }

    /** Marks the rows covering {@code amount} withdrawn, splitting the last one if it is needed only in part. */
    private Reservation reserve(List<Earnings> pending, BigDecimal amount, String withdrawalId, Instant now) {
        List<Earnings> toSave = new ArrayList<>();
        Earnings shrunk = null;
        String splitPaymentId = null;
        BigDecimal remaining = amount;
        for (Earnings e : pending) {
            if (remaining.signum() <= 0) {
                break;
            }
            if (e.getAmountZec().compareTo(remaining) <= 0) {
                markWithdrawn(e, withdrawalId, now);
                remaining = remaining.subtract(e.getAmountZec());
                toSave.add(e);
            } else {
                Earnings part = new Earnings();
                part.setOwnerId(e.getOwnerId());
                part.setWalletId(e.getWalletId());
                part.setPaymentId(e.getPaymentId() + "/" + withdrawalId);
                part.setAmountZec(remaining);
                part.setPlatformFeeZec(BigDecimal.ZERO);
                part.setCreatedAt(e.getCreatedAt());
                markWithdrawn(part, withdrawalId, now);
                e.setAmountZec(e.getAmountZec().subtract(remaining));
                remaining = BigDecimal.ZERO;
                shrunk = e;
                splitPaymentId = part.getPaymentId();
                toSave.add(e);
                toSave.add(part);
            }
        }
        List<Earnings> saved = earningsRepository.saveAll(toSave);
        List<Earnings> consumed = saved.stream().filter(s -> s.getStatus() == Earnings.EarningsStatus.WITHDRAWN).toList();
        return new Reservation(consumed, shrunk, splitPaymentId);
    }

    /** Undoes {@link #reserve}: whole rows go back to pending, a split part is merged into its source row. */
    private void release(Withdrawal withdrawal, Reservation reservation) {
        try {
            List<Earnings> restored = new ArrayList<>();
            for (Earnings e : reservation.consumed()) {
                if (reservation.shrunk() != null && Objects.equals(e.getPaymentId(), reservation.splitPaymentId())) {
                    reservation.shrunk().setAmountZec(reservation.shrunk().getAmountZec().add(e.getAmountZec()));
                    earningsRepository.delete(e);
                } else {
                    e.setStatus(Earnings.EarningsStatus.PENDING);
                    e.setWithdrawalId(null);
                    e.setWithdrawnAt(null);
                    restored.add(e);
                }
            }
            if (reservation.shrunk() != null) {
                restored.add(reservation.shrunk());
            }
            earningsRepository.saveAll(restored);
            withdrawal.setStatus(Withdrawal.WithdrawalStatus.FAILED);
            withdrawalRepository.save(withdrawal);
            log.warn("Withdrawal {} refused by the gateway, released {} earnings rows",
                    withdrawal.getId(), reservation.consumed().size());
        } catch (RuntimeException e) {
            log.error("Withdrawal {} refused by the gateway and its reserved rows could not be released",
                    withdrawal.getId(), e);
        }
    }

    private record Reservation(List<Earnings> consumed, Earnings shrunk, String splitPaymentId) {
    }

    private static void markWithdrawn(Earnings e, String withdrawalId, Instant now) {
        e.setStatus(Earnings.EarningsStatus.WITHDRAWN);
        e.setWithdrawalId(withdrawalId);
        e.setWithdrawnAt(now);
    }

    public List<Withdrawal> getWithdrawalHistory(String ownerId) {
        return withdrawalRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    /** Monetizable wallets only, best productivity first, then most purchased. */
    public List<MarketplaceListing> getMarketplaceListing(MarketplaceFilter filter) {
        MarketplaceFilter f = filter == null ? MarketplaceFilter.none() : filter;
        int limit = f.limit() == null ? properties.getMarketplaceDefaultLimit() : f.limit();
        if (limit < 1 || limit > MAX_MARKETPLACE_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_MARKETPLACE_LIMIT);
        }
        List<MarketplaceListing> listings = new ArrayList<>();
        for (MonetizableWallet w : privacyService.getMonetizableWallets()) {
            if (f.walletType() != null && f.walletType() != w.walletType()) {
                continue;
            }
            if (f.minProductivityScore() != null
                    && (w.productivityScore() == null || w.productivityScore() < f.minProductivityScore())) {
                continue;
            }
            long purchases = paymentRepository.countByWalletIdAndStatus(w.walletId(), DataAccessPayment.PaymentStatus.PAID);
            listings.add(new MarketplaceListing(w.walletId(), w.walletType(), w.projectCategory(), properties.getPriceZec(),
                    new MarketplaceListing.MetricsPreview(w.activeDays(), w.totalTransactions(), w.productivityScore()),
                    purchases));
        }
        listings.sort(Comparator
                .comparing((MarketplaceListing l) -> l.metricsPreview().productivityScore(),
                        Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(MarketplaceListing::purchaseCount, Comparator.reverseOrder()));
        return listings.size() > limit ? listings.subList(0, limit) : listings;
    }
}
