package com.zecinsight.monetization;

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
import com.zecinsight.domain.WalletType;
import com.zecinsight.domain.Withdrawal;
import com.zecinsight.domain.WithdrawalRepository;
import com.zecinsight.monetization.config.MonetizationProperties;
import com.zecinsight.monetization.gateway.GatewayInvoice;
import com.zecinsight.monetization.gateway.GatewayPaymentCheck;
import com.zecinsight.monetization.gateway.GatewayWithdrawal;
import com.zecinsight.monetization.gateway.PaymentGateway;
import com.zecinsight.privacy.MonetizableWallet;
import com.zecinsight.privacy.PrivacyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MonetizationServiceTest {

    private static final String OWNER = "owner-1";
    private static final String ADDRESS = "zs1z7rejlpsa98s2rrrfkwmaxu53e4ue0ulcrw0h4x5g8jl04tak0d3mm47vdtahatqrlkngh9sly";

    @Mock
    private PrivacyService privacyService;
    @Mock
    private PaymentGateway paymentGateway;
    @Mock
    private DataAccessPaymentRepository paymentRepository;
    @Mock
    private EarningsRepository earningsRepository;
    @Mock
    private WithdrawalRepository withdrawalRepository;

    private MonetizationService service;

    @BeforeEach
    void setUp() {
        service = new MonetizationService(privacyService, paymentGateway, paymentRepository, earningsRepository,
                withdrawalRepository, new MonetizationProperties());
    }

    private static Earnings pending(String id, String amount, Instant createdAt) {
        Earnings e = new Earnings();
        e.setId(id);
        e.setOwnerId(OWNER);
        e.setWalletId("w1");
        e.setPaymentId("pay-" + id);
        e.setAmountZec(new BigDecimal(amount));
        e.setPlatformFeeZec(BigDecimal.ZERO);
        e.setCreatedAt(createdAt);
        return e;
    }

    private void stubPending(Earnings... rows) {
        when(earningsRepository.findByOwnerIdAndStatusOrderByCreatedAtAsc(OWNER, Earnings.EarningsStatus.PENDING))
                .thenReturn(new ArrayList<>(List.of(rows)));
    }

    private void stubWithdrawalSaves() {
        when(withdrawalRepository.save(any(Withdrawal.class))).thenAnswer(inv -> {
            Withdrawal w = inv.getArgument(0);
            if (w.getId() == null) {
                w.setId("wd-1");
            }
            return w;
        });
        when(earningsRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("withdrawing more than pending earnings fails without calling the gateway")
    void requestWithdrawal_insufficientBalance() {
        stubPending(pending("e1", "0.0007", Instant.parse("2025-03-01T00:00:00Z")));

        assertThatThrownBy(() -> service.requestWithdrawal(OWNER, ADDRESS, new BigDecimal("0.001")))
                .isInstanceOf(InsufficientBalanceException.class)
                .hasMessageContaining("0.0007");
        verify(paymentGateway, never()).createWithdrawal(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("non-positive amount is rejected")
    void requestWithdrawal_nonPositive_rejected() {
        assertThatThrownBy(() -> service.requestWithdrawal(OWNER, ADDRESS, BigDecimal.ZERO))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("withdrawal consumes oldest rows first and splits the row needed only in part")
    @SuppressWarnings("unchecked")
    void requestWithdrawal_splitsPartialRow() {
        Earnings older = pending("e1", "0.0007", Instant.parse("2025-03-01T00:00:00Z"));
        Earnings newer = pending("e2", "0.0007", Instant.parse("2025-03-02T00:00:00Z"));
        stubPending(newer, older);
        stubWithdrawalSaves();
        when(paymentGateway.createWithdrawal(OWNER, ADDRESS, new BigDecimal("0.001")))
                .thenReturn(Mono.just(new GatewayWithdrawal("gw-9", "pending")));

        WithdrawalResult result = service.requestWithdrawal(OWNER, ADDRESS, new BigDecimal("0.001"));

        assertThat(result.gatewayWithdrawalId()).isEqualTo("gw-9");
        assertThat(result.status()).isEqualTo("pending");
        assertThat(result.earningsConsumed()).isEqualTo(2);
        assertThat(older.getStatus()).isEqualTo(Earnings.EarningsStatus.WITHDRAWN);
        assertThat(newer.getStatus()).isEqualTo(Earnings.EarningsStatus.PENDING);
        assertThat(newer.getAmountZec()).isEqualByComparingTo("0.0004");

        ArgumentCaptor<List<Earnings>> saved = ArgumentCaptor.forClass(List.class);
        verify(earningsRepository).saveAll(saved.capture());
        Earnings part = saved.getValue().stream()
                .filter(e -> e.getId() == null)
                .findFirst().orElseThrow();
        assertThat(part.getAmountZec()).isEqualByComparingTo("0.0003");
        assertThat(part.getStatus()).isEqualTo(Earnings.EarningsStatus.WITHDRAWN);
        assertThat(part.getWithdrawalId()).isEqualTo("wd-1");
        assertThat(part.getPaymentId()).isEqualTo("pay-e2/wd-1");
    }

    @Test
    @DisplayName("exact withdrawal marks every pending row withdrawn and leaves no remainder")
    void requestWithdrawal_exactAmount() {
        Earnings e1 = pending("e1", "0.0007", Instant.parse("2025-03-01T00:00:00Z"));
        Earnings e2 = pending("e2", "0.0007", Instant.parse("2025-03-02T00:00:00Z"));
        stubPending(e1, e2);
        stubWithdrawalSaves();
        when(paymentGateway.createWithdrawal(eq(OWNER), eq(ADDRESS), any()))
                .thenReturn(Mono.just(new GatewayWithdrawal("gw-1", "pending")));

        WithdrawalResult result = service.requestWithdrawal(OWNER, ADDRESS, new BigDecimal("0.0014"));

        assertThat(result.earningsConsumed()).isEqualTo(2);
        assertThat(e1.getStatus()).isEqualTo(Earnings.EarningsStatus.WITHDRAWN);
        assertThat(e2.getStatus()).isEqualTo(Earnings.EarningsStatus.WITHDRAWN);
        ArgumentCaptor<Withdrawal> withdrawal = ArgumentCaptor.forClass(Withdrawal.class);
        verify(withdrawalRepository, times(2)).save(withdrawal.capture());
        Withdrawal last = withdrawal.getAllValues().get(1);
        assertThat(last.getConsumedZec()).isEqualByComparingTo("0.0014");
        assertThat(last.getEarningIds()).containsExactly("e1", "e2");
        assertThat(last.getStatus()).isEqualTo(Withdrawal.WithdrawalStatus.SUBMITTED);
    }

    @Test
    @DisplayName("gateway refusal releases the reserved rows and marks the withdrawal failed")
    void requestWithdrawal_gatewayFailure_releasesReservation() {
        Earnings e1 = pending("e1", "0.0007", Instant.parse("2025-03-01T00:00:00Z"));
        stubPending(e1);
        stubWithdrawalSaves();
        when(paymentGateway.createWithdrawal(eq(OWNER), eq(ADDRESS), any()))
                .thenReturn(Mono.error(new UpstreamException("Payment gateway createWithdrawal failed: 503")));

        assertThatThrownBy(() -> service.requestWithdrawal(OWNER, ADDRESS, new BigDecimal("0.0007")))
                .isInstanceOf(UpstreamException.class);

        assertThat(e1.getStatus()).isEqualTo(Earnings.EarningsStatus.PENDING);
        assertThat(e1.getWithdrawalId()).isNull();
        ArgumentCaptor<Withdrawal> withdrawal = ArgumentCaptor.forClass(Withdrawal.class);
        verify(withdrawalRepository, times(2)).save(withdrawal.capture());
        assertThat(withdrawal.getAllValues().get(1).getStatus()).isEqualTo(Withdrawal.WithdrawalStatus.FAILED);
    }

    @Test
    @DisplayName("gateway refusal merges a split part back into its source row")
    void requestWithdrawal_gatewayFailure_mergesSplitPart() {
        Earnings e1 = pending("e1", "0.0007", Instant.parse("2025-03-01T00:00:00Z"));
        stubPending(e1);
        stubWithdrawalSaves();
        when(paymentGateway.createWithdrawal(eq(OWNER), eq(ADDRESS), any())).thenReturn(Mono.empty());

        assertThatThrownBy(() -> service.requestWithdrawal(OWNER, ADDRESS, new BigDecimal("0.0005")))
                .isInstanceOf(UpstreamException.class)
                .hasMessage("Payment gateway returned no withdrawal");

        assertThat(e1.getStatus()).isEqualTo(Earnings.EarningsStatus.PENDING);
        assertThat(e1.getAmountZec()).isEqualByComparingTo("0.0007");
        ArgumentCaptor<Earnings> deleted = ArgumentCaptor.forClass(Earnings.class);
        verify(earningsRepository).delete(deleted.capture());
        assertThat(deleted.getValue().getPaymentId()).isEqualTo("pay-e1/wd-1");
    }

    @Test
    @DisplayName("earnings already paid out stay consumed when recording the gateway reference fails")
    void requestWithdrawal_saveFailsAfterPayout_noSecondPayout() {
        List<Earnings> rows = List.of(pending("e1", "0.0007", Instant.parse("2025-03-01T00:00:00Z")));
        when(earningsRepository.findByOwnerIdAndStatusOrderByCreatedAtAsc(OWNER, Earnings.EarningsStatus.PENDING))
                .thenAnswer(inv -> rows.stream().filter(e -> e.getStatus() == Earnings.EarningsStatus.PENDING).toList());
        when(earningsRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
        when(withdrawalRepository.save(any(Withdrawal.class))).thenAnswer(inv -> {
            Withdrawal w = inv.getArgument(0);
            if (w.getStatus() == Withdrawal.WithdrawalStatus.SUBMITTED) {
                throw new DataAccessResourceFailureException("write timed out");
            }
            w.setId("wd-1");
            return w;
        });
        when(paymentGateway.createWithdrawal(eq(OWNER), eq(ADDRESS), any()))
                .thenReturn(Mono.just(new GatewayWithdrawal("gw-1", "pending")));

        WithdrawalResult first = service.requestWithdrawal(OWNER, ADDRESS, new BigDecimal("0.0007"));

        assertThat(first.gatewayWithdrawalId()).isEqualTo("gw-1");
        assertThat(rows.get(0).getStatus()).isEqualTo(Earnings.EarningsStatus.WITHDRAWN);
        assertThatThrownBy(() -> service.requestWithdrawal(OWNER, ADDRESS, new BigDecimal("0.0007")))
                .isInstanceOf(InsufficientBalanceException.class);
        verify(paymentGateway, times(1)).createWithdrawal(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("failure to reserve the rows never reaches the gateway")
    void requestWithdrawal_reserveFails_noPayout() {
        stubPending(pending("e1", "0.0007", Instant.parse("2025-03-01T00:00:00Z")));
        when(withdrawalRepository.save(any(Withdrawal.class))).thenAnswer(inv -> {
            Withdrawal w = inv.getArgument(0);
            w.setId("wd-1");
            return w;
        });
        when(earningsRepository.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("primary down"));

        assertThatThrownBy(() -> service.requestWithdrawal(OWNER, ADDRESS, new BigDecimal("0.0007")))
                .isInstanceOf(DataAccessResourceFailureException.class);
        verify(paymentGateway, never()).createWithdrawal(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("two concurrent withdrawals against one balance pay out only once")
    void requestWithdrawal_concurrentSameOwner_serialized() throws Exception {
        List<Earnings> rows = new CopyOnWriteArrayList<>(List.of(
                pending("e1", "0.0007", Instant.parse("2025-03-01T00:00:00Z")),
                pending("e2", "0.0007", Instant.parse("2025-03-02T00:00:00Z"))));
        when(earningsRepository.findByOwnerIdAndStatusOrderByCreatedAtAsc(OWNER, Earnings.EarningsStatus.PENDING))
                .thenAnswer(inv -> rows.stream().filter(e -> e.getStatus() == Earnings.EarningsStatus.PENDING).toList());
        when(earningsRepository.saveAll(anyList())).thenAnswer(inv -> {
            List<Earnings> saved = inv.getArgument(0);
            saved.stream().filter(e -> e.getId() == null).forEach(e -> {
                e.setId("split-" + rows.size());
                rows.add(e);
            });
            return saved;
        });
        AtomicInteger withdrawalIds = new AtomicInteger();
        when(withdrawalRepository.save(any(Withdrawal.class))).thenAnswer(inv -> {
            Withdrawal w = inv.getArgument(0);
            if (w.getId() == null) {
                w.setId("wd-" + withdrawalIds.incrementAndGet());
            }
            return w;
        });
        when(paymentGateway.createWithdrawal(eq(OWNER), eq(ADDRESS), any()))
                .thenReturn(Mono.just(new GatewayWithdrawal("gw-1", "pending")).delayElement(Duration.ofMillis(100)));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<WithdrawalResult>> calls = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                calls.add(pool.submit(() -> {
                    start.await();
                    return service.requestWithdrawal(OWNER, ADDRESS, new BigDecimal("0.001"));
                }));
            }
            start.countDown();
            int succeeded = 0;
            int refused = 0;
            for (Future<WithdrawalResult> call : calls) {
                try {
                    call.get(5, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(InsufficientBalanceException.class);
                    refused++;
                }
            }
            assertThat(succeeded).isEqualTo(1);
            assertThat(refused).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        verify(paymentGateway, times(1)).createWithdrawal(anyString(), anyString(), any());
        BigDecimal stillPending = rows.stream().filter(e -> e.getStatus() == Earnings.EarningsStatus.PENDING)
                .map(Earnings::getAmountZec).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(stillPending).isEqualByComparingTo("0.0004");
    }

    @Test
    @DisplayName("purchase of a non-monetizable wallet is rejected before invoicing")
    void createDataAccessPayment_notMonetizable_rejected() {
        Wallet wallet = new Wallet();
        wallet.setId("w1");
        wallet.setPrivacyMode(PrivacyMode.PUBLIC);
        when(privacyService.requireWallet("w1")).thenReturn(wallet);

        assertThatThrownBy(() -> service.createDataAccessPayment("buyer", "w1", null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Wallet is not available for monetization");
        verify(paymentGateway, never()).createInvoice(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("purchase records a pending payment with the invoice details")
    void createDataAccessPayment_recordsPendingPayment() {
        Wallet wallet = new Wallet();
        wallet.setId("w1");
        wallet.setPrivacyMode(PrivacyMode.MONETIZABLE);
        when(privacyService.requireWallet("w1")).thenReturn(wallet);
        when(privacyService.getOwnerId("w1")).thenReturn(OWNER);
        when(paymentGateway.createInvoice("buyer", new BigDecimal("0.001"), "wallet_data_w1"))
                .thenReturn(Mono.just(new GatewayInvoice("inv-1", ADDRESS, new BigDecimal("0.001"), "qr", "zcash:uri", null)));

        PaymentInvoice invoice = service.createDataAccessPayment("buyer", "w1", "buyer@example.com");

        assertThat(invoice.invoiceId()).isEqualTo("inv-1");
        assertThat(invoice.paymentAddress()).isEqualTo(ADDRESS);
        ArgumentCaptor<DataAccessPayment> payment = ArgumentCaptor.forClass(DataAccessPayment.class);
        verify(paymentRepository).save(payment.capture());
        assertThat(payment.getValue().getStatus()).isEqualTo(DataAccessPayment.PaymentStatus.PENDING);
        assertThat(payment.getValue().getOwnerId()).isEqualTo(OWNER);
    }

    @Test
    @DisplayName("first observer of the paid transition credits the owner 70% of the price")
    void checkPaymentStatus_paidTransition_creditsOnce() {
        DataAccessPayment pendingPayment = new DataAccessPayment();
        pendingPayment.setId("pay-1");
        pendingPayment.setInvoiceId("inv-1");
        pendingPayment.setWalletId("w1");
        pendingPayment.setOwnerId(OWNER);
        pendingPayment.setAmountZec(new BigDecimal("0.001"));
        DataAccessPayment paid = new DataAccessPayment();
        paid.setId("pay-1");
        paid.setInvoiceId("inv-1");
        paid.setWalletId("w1");
        paid.setOwnerId(OWNER);
        paid.setAmountZec(new BigDecimal("0.001"));
        paid.setStatus(DataAccessPayment.PaymentStatus.PAID);
        paid.setTxid("tx-1");
        when(paymentRepository.findByInvoiceId("inv-1")).thenReturn(Optional.of(pendingPayment));
        when(paymentGateway.checkPayment("inv-1")).thenReturn(Mono.just(
                new GatewayPaymentCheck(true, new GatewayPaymentCheck.InvoiceState("tx-1", null))));
        when(paymentRepository.markPaidIfPending(eq("inv-1"), eq("tx-1"), any())).thenReturn(Optional.of(paid));
        when(earningsRepository.save(any(Earnings.class))).thenAnswer(inv -> inv.getArgument(0));

        PaymentStatusResult result = service.checkPaymentStatus("inv-1");

        assertThat(result.paid()).isTrue();
        assertThat(result.paidTxid()).isEqualTo("tx-1");
        ArgumentCaptor<Earnings> earnings = ArgumentCaptor.forClass(Earnings.class);
        verify(earningsRepository).save(earnings.capture());
        assertThat(earnings.getValue().getAmountZec()).isEqualByComparingTo("0.0007");
        assertThat(earnings.getValue().getPlatformFeeZec()).isEqualByComparingTo("0.0003");
        assertThat(earnings.getValue().getPaymentId()).isEqualTo("pay-1");
    }

    @Test
    @DisplayName("losing the paid transition race does not credit again")
    void checkPaymentStatus_alreadyTransitioned_noCredit() {
        DataAccessPayment pendingPayment = new DataAccessPayment();
        pendingPayment.setInvoiceId("inv-1");
        pendingPayment.setWalletId("w1");
        when(paymentRepository.findByInvoiceId("inv-1")).thenReturn(Optional.of(pendingPayment));
        when(paymentGateway.checkPayment("inv-1")).thenReturn(Mono.just(
                new GatewayPaymentCheck(true, new GatewayPaymentCheck.InvoiceState("tx-1", null))));
        when(paymentRepository.markPaidIfPending(eq("inv-1"), eq("tx-1"), any())).thenReturn(Optional.empty());

        PaymentStatusResult result = service.checkPaymentStatus("inv-1");

        assertThat(result.paid()).isTrue();
        verify(earningsRepository, never()).save(any());
    }

    @Test
    @DisplayName("already paid invoice is answered from the record without calling the gateway")
    void checkPaymentStatus_alreadyPaid_skipsGateway() {
        DataAccessPayment paid = new DataAccessPayment();
        paid.setInvoiceId("inv-1");
        paid.setWalletId("w1");
        paid.setStatus(DataAccessPayment.PaymentStatus.PAID);
        paid.setTxid("tx-1");
        when(paymentRepository.findByInvoiceId("inv-1")).thenReturn(Optional.of(paid));

        assertThat(service.checkPaymentStatus("inv-1").paid()).isTrue();
        verify(paymentGateway, never()).checkPayment(anyString());
    }

    @Test
    @DisplayName("unknown invoice is not found")
    void checkPaymentStatus_unknownInvoice_notFound() {
        when(paymentRepository.findByInvoiceId("nope")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> service.checkPaymentStatus("nope")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("earnings summary splits pending from withdrawn")
    void getOwnerEarnings_sums() {
        Earnings a = pending("e1", "0.0007", Instant.now());
        Earnings b = pending("e2", "0.0007", Instant.now());
        b.setStatus(Earnings.EarningsStatus.WITHDRAWN);
        b.setPlatformFeeZec(new BigDecimal("0.0003"));
        when(earningsRepository.findByOwnerId(OWNER)).thenReturn(List.of(a, b));

        EarningsSummary summary = service.getOwnerEarnings(OWNER);

        assertThat(summary.totalSales()).isEqualTo(2);
        assertThat(summary.totalEarnedZec()).isEqualByComparingTo("0.0014");
        assertThat(summary.pendingZec()).isEqualByComparingTo("0.0007");
        assertThat(summary.withdrawnZec()).isEqualByComparingTo("0.0007");
        assertThat(summary.availableZec()).isEqualByComparingTo(summary.pendingZec());
    }

    @Test
    @DisplayName("marketplace sorts by score with unscored wallets last and filters by type")
    void getMarketplaceListing_sortsAndFilters() {
        when(privacyService.getMonetizableWallets()).thenReturn(List.of(
                new MonetizableWallet("w1", WalletType.SHIELDED, "defi", 60, 10, 40),
                new MonetizableWallet("w2", WalletType.SHIELDED, "defi", null, 3, 5),
                new MonetizableWallet("w3", WalletType.SHIELDED, "defi", 85, 20, 90),
                new MonetizableWallet("w4", WalletType.TRANSPARENT, "defi", 99, 20, 90)));
        when(paymentRepository.countByWalletIdAndStatus(anyString(), eq(DataAccessPayment.PaymentStatus.PAID)))
                .thenReturn(0L);

        List<MarketplaceListing> listings = service.getMarketplaceListing(
                new MarketplaceFilter(null, WalletType.SHIELDED, null));

        assertThat(listings).extracting(MarketplaceListing::walletId).containsExactly("w3", "w1", "w2");
        assertThat(listings.get(0).priceZec()).isEqualByComparingTo("0.001");
    }

    @Test
    @DisplayName("marketplace limit outside 1..200 is rejected")
    void getMarketplaceListing_invalidLimit() {
        assertThatThrownBy(() -> service.getMarketplaceListing(new MarketplaceFilter(null, null, 0)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.getMarketplaceListing(new MarketplaceFilter(null, null, 201)))
                .isInstanceOf(ValidationException.class);
    }
}
