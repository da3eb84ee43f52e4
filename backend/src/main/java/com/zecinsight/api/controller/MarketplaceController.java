package com.zecinsight.api.controller;

import com.zecinsight.api.dto.ApiResponse;
import com.zecinsight.api.dto.PurchaseAccessRequest;
import com.zecinsight.api.dto.WithdrawalRequest;
import com.zecinsight.common.AccessDeniedException;
import com.zecinsight.common.ValidationException;
import com.zecinsight.domain.WalletType;
import com.zecinsight.monetization.MarketplaceFilter;
import com.zecinsight.monetization.MonetizationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Marketplace listing, access purchases and owner earnings. Calls that reach the Payment Gateway run on
 * the bounded elastic scheduler, never on the event loop.
 */
@RestController
@RequestMapping("/api/v1/monetization")
@RequiredArgsConstructor
public class MarketplaceController {

    private final MonetizationService monetizationService;

    @GetMapping("/marketplace")
    public ResponseEntity<?> getMarketplace(@RequestParam(name = "min_productivity_score", required = false) Integer minScore,
                                            @RequestParam(name = "wallet_type", required = false) String walletType,
                                            @RequestParam(required = false) Integer limit) {
        WalletType type = null;
        if (walletType != null && !walletType.isBlank()) {
            type = WalletType.fromValue(walletType);
            if (type == null) {
                throw new ValidationException("Invalid wallet_type: " + walletType);
            }
        }
        MarketplaceFilter filter = new MarketplaceFilter(minScore, type, limit);
        return ResponseEntity.ok(ApiResponse.ok(monetizationService.getMarketplaceListing(filter)));
    }

    @PostMapping("/purchase")
    public Mono<ResponseEntity<?>> purchaseAccess(@RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
                                                  @Valid @RequestBody PurchaseAccessRequest request) {
        String requester = requireUser(userId);
        return Mono.fromCallable(() -> monetizationService.createDataAccessPayment(requester, request.walletId(), request.email()))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(invoice -> ResponseEntity.ok(ApiResponse.ok(invoice, "Invoice created")));
    }

    @GetMapping("/payments/{invoiceId}")
    public Mono<ResponseEntity<?>> getPaymentStatus(@PathVariable String invoiceId) {
        return Mono.fromCallable(() -> monetizationService.checkPaymentStatus(invoiceId))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(status -> ResponseEntity.ok(ApiResponse.ok(status)));
    }

    @GetMapping("/earnings")
    public ResponseEntity<?> getEarnings(@RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(monetizationService.getOwnerEarnings(requireUser(userId))));
    }

    @PostMapping("/withdrawals")
    public Mono<ResponseEntity<?>> requestWithdrawal(@RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
                                                     @Valid @RequestBody WithdrawalRequest request) {
        String owner = requireUser(userId);
        return Mono.fromCallable(() -> monetizationService.requestWithdrawal(owner, request.toAddress().trim(), request.amountZec()))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(result -> ResponseEntity.ok(ApiResponse.ok(result, "Withdrawal requested")));
    }

    @GetMapping("/withdrawals")
    public ResponseEntity<?> getWithdrawals(@RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(monetizationService.getWithdrawalHistory(requireUser(userId))));
    }

    private static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new AccessDeniedException("Authentication required");
        }
        return userId;
    }
}
