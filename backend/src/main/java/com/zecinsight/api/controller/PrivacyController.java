package com.zecinsight.api.controller;

import com.zecinsight.api.dto.ApiResponse;
import com.zecinsight.api.dto.PrivacyModeRequest;
import com.zecinsight.domain.Wallet;
import com.zecinsight.monetization.MonetizationService;
import com.zecinsight.privacy.PrivacyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Wallet and project privacy modes, access checks and privacy-gated wallet data.
 */
@RestController
@RequestMapping("/api/v1/privacy")
@RequiredArgsConstructor
public class PrivacyController {

    private final PrivacyService privacyService;
    private final MonetizationService monetizationService;

    @GetMapping("/wallets/{walletId}")
    public ResponseEntity<?> getPrivacyMode(@PathVariable String walletId) {
        return ResponseEntity.ok(ApiResponse.ok(Map.of(
                "wallet_id", walletId,
                "privacy_mode", privacyService.getPrivacyMode(walletId))));
    }

    @PutMapping("/wallets/{walletId}")
    public ResponseEntity<?> setPrivacyMode(@PathVariable String walletId,
                                            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
                                            @Valid @RequestBody PrivacyModeRequest request) {
        privacyService.requireOwner(walletId, userId);
        Wallet wallet = privacyService.setPrivacyPreference(walletId, request.privacyMode());
        return ResponseEntity.ok(ApiResponse.ok(Map.of(
                "wallet_id", wallet.getId(),
                "privacy_mode", wallet.getPrivacyMode()), "Privacy preference updated"));
    }

    @PutMapping("/projects/{projectId}")
    public ResponseEntity<?> setProjectPrivacyMode(@PathVariable String projectId,
                                                   @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
                                                   @Valid @RequestBody PrivacyModeRequest request) {
        privacyService.requireProjectOwner(projectId, userId);
        int updated = privacyService.setProjectPrivacyPreference(projectId, request.privacyMode());
        return ResponseEntity.ok(ApiResponse.ok(Map.of(
                "project_id", projectId,
                "privacy_mode", request.privacyMode().toLowerCase(),
                "wallets_updated", updated), "Privacy preference updated for " + updated + " wallets"));
    }

    @GetMapping("/projects/{projectId}/stats")
    public ResponseEntity<?> getProjectStats(@PathVariable String projectId) {
        return ResponseEntity.ok(ApiResponse.ok(privacyService.getProjectPrivacyStats(projectId)));
    }

    @GetMapping("/wallets/{walletId}/access")
    public ResponseEntity<?> checkAccess(@PathVariable String walletId,
                                         @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(monetizationService.checkDataAccess(walletId, userId)));
    }

    @GetMapping("/wallets/{walletId}/data")
    public ResponseEntity<?> getWalletData(@PathVariable String walletId,
                                           @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(monetizationService.getWalletDataForRequester(walletId, userId)));
    }

    @GetMapping("/wallets/{walletId}/audit")
    public ResponseEntity<?> getAuditLog(@PathVariable String walletId,
                                         @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId) {
        privacyService.requireOwner(walletId, userId);
        return ResponseEntity.ok(ApiResponse.ok(privacyService.getAuditLog(walletId)));
    }
}
