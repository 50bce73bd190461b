package com.zookies.zkbackend.controller;

import com.zookies.zkbackend.model.OperationResult;
import com.zookies.zkbackend.model.attestation.AttestationStatistics;
import com.zookies.zkbackend.model.attestation.PublisherInfo;
import com.zookies.zkbackend.model.attestation.StoredAttestation;
import com.zookies.zkbackend.service.attestation.AttestationStoreService;
import com.zookies.zkbackend.service.attestation.PublisherKeyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Profile", description = "Endpoints for wallet profiles and publisher information")
public class ProfileController {

    private final AttestationStoreService storeService;
    private final PublisherKeyService publisherKeyService;

    @Operation(summary = "Get the attestations and statistics of a wallet")
    @GetMapping("/profile/{wallet}")
    public ResponseEntity<?> getProfile(@PathVariable @NotBlank String wallet) {
        log.info("Load profile for wallet: {}", wallet);
        try {
            OperationResult<List<StoredAttestation>> attestations = storeService.getAttestations(wallet, null);
            if (!attestations.isSuccess()) {
                return ErrorResponses.of(attestations.getErrorCode(), attestations.getError());
            }
            OperationResult<AttestationStatistics> statistics = storeService.getStatistics(wallet);
            if (!statistics.isSuccess()) {
                return ErrorResponses.of(statistics.getErrorCode(), statistics.getError());
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("wallet", wallet);
            body.put("attestations", attestations.getValue());
            body.put("statistics", statistics.getValue());
            body.put("timestamp", Instant.now().toString());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("Failed to load profile for wallet: {}", wallet, e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Error loading profile: " + e.getMessage());
        }
    }

    @Operation(summary = "Delete all attestations of a wallet")
    @DeleteMapping("/profile/{wallet}")
    public ResponseEntity<?> resetProfile(@PathVariable @NotBlank String wallet) {
        log.info("Reset profile for wallet: {}", wallet);
        try {
            OperationResult<Integer> result = storeService.resetWallet(wallet);
            if (!result.isSuccess()) {
                return ErrorResponses.of(result.getErrorCode(), result.getError());
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("wallet", wallet);
            body.put("deletedCount", result.getValue());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("Failed to reset profile for wallet: {}", wallet, e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Error resetting profile: " + e.getMessage());
        }
    }

    @Operation(summary = "List configured publishers with their public keys")
    @GetMapping("/publishers")
    public ResponseEntity<List<PublisherInfo>> listPublishers() {
        return ResponseEntity.ok(publisherKeyService.listPublishers());
    }

}
