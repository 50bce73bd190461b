package com.zookies.zkbackend.controller;

import com.zookies.zkbackend.model.OperationResult;
import com.zookies.zkbackend.model.attestation.Attestation;
import com.zookies.zkbackend.model.attestation.StoredAttestation;
import com.zookies.zkbackend.service.attestation.AttestationSigningService;
import com.zookies.zkbackend.service.attestation.AttestationStoreService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/attestations")
@RequiredArgsConstructor
@Tag(name = "Attestations", description = "Endpoints for signing, storing and listing interest attestations")
public class AttestationController {

    private final AttestationSigningService signingService;
    private final AttestationStoreService storeService;

    @Operation(summary = "Sign an interest attestation with a configured publisher key")
    @PostMapping("/sign")
    public ResponseEntity<?> signAttestation(@Valid @RequestBody SignRequest request) {
        log.info("Sign {} attestation for wallet {} as {}", request.getTag(), request.getWallet(), request.getPublisher());
        try {
            OperationResult<Attestation> result = signingService.sign(
                    request.getPublisher(), request.getTag(), request.getWallet(), request.getScore());
            if (!result.isSuccess()) {
                return ErrorResponses.of(result.getErrorCode(), result.getError());
            }
            return ResponseEntity.ok(result.getValue());
        } catch (Exception e) {
            log.error("Failed to sign attestation for publisher: {}", request.getPublisher(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Error signing attestation: " + e.getMessage());
        }
    }

    @Operation(summary = "Verify an attestation against its publisher's key and store it")
    @PostMapping
    public ResponseEntity<?> storeAttestation(@RequestBody Attestation attestation) {
        log.info("Store attestation {} from {}", attestation.getNonce(), attestation.getPublisher());
        try {
            OperationResult<StoredAttestation> result = storeService.verifyAndStoreAttestation(attestation);
            if (!result.isSuccess()) {
                return ErrorResponses.of(result.getErrorCode(), result.getError());
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("attestationId", result.getValue().getId());
            body.put("message", "Attestation stored successfully");
            return ResponseEntity.status(HttpStatus.CREATED).body(body);
        } catch (Exception e) {
            log.error("Failed to store attestation {}", attestation.getNonce(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Error storing attestation: " + e.getMessage());
        }
    }

    @Operation(summary = "List the attestations of a wallet, newest first")
    @GetMapping("/{wallet}")
    public ResponseEntity<?> getAttestations(@PathVariable @NotBlank String wallet,
                                             @RequestParam(required = false) String tag) {
        log.info("Load attestations for wallet {} with tag {}", wallet, tag);
        try {
            OperationResult<List<StoredAttestation>> result = storeService.getAttestations(wallet, tag);
            if (!result.isSuccess()) {
                return ErrorResponses.of(result.getErrorCode(), result.getError());
            }
            return ResponseEntity.ok(result.getValue());
        } catch (Exception e) {
            log.error("Failed to load attestations for wallet: {}", wallet, e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Error loading attestations: " + e.getMessage());
        }
    }

    @Data
    public static class SignRequest {
        @NotBlank
        private String publisher;
        @NotBlank
        private String tag;
        @NotBlank
        private String wallet;
        @Min(0)
        @Max(Attestation.MAX_SCORE)
        private Integer score;
    }

}
