package com.zookies.zkbackend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.zookies.zkbackend.exception.ErrorCode;
import com.zookies.zkbackend.exception.ZkBackendException;
import com.zookies.zkbackend.model.proof.ProofResult;
import com.zookies.zkbackend.model.proof.ProofVerification;
import com.zookies.zkbackend.model.proof.ProvingArtifacts;
import com.zookies.zkbackend.service.proof.ProofOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/proof")
@RequiredArgsConstructor
@Tag(name = "Proof", description = "Endpoints for generating and verifying interest threshold proofs")
public class ProofController {

    private final ProofOrchestrator proofOrchestrator;

    @Operation(summary = "Generate a threshold proof over the stored attestations of a wallet")
    @PostMapping("/generate")
    public ResponseEntity<?> generateProof(@Valid @RequestBody GenerateRequest request) {
        log.info("Generate proof for wallet {} on tag {} with threshold {}", request.getWallet(), request.getTag(), request.getThreshold());
        if (request.getThreshold() == null) {
            return ErrorResponses.of(ErrorCode.INVALID_PARAMETERS, "Invalid parameters: threshold is required");
        }
        try {
            ProofResult result = proofOrchestrator.generateProofForWallet(
                    request.getWallet(), request.getTag(), request.getThreshold(), request.isMarkConsumed());
            if (result.isSuccess()) {
                return ResponseEntity.ok(result);
            }
            return ResponseEntity.status(ErrorResponses.statusOf(result.getErrorCode())).body(result);
        } catch (Exception e) {
            log.error("Failed to generate proof for wallet: {}", request.getWallet(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Error generating proof: " + e.getMessage());
        }
    }

    @Operation(summary = "Verify a threshold proof against the loaded verification key")
    @PostMapping("/verify")
    public ResponseEntity<?> verifyProof(@RequestBody(required = false) JsonNode request) {
        JsonNode proof = request == null ? null : request.get("proof");
        JsonNode signals = request == null ? null : request.get("publicSignals");
        boolean hasProof = proof != null && !proof.isNull();
        boolean hasSignals = signals != null && !signals.isNull();
        if (!hasProof || !hasSignals) {
            Map<String, Object> body = ErrorResponses.body("MISSING_PARAMETERS", "Missing required parameters");
            body.put("required", List.of("proof", "publicSignals"));
            body.put("received", Map.of("proof", hasProof, "publicSignals", hasSignals));
            return ResponseEntity.badRequest().body(body);
        }
        if (!signals.isArray()) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, "INVALID_PUBLIC_SIGNALS_FORMAT", "Public signals must be an array");
        }
        List<String> publicSignals = new ArrayList<>();
        for (int i = 0; i < signals.size(); i++) {
            JsonNode signal = signals.get(i);
            if (!signal.isTextual() && !signal.isNumber()) {
                return ErrorResponses.of(HttpStatus.BAD_REQUEST, "INVALID_PUBLIC_SIGNAL_TYPE",
                        "Invalid public signal at index " + i + ": must be string or number");
            }
            publicSignals.add(signal.asText());
        }

        try {
            ProofVerification verification = proofOrchestrator.verifyProofDetailed(proof, publicSignals, null);
            return switch (verification.getReason()) {
                case VERIFIED -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("success", true);
                    body.put("verified", true);
                    body.put("metadata", verification.getMetadata());
                    body.put("timestamp", Instant.now().toString());
                    yield ResponseEntity.ok(body);
                }
                case VERIFICATION_FAILED -> {
                    Map<String, Object> body = ErrorResponses.body("VERIFICATION_FAILED", "Proof verification failed");
                    body.put("verified", false);
                    body.put("metadata", verification.getMetadata());
                    yield ResponseEntity.badRequest().body(body);
                }
                case INVALID_PUBLIC_SIGNALS_LENGTH -> {
                    Map<String, Object> body = ErrorResponses.body(verification.getReason().name(), "Invalid public signals length");
                    body.put("expected", 3);
                    body.put("received", publicSignals.size());
                    yield ResponseEntity.badRequest().body(body);
                }
                case INVALID_PROOF_FORMAT, INVALID_PUBLIC_SIGNAL_TYPE ->
                        ErrorResponses.of(HttpStatus.BAD_REQUEST, verification.getReason().name(), verification.getDetail());
                case VERIFIER_ERROR -> {
                    Map<String, Object> body = ErrorResponses.body("VERIFICATION_ERROR", "Verification service error");
                    body.put("message", verification.getDetail());
                    yield ResponseEntity.internalServerError().body(body);
                }
            };
        } catch (Exception e) {
            log.error("Failed to verify proof", e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "VERIFICATION_ERROR", "Verification service error");
        }
    }

    @Operation(summary = "Get the Groth16 verification key of the threshold circuit")
    @GetMapping("/verification-key")
    public ResponseEntity<?> getVerificationKey() {
        try {
            proofOrchestrator.initialize();
            ProvingArtifacts artifacts = proofOrchestrator.getArtifacts();
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("protocol", artifacts.getProtocol());
            metadata.put("curve", artifacts.getCurve());
            metadata.put("nPublic", artifacts.getPublicSignalCount());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("verificationKey", artifacts.getVerificationKey());
            body.put("metadata", metadata);
            body.put("timestamp", Instant.now().toString());
            return ResponseEntity.ok()
                    .cacheControl(CacheControl.maxAge(Duration.ofHours(1)).cachePublic())
                    .eTag(artifacts.getZkeySha256())
                    .body(body);
        } catch (ZkBackendException e) {
            log.error("Verification key not available: {}", e.getMessage());
            Map<String, Object> body = ErrorResponses.body(e.getErrorCode().name(), "Verification key not available");
            body.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }

    @Data
    public static class GenerateRequest {
        @NotBlank
        private String wallet;
        @NotBlank
        private String tag;
        @NotNull
        @Min(0)
        private Long threshold;
        private boolean markConsumed;
    }

}
