package com.zookies.zkbackend.controller;

import com.zookies.zkbackend.service.proof.ProofOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final ProofOrchestrator proofOrchestrator;

    @Value("${attestation.registry.type:memory}")
    private String registryType;

    @Operation(summary = "Report service status")
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now().toString());
        body.put("registry", registryType);
        body.put("prover", proofOrchestrator.getState().name());
        return ResponseEntity.ok(body);
    }

}
