package com.zookies.zkbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "proof")
public class ProofCircuitProperties {

    private CircuitProperties circuit = new CircuitProperties();
    private SnarkjsProperties snarkjs = new SnarkjsProperties();
    private WorkerProperties worker = new WorkerProperties();

    @Data
    public static class CircuitProperties {
        private String wasmPath = "circom/build/circuits/ThresholdProof_js/ThresholdProof.wasm";
        private String zkeyPath = "circom/build/keys/ThresholdProof_final.zkey";
        private String verificationKeyPath = "circom/build/keys/verification_key.json";
        // Must match ThresholdProof(50) in the circuit
        private int maxAttestations = 50;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class SnarkjsProperties {
        private String command = "snarkjs";
        private String workDir = "data/proof-work";
    }

    @Data
    public static class WorkerProperties {
        private int threads = 2;
        private int queueCapacity = 64;
    }

}
