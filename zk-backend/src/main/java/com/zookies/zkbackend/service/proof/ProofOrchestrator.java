package com.zookies.zkbackend.service.proof;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zookies.zkbackend.config.ProofCircuitProperties;
import com.zookies.zkbackend.exception.ErrorCode;
import com.zookies.zkbackend.exception.ProofGenerationException;
import com.zookies.zkbackend.exception.ZkBackendException;
import com.zookies.zkbackend.model.OperationResult;
import com.zookies.zkbackend.model.attestation.Attestation;
import com.zookies.zkbackend.model.attestation.InterestTag;
import com.zookies.zkbackend.model.attestation.StoredAttestation;
import com.zookies.zkbackend.model.proof.BackendProof;
import com.zookies.zkbackend.model.proof.CircuitInput;
import com.zookies.zkbackend.model.proof.OrchestratorState;
import com.zookies.zkbackend.model.proof.ProofResult;
import com.zookies.zkbackend.model.proof.ProofVerification;
import com.zookies.zkbackend.model.proof.ProofVerification.Reason;
import com.zookies.zkbackend.model.proof.ProvingArtifacts;
import com.zookies.zkbackend.service.attestation.AttestationStoreService;
import com.zookies.zkbackend.service.proof.backend.ProvingBackend;
import com.zookies.zkbackend.util.EthereumSignatureUtils;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives threshold proofs end to end: loads the circuit artifacts once, builds the circuit input,
 * runs the prover on the worker pool under a deadline and checks the returned public signals.
 * <p>
 * Every outcome, including failures, is reported as a {@link ProofResult}; nothing is thrown to the caller.
 */
@Slf4j
@Service
public class ProofOrchestrator {

    private static final List<String> REQUIRED_PROOF_FIELDS = List.of("pi_a", "pi_b", "pi_c", "protocol");
    private static final int PUBLIC_SIGNAL_COUNT = 3;

    private final ProvingBackend provingBackend;
    private final CircuitInputBuilder inputBuilder;
    private final AttestationStoreService storeService;
    private final ExecutorService executor;
    private final ProofCircuitProperties.CircuitProperties circuit;
    private final ObjectMapper mapper = new ObjectMapper();

    private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.UNINITIALIZED);
    private volatile ProvingArtifacts artifacts;

    public ProofOrchestrator(ProvingBackend provingBackend,
                             CircuitInputBuilder inputBuilder,
                             AttestationStoreService storeService,
                             @Qualifier("proofExecutor") ExecutorService executor,
                             ProofCircuitProperties properties) {
        this.provingBackend = provingBackend;
        this.inputBuilder = inputBuilder;
        this.storeService = storeService;
        this.executor = executor;
        this.circuit = properties.getCircuit();
    }

    /**
     * Loads the proving artifacts. Calling again once ready does nothing; after a failure the
     * orchestrator is back in {@link OrchestratorState#UNINITIALIZED} and the call may be retried.
     *
     * @throws ProofGenerationException with {@link ErrorCode#CIRCUIT_FILES_NOT_FOUND} if an artifact is missing or unreadable
     */
    public synchronized void initialize() {
        if (state.get() == OrchestratorState.READY) {
            return;
        }
        state.set(OrchestratorState.INITIALIZING);
        log.info("Load circuit artifacts: wasm={}, zkey={}, vkey={}",
                circuit.getWasmPath(), circuit.getZkeyPath(), circuit.getVerificationKeyPath());
        try {
            Path wasm = requireFile(circuit.getWasmPath());
            Path zkey = requireFile(circuit.getZkeyPath());
            Path vkey = requireFile(circuit.getVerificationKeyPath());

            JsonNode verificationKey = mapper.readTree(vkey.toFile());
            if (!verificationKey.hasNonNull("protocol") || !verificationKey.hasNonNull("curve")) {
                throw new ProofGenerationException(ErrorCode.CIRCUIT_FILES_NOT_FOUND,
                        "Invalid verification key format: missing protocol or curve in " + vkey);
            }
            artifacts = new ProvingArtifacts(wasm, zkey, fingerprint(wasm), fingerprint(zkey), verificationKey);
            state.set(OrchestratorState.READY);
            log.info("Circuit artifacts ready: {}", artifacts);
        } catch (IOException e) {
            state.set(OrchestratorState.UNINITIALIZED);
            log.error("Failed to read circuit artifacts", e);
            throw new ProofGenerationException(ErrorCode.CIRCUIT_FILES_NOT_FOUND, "Failed to read circuit files: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            state.set(OrchestratorState.UNINITIALIZED);
            log.error("Failed to load circuit artifacts: {}", e.getMessage());
            throw e;
        }
    }

    public OrchestratorState getState() {
        return state.get();
    }

    public ProvingArtifacts getArtifacts() {
        return artifacts;
    }

    public ProofResult generateProof(List<? extends Attestation> attestations, String targetTag, long threshold) {
        return generate(attestations, targetTag, threshold, false);
    }

    /**
     * Proves over a snapshot of the wallet's stored attestations. With {@code markConsumed} the
     * attestations that went into a successful proof are flagged consumed afterwards.
     */
    public ProofResult generateProofForWallet(String subjectWallet, String targetTag, long threshold, boolean markConsumed) {
        log.info("Generate proof for wallet {} on tag {} with threshold {}", subjectWallet, targetTag, threshold);
        OperationResult<List<StoredAttestation>> snapshot = storeService.getAttestations(subjectWallet, null);
        if (!snapshot.isSuccess()) {
            if (snapshot.getErrorCode() == ErrorCode.VALIDATION_ERROR) {
                return ProofResult.failure(ErrorCode.INVALID_PARAMETERS, "Invalid parameters: " + snapshot.getError(), null);
            }
            return ProofResult.failure(snapshot.getErrorCode(), snapshot.getError(), null);
        }
        return generate(snapshot.getValue(), targetTag, threshold, markConsumed);
    }

    public boolean verifyProof(JsonNode proof, List<String> publicSignals, JsonNode verificationKey) {
        return verifyProofDetailed(proof, publicSignals, verificationKey).isVerified();
    }

    /**
     * Verifies a proof and decodes its public signals. A null verification key means the one loaded
     * by {@link #initialize()}. Never throws.
     */
    public ProofVerification verifyProofDetailed(JsonNode proof, List<String> publicSignals, JsonNode verificationKey) {
        try {
            String formatError = checkProofFormat(proof);
            if (formatError != null) {
                return ProofVerification.rejected(Reason.INVALID_PROOF_FORMAT, formatError, null);
            }
            if (publicSignals == null || publicSignals.size() != PUBLIC_SIGNAL_COUNT) {
                return ProofVerification.rejected(Reason.INVALID_PUBLIC_SIGNALS_LENGTH,
                        "Invalid public signals length: expected " + PUBLIC_SIGNAL_COUNT, null);
            }
            BigInteger[] signals = new BigInteger[PUBLIC_SIGNAL_COUNT];
            for (int i = 0; i < PUBLIC_SIGNAL_COUNT; i++) {
                signals[i] = parseSignal(publicSignals.get(i));
                if (signals[i] == null) {
                    return ProofVerification.rejected(Reason.INVALID_PUBLIC_SIGNAL_TYPE,
                            "Invalid public signal at index " + i + ": must be a non-negative integer", null);
                }
            }

            JsonNode key = verificationKey;
            if (key == null) {
                initialize();
                key = artifacts.getVerificationKey();
            }
            JsonNode vk = key;
            boolean valid = callWithDeadline(() -> provingBackend.verify(vk, publicSignals, proof));

            ProofVerification.Metadata metadata = decode(signals, valid);
            if (!valid) {
                log.info("Proof rejected for tag {} threshold {}", metadata.getTag(), metadata.getThreshold());
                return ProofVerification.rejected(Reason.VERIFICATION_FAILED, "Proof verification failed", metadata);
            }
            log.info("Proof verified for tag {} threshold {}", metadata.getTag(), metadata.getThreshold());
            return ProofVerification.verified(metadata);
        } catch (ZkBackendException e) {
            log.error("Proof verification error: {}", e.getMessage());
            return ProofVerification.rejected(Reason.VERIFIER_ERROR, e.getMessage(), null);
        } catch (RuntimeException e) {
            log.error("Proof verification error", e);
            return ProofVerification.rejected(Reason.VERIFIER_ERROR, e.getMessage(), null);
        }
    }

    private ProofResult generate(List<? extends Attestation> attestations, String targetTag, long threshold, boolean markConsumed) {
        String invalid = checkParameters(attestations, targetTag, threshold);
        if (invalid != null) {
            log.warn("Rejected proof request: {}", invalid);
            return ProofResult.failure(ErrorCode.INVALID_PARAMETERS, "Invalid parameters: " + invalid, null);
        }
        String tag = InterestTag.fromName(targetTag).map(InterestTag::getTagName).orElse(targetTag);

        try {
            initialize();
        } catch (ZkBackendException e) {
            return ProofResult.failure(e.getErrorCode(), "Failed to initialize: " + e.getMessage(), null);
        }

        CircuitInput input = inputBuilder.prepareCircuitInputs(attestations, tag, threshold);
        if (input == null) {
            return ProofResult.failure(ErrorCode.NO_VALID_ATTESTATIONS, "No valid attestations",
                    ProofResult.Metadata.of(tag, threshold, 0L, 0));
        }
        ProofResult.Metadata metadata = ProofResult.Metadata.of(tag, threshold, input.getTotalScore(), input.getAttestationCount());
        if (input.getTotalScore() < threshold) {
            log.info("Total score {} below threshold {} for tag {}", input.getTotalScore(), threshold, tag);
            return ProofResult.failure(ErrorCode.INSUFFICIENT_THRESHOLD, "Insufficient attestations to meet threshold", metadata);
        }

        BackendProof backendProof;
        try {
            ProvingArtifacts loaded = artifacts;
            backendProof = callWithDeadline(() -> provingBackend.prove(input, loaded));
        } catch (ZkBackendException e) {
            return ProofResult.failure(e.getErrorCode(), e.getMessage(), metadata);
        }

        List<String> expected = input.toPublicSignals();
        if (!sameSignals(expected, backendProof.getPublicSignals())) {
            log.error("Prover returned public signals {} but {} were expected", backendProof.getPublicSignals(), expected);
            return ProofResult.failure(ErrorCode.BACKEND_FAILURE,
                    "Public signals mismatch: expected " + expected + ", got " + backendProof.getPublicSignals(), metadata);
        }

        if (markConsumed) {
            storeService.markConsumed(input.getAttestationIds());
        }
        log.info("Generated proof for tag {} with {} attestations", tag, input.getAttestationCount());
        return ProofResult.success(backendProof.getProof(), expected, metadata);
    }

    /**
     * Runs backend work on the worker pool. On deadline the task is cancelled with an interrupt,
     * which makes the backend stop its child process.
     */
    private <T> T callWithDeadline(Callable<T> task) {
        Duration timeout = circuit.getTimeout();
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new ProofGenerationException(ErrorCode.BACKEND_FAILURE, "Proving workers are busy, try again later", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Backend call timed out after {}", timeout);
            throw new ProofGenerationException(ErrorCode.BACKEND_TIMEOUT,
                    "Proof generation timed out after " + timeout.toSeconds() + " seconds", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProofGenerationException(ErrorCode.BACKEND_FAILURE, "Interrupted while waiting for the prover", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ZkBackendException zk) {
                throw zk;
            }
            log.error("Backend call failed", cause);
            throw new ProofGenerationException(ErrorCode.BACKEND_FAILURE, "Proof backend failed: " + cause.getMessage(), cause);
        }
    }

    private static String checkParameters(List<? extends Attestation> attestations, String targetTag, long threshold) {
        if (attestations == null) {
            return "attestations are required";
        }
        if (targetTag == null || targetTag.isBlank()) {
            return "tag is required";
        }
        if (!InterestTag.isSupported(targetTag)) {
            return "unsupported tag " + targetTag;
        }
        if (threshold < 0) {
            return "threshold must not be negative";
        }
        return null;
    }

    private static String checkProofFormat(JsonNode proof) {
        if (proof == null || !proof.isObject()) {
            return "Invalid proof format: proof must be an object";
        }
        for (String field : REQUIRED_PROOF_FIELDS) {
            if (!proof.hasNonNull(field)) {
                return "Invalid proof format: missing field '" + field + "'";
            }
        }
        if (!isPoint(proof.get("pi_a"))) {
            return "Invalid proof format: pi_a must be an array of at least 2 field elements";
        }
        JsonNode piB = proof.get("pi_b");
        boolean piBValid = piB.isArray() && piB.size() >= 2;
        for (int i = 0; piBValid && i < piB.size(); i++) {
            piBValid = isPoint(piB.get(i));
        }
        if (!piBValid) {
            return "Invalid proof format: pi_b must be an array of at least 2 pairs of field elements";
        }
        if (!isPoint(proof.get("pi_c"))) {
            return "Invalid proof format: pi_c must be an array of at least 2 field elements";
        }
        return null;
    }

    // Array of at least two numeric strings; snarkjs emits projective coordinates, so a third is allowed
    private static boolean isPoint(JsonNode node) {
        if (node == null || !node.isArray() || node.size() < 2) {
            return false;
        }
        for (JsonNode coordinate : node) {
            if (!coordinate.isTextual() || parseSignal(coordinate.asText()) == null) {
                return false;
            }
        }
        return true;
    }

    private static ProofVerification.Metadata decode(BigInteger[] signals, boolean verified) {
        BigInteger tagId = signals[0];
        String tag = tagId.bitLength() < 32
                ? InterestTag.fromId(tagId.longValue()).map(InterestTag::getTagName).orElse("unknown")
                : "unknown";
        boolean hasValidProof = signals[2].signum() > 0;
        return new ProofVerification.Metadata(tag, signals[1], signals[2], hasValidProof, verified && hasValidProof);
    }

    private static BigInteger parseSignal(String signal) {
        if (signal == null) {
            return null;
        }
        try {
            BigInteger value = new BigInteger(signal.trim());
            return value.signum() < 0 ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean sameSignals(List<String> expected, List<String> actual) {
        if (actual == null || actual.size() != expected.size()) {
            return false;
        }
        for (int i = 0; i < expected.size(); i++) {
            BigInteger value = parseSignal(actual.get(i));
            if (value == null || !value.equals(new BigInteger(expected.get(i)))) {
                return false;
            }
        }
        return true;
    }

    private static Path requireFile(String location) {
        Path path = Paths.get(location).toAbsolutePath();
        if (!Files.isRegularFile(path)) {
            throw new ProofGenerationException(ErrorCode.CIRCUIT_FILES_NOT_FOUND, "Circuit file not found: " + path);
        }
        return path;
    }

    private static String fingerprint(Path file) throws IOException {
        return Hex.toHexString(EthereumSignatureUtils.sha256(Files.readAllBytes(file)));
    }

}
