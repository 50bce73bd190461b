package com.zookies.zkbackend.service.proof;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zookies.zkbackend.config.ProofCircuitProperties;
import com.zookies.zkbackend.exception.ErrorCode;
import com.zookies.zkbackend.exception.ProofGenerationException;
import com.zookies.zkbackend.model.OperationResult;
import com.zookies.zkbackend.model.attestation.Attestation;
import com.zookies.zkbackend.model.attestation.InterestTag;
import com.zookies.zkbackend.model.attestation.StoredAttestation;
import com.zookies.zkbackend.model.proof.BackendProof;
import com.zookies.zkbackend.model.proof.CircuitInput;
import com.zookies.zkbackend.model.proof.OrchestratorState;
import com.zookies.zkbackend.model.proof.ProofResult;
import com.zookies.zkbackend.model.proof.ProofVerification;
import com.zookies.zkbackend.model.proof.ProvingArtifacts;
import com.zookies.zkbackend.service.attestation.AttestationStoreService;
import com.zookies.zkbackend.service.proof.backend.ProvingBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.zookies.zkbackend.service.proof.CircuitInputBuilderTest.attestation;
import static com.zookies.zkbackend.service.proof.CircuitInputBuilderTest.tagged;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProofOrchestratorTest {

    private static final String WALLET = "0x1234567890abcdef1234567890abcdef12345678";
    private static final String VERIFICATION_KEY = "{\"protocol\":\"groth16\",\"curve\":\"bn128\",\"nPublic\":3}";

    private static final String SNARKJS_PROOF = "{\"pi_a\":[\"11\",\"12\",\"1\"],"
            + "\"pi_b\":[[\"21\",\"22\"],[\"23\",\"24\"],[\"1\",\"0\"]],"
            + "\"pi_c\":[\"31\",\"32\",\"1\"],\"protocol\":\"groth16\",\"curve\":\"bn128\"}";

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path circuitDir;

    @Mock
    private ProvingBackend provingBackend;

    @Mock
    private AttestationStoreService storeService;

    private ExecutorService executor;
    private ProofCircuitProperties properties;
    private ProofOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        properties = new ProofCircuitProperties();
        properties.getCircuit().setWasmPath(circuitDir.resolve("ThresholdProof.wasm").toString());
        properties.getCircuit().setZkeyPath(circuitDir.resolve("ThresholdProof_final.zkey").toString());
        properties.getCircuit().setVerificationKeyPath(circuitDir.resolve("verification_key.json").toString());
        properties.getCircuit().setTimeout(Duration.ofMillis(500));
        orchestrator = new ProofOrchestrator(provingBackend, new CircuitInputBuilder(50), storeService, executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void writeArtifacts(String verificationKey) throws IOException {
        Files.write(circuitDir.resolve("ThresholdProof.wasm"), new byte[]{0, 97, 115, 109});
        Files.write(circuitDir.resolve("ThresholdProof_final.zkey"), new byte[]{1, 2, 3});
        Files.writeString(circuitDir.resolve("verification_key.json"), verificationKey);
    }

    private JsonNode proof() throws IOException {
        return mapper.readTree(SNARKJS_PROOF);
    }

    @Nested
    @DisplayName("initialize")
    class Initialize {

        @Test
        void shouldStayUninitializedWhenArtifactsAreMissingAndAllowRetry() throws IOException {
            assertThatThrownBy(orchestrator::initialize)
                    .isInstanceOf(ProofGenerationException.class)
                    .extracting(e -> ((ProofGenerationException) e).getErrorCode())
                    .isEqualTo(ErrorCode.CIRCUIT_FILES_NOT_FOUND);
            assertThat(orchestrator.getState()).isEqualTo(OrchestratorState.UNINITIALIZED);

            writeArtifacts(VERIFICATION_KEY);
            orchestrator.initialize();

            assertThat(orchestrator.getState()).isEqualTo(OrchestratorState.READY);
        }

        @Test
        void shouldLoadArtifactsOnlyOnce() throws IOException {
            writeArtifacts(VERIFICATION_KEY);

            orchestrator.initialize();
            ProvingArtifacts first = orchestrator.getArtifacts();
            orchestrator.initialize();

            assertThat(orchestrator.getArtifacts()).isSameAs(first);
            assertThat(first.getProtocol()).isEqualTo("groth16");
            assertThat(first.getCurve()).isEqualTo("bn128");
            assertThat(first.getZkeySha256()).hasSize(64);
        }

        @Test
        void shouldRejectVerificationKeyWithoutProtocolOrCurve() throws IOException {
            writeArtifacts("{\"protocol\":\"groth16\"}");

            assertThatThrownBy(orchestrator::initialize)
                    .isInstanceOf(ProofGenerationException.class)
                    .hasMessageContaining("protocol or curve");
            assertThat(orchestrator.getState()).isEqualTo(OrchestratorState.UNINITIALIZED);
        }
    }

    @Nested
    @DisplayName("generateProof")
    class GenerateProof {

        @Test
        void shouldRejectInvalidParametersWithoutTouchingTheBackend() {
            assertThat(orchestrator.generateProof(null, "defi", 1).getError()).startsWith("Invalid parameters");
            assertThat(orchestrator.generateProof(List.of(), " ", 1).getErrorCode()).isEqualTo(ErrorCode.INVALID_PARAMETERS);
            assertThat(orchestrator.generateProof(List.of(), "sports", 1).getErrorCode()).isEqualTo(ErrorCode.INVALID_PARAMETERS);
            assertThat(orchestrator.generateProof(List.of(), "defi", -1).getErrorCode()).isEqualTo(ErrorCode.INVALID_PARAMETERS);
            verifyNoInteractions(provingBackend);
        }

        @Test
        void shouldReportInitializationFailure() {
            ProofResult result = orchestrator.generateProof(tagged("defi", 5), "defi", 1);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).startsWith("Failed to initialize");
            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.CIRCUIT_FILES_NOT_FOUND);
        }

        @Test
        void shouldReportNoValidAttestationsForEmptyInput() throws IOException {
            writeArtifacts(VERIFICATION_KEY);

            ProofResult result = orchestrator.generateProof(List.of(), "defi", 1);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo("No valid attestations");
            assertThat(result.getErrorCode().isNeutralOutcome()).isTrue();
        }

        @Test
        void shouldReportShortfallWithTotalScoreAndThreshold() throws Exception {
            writeArtifacts(VERIFICATION_KEY);

            ProofResult result = orchestrator.generateProof(tagged("defi", 3, 4), "defi", 10);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo("Insufficient attestations to meet threshold");
            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_THRESHOLD);
            assertThat(result.getMetadata().getTotalScore()).isEqualTo(7L);
            assertThat(result.getMetadata().getThreshold()).isEqualTo(10L);
            assertThat(result.getProof()).isNull();
            verify(provingBackend, never()).prove(any(), any());
        }

        @Test
        void shouldFailWhenNoAttestationMatchesRequestedTag() throws IOException {
            writeArtifacts(VERIFICATION_KEY);

            ProofResult result = orchestrator.generateProof(tagged("privacy", 5, 5), "defi", 1);

            assertThat(result.isSuccess()).isFalse();
        }

        @Test
        void shouldReturnProofAndPublicSignalsOnSuccess() throws Exception {
            writeArtifacts(VERIFICATION_KEY);
            String financeId = String.valueOf(InterestTag.FINANCE.getId());
            when(provingBackend.prove(any(CircuitInput.class), any(ProvingArtifacts.class)))
                    .thenReturn(new BackendProof(proof(), List.of(financeId, "20", "1")));

            ProofResult result = orchestrator.generateProof(tagged("finance", 8, 7, 9), "finance", 20);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getProof().get("protocol").asText()).isEqualTo("groth16");
            assertThat(result.getPublicSignals()).containsExactly(financeId, "20", "1");
            assertThat(result.getMetadata().getTotalScore()).isEqualTo(24L);
            assertThat(result.getMetadata().getAttestationCount()).isEqualTo(3);
            assertThat(result.getMetadata().getTag()).isEqualTo("finance");
        }

        @Test
        void shouldTreatPublicSignalMismatchAsBackendFailure() throws Exception {
            writeArtifacts(VERIFICATION_KEY);
            when(provingBackend.prove(any(), any())).thenReturn(new BackendProof(proof(), List.of("1", "20", "0")));

            ProofResult result = orchestrator.generateProof(tagged("finance", 8, 7, 9), "finance", 20);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.BACKEND_FAILURE);
            assertThat(result.getError()).contains("Public signals mismatch");
        }

        @Test
        void shouldPassBackendFailureMessageThrough() throws Exception {
            writeArtifacts(VERIFICATION_KEY);
            when(provingBackend.prove(any(), any()))
                    .thenThrow(new ProofGenerationException(ErrorCode.BACKEND_FAILURE, "witness generation failed"));

            ProofResult result = orchestrator.generateProof(tagged("defi", 5), "defi", 5);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo("witness generation failed");
        }

        @Test
        void shouldCancelBackendWorkOnTimeout() throws Exception {
            writeArtifacts(VERIFICATION_KEY);
            CountDownLatch interrupted = new CountDownLatch(1);
            when(provingBackend.prove(any(), any())).thenAnswer(invocation -> {
                try {
                    Thread.sleep(30_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return null;
            });

            ProofResult result = orchestrator.generateProof(tagged("defi", 5), "defi", 5);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.BACKEND_TIMEOUT);
            assertThat(result.getErrorCode().isRetryable()).isTrue();
            assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Nested
    @DisplayName("generateProofForWallet")
    class GenerateProofForWallet {

        @Test
        void shouldMarkUsedAttestationsConsumedAfterSuccess() throws Exception {
            writeArtifacts(VERIFICATION_KEY);
            StoredAttestation defi = StoredAttestation.of(7, attestation("defi", 5), 0);
            StoredAttestation travel = StoredAttestation.of(8, attestation("travel", 5), 0);
            when(storeService.getAttestations(WALLET, null)).thenReturn(OperationResult.success(List.of(defi, travel)));
            when(provingBackend.prove(any(), any())).thenReturn(new BackendProof(proof(), List.of("1", "5", "1")));

            ProofResult result = orchestrator.generateProofForWallet(WALLET, "defi", 5, true);

            assertThat(result.isSuccess()).isTrue();
            verify(storeService).markConsumed(List.of(7L));
        }

        @Test
        void shouldNotMarkAnythingWhenProofFails() throws IOException {
            writeArtifacts(VERIFICATION_KEY);
            Attestation low = attestation("defi", 1);
            when(storeService.getAttestations(WALLET, null))
                    .thenReturn(OperationResult.success(List.of(StoredAttestation.of(1, low, 0))));

            ProofResult result = orchestrator.generateProofForWallet(WALLET, "defi", 5, true);

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_THRESHOLD);
            verify(storeService, never()).markConsumed(anyList());
        }

        @Test
        void shouldMapStoreValidationErrorToInvalidParameters() {
            when(storeService.getAttestations("0x12", null))
                    .thenReturn(OperationResult.failure(ErrorCode.VALIDATION_ERROR, "Invalid wallet address format: 0x12"));

            ProofResult result = orchestrator.generateProofForWallet("0x12", "defi", 5, false);

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INVALID_PARAMETERS);
        }
    }

    @Nested
    @DisplayName("verifyProof")
    class VerifyProof {

        @Test
        void shouldDecodeMetadataOfValidProof() throws Exception {
            writeArtifacts(VERIFICATION_KEY);
            List<String> signals = List.of("6", "20", "1");
            when(provingBackend.verify(any(JsonNode.class), eq(signals), any(JsonNode.class))).thenReturn(true);

            ProofVerification verification = orchestrator.verifyProofDetailed(proof(), signals, null);

            assertThat(verification.isVerified()).isTrue();
            assertThat(verification.getMetadata().getTag()).isEqualTo("finance");
            assertThat(verification.getMetadata().getThreshold()).isEqualTo(BigInteger.valueOf(20));
            assertThat(verification.getMetadata().isHasValidProof()).isTrue();
            assertThat(verification.getMetadata().isAttestationsSufficient()).isTrue();
        }

        @Test
        void shouldReportRejectedProof() throws Exception {
            JsonNode key = mapper.readTree(VERIFICATION_KEY);
            when(provingBackend.verify(any(), anyList(), any())).thenReturn(false);

            ProofVerification verification = orchestrator.verifyProofDetailed(proof(), List.of("99", "20", "1"), key);

            assertThat(verification.isVerified()).isFalse();
            assertThat(verification.getReason()).isEqualTo(ProofVerification.Reason.VERIFICATION_FAILED);
            assertThat(verification.getMetadata().getTag()).isEqualTo("unknown");
            assertThat(verification.getMetadata().isAttestationsSufficient()).isFalse();
        }

        @Test
        void shouldRejectMalformedInputWithoutCallingTheBackend() throws Exception {
            JsonNode key = mapper.readTree(VERIFICATION_KEY);
            JsonNode incomplete = mapper.readTree("{\"pi_b\":[],\"pi_c\":[],\"protocol\":\"groth16\"}");

            assertThat(orchestrator.verifyProofDetailed(incomplete, List.of("1", "2", "3"), key).getDetail())
                    .isEqualTo("Invalid proof format: missing field 'pi_a'");
            assertThat(orchestrator.verifyProofDetailed(proof(), List.of("1", "2"), key).getReason())
                    .isEqualTo(ProofVerification.Reason.INVALID_PUBLIC_SIGNALS_LENGTH);
            assertThat(orchestrator.verifyProofDetailed(proof(), List.of("1", "abc", "3"), key).getReason())
                    .isEqualTo(ProofVerification.Reason.INVALID_PUBLIC_SIGNAL_TYPE);
            verifyNoInteractions(provingBackend);
        }

        @Test
        void shouldRejectMalformedCurvePointsWithoutCallingTheBackend() throws Exception {
            JsonNode key = mapper.readTree(VERIFICATION_KEY);
            List<String> malformedProofs = List.of(
                        "{\"pi_a\":[\"1\"],\"pi_b\":[[\"3\",\"4\"],[\"5\",\"6\"]],\"pi_c\":[\"7\",\"8\"],\"protocol\":\"groth16\"}",
                        "{\"pi_a\":[\"1\",\"2\"],\"pi_b\":[\"invalid_structure\"],\"pi_c\":[\"7\",\"8\"],\"protocol\":\"groth16\"}",
                        "{\"pi_a\":[\"1\",\"2\"],\"pi_b\":[[\"3\",\"4\"],[\"5\"]],\"pi_c\":[\"7\",\"8\"],\"protocol\":\"groth16\"}",
                        "{\"pi_a\":[\"1\",\"2\"],\"pi_b\":[[\"3\",\"4\"],[\"5\",\"6\"]],\"pi_c\":[\"x\",\"8\"],\"protocol\":\"groth16\"}",
                        "{\"pi_a\":[1,2],\"pi_b\":[[\"3\",\"4\"],[\"5\",\"6\"]],\"pi_c\":[\"7\",\"8\"],\"protocol\":\"groth16\"}",
                        "{\"pi_a\":\"x\",\"pi_b\":7,\"pi_c\":true,\"protocol\":\"groth16\"}"
            );

            for (String malformed : malformedProofs) {
                ProofVerification verification = orchestrator.verifyProofDetailed(mapper.readTree(malformed), List.of("1", "2", "1"), key);

                assertThat(verification.getReason()).as(malformed).isEqualTo(ProofVerification.Reason.INVALID_PROOF_FORMAT);
                assertThat(verification.getDetail()).startsWith("Invalid proof format");
            }
            verifyNoInteractions(provingBackend);
        }

        @Test
        void shouldAcceptAffineCoordinates() throws Exception {
            JsonNode key = mapper.readTree(VERIFICATION_KEY);
            JsonNode affine = mapper.readTree("{\"pi_a\":[\"1\",\"2\"],\"pi_b\":[[\"3\",\"4\"],[\"5\",\"6\"]],"
                    + "\"pi_c\":[\"7\",\"8\"],\"protocol\":\"groth16\"}");
            when(provingBackend.verify(any(), anyList(), any())).thenReturn(true);

            assertThat(orchestrator.verifyProof(affine, List.of("1", "2", "1"), key)).isTrue();
        }

        @Test
        void shouldReturnFalseInsteadOfThrowing() throws Exception {
            JsonNode key = mapper.readTree(VERIFICATION_KEY);
            when(provingBackend.verify(any(), anyList(), any())).thenThrow(new IllegalStateException("snarkjs crashed"));

            assertThat(orchestrator.verifyProof(proof(), List.of("1", "2", "1"), key)).isFalse();
            assertThat(orchestrator.verifyProofDetailed(proof(), List.of("1", "2", "1"), key).getReason())
                    .isEqualTo(ProofVerification.Reason.VERIFIER_ERROR);
        }

        @Test
        void shouldReportVerifierErrorWhenNoKeyCanBeLoaded() throws IOException {
            ProofVerification verification = orchestrator.verifyProofDetailed(proof(), List.of("1", "2", "1"), null);

            assertThat(verification.getReason()).isEqualTo(ProofVerification.Reason.VERIFIER_ERROR);
            verifyNoInteractions(provingBackend);
        }
    }

}
