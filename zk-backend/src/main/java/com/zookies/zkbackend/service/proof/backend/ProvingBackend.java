package com.zookies.zkbackend.service.proof.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.zookies.zkbackend.model.proof.BackendProof;
import com.zookies.zkbackend.model.proof.CircuitInput;
import com.zookies.zkbackend.model.proof.ProvingArtifacts;

import java.util.List;

/**
 * Groth16 prover and verifier for the ThresholdProof circuit.
 * Implementations must stop work and release resources when the calling thread is interrupted.
 */
public interface ProvingBackend {

    /**
     * @throws com.zookies.zkbackend.exception.ProofGenerationException if no proof could be produced
     */
    BackendProof prove(CircuitInput input, ProvingArtifacts artifacts) throws InterruptedException;

    /**
     * @return true only if the proof verifies against the key and public signals
     * @throws com.zookies.zkbackend.exception.ProofGenerationException if the verifier itself failed
     */
    boolean verify(JsonNode verificationKey, List<String> publicSignals, JsonNode proof) throws InterruptedException;

}
