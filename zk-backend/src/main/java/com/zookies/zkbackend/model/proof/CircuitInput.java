package com.zookies.zkbackend.model.proof;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Fixed-shape input of the ThresholdProof circuit. Only {@code scores}, {@code targetTagId} and
 * {@code threshold} are sent to the prover; the remaining fields are derived for the caller.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CircuitInput {

    // Exactly maxAttestations entries, zero padded
    private List<Integer> scores;
    private int targetTagId;
    private long threshold;

    private long totalScore;
    // 1 when totalScore >= threshold, else 0
    private int hasValidProof;
    private int attestationCount;

    // Store ids of the attestations behind the non-zero slots, in slot order
    @JsonIgnore
    private List<Long> attestationIds;

    /**
     * Public signals the circuit must output for this input: {@code [targetTagId, threshold, hasValidProof]}.
     */
    public List<String> toPublicSignals() {
        return List.of(String.valueOf(targetTagId), String.valueOf(threshold), String.valueOf(hasValidProof));
    }

}
