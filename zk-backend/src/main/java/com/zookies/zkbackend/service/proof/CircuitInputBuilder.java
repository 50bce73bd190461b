package com.zookies.zkbackend.service.proof;

import com.zookies.zkbackend.config.ProofCircuitProperties;
import com.zookies.zkbackend.model.attestation.Attestation;
import com.zookies.zkbackend.model.attestation.InterestTag;
import com.zookies.zkbackend.model.attestation.StoredAttestation;
import com.zookies.zkbackend.model.proof.CircuitInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Turns a set of attestations into the fixed-size score vector of the ThresholdProof circuit.
 * Pure function of its arguments.
 */
@Slf4j
@Component
public class CircuitInputBuilder {

    private final int maxAttestations;

    @Autowired
    public CircuitInputBuilder(ProofCircuitProperties properties) {
        this(properties.getCircuit().getMaxAttestations());
    }

    public CircuitInputBuilder(int maxAttestations) {
        if (maxAttestations < 1) {
            throw new IllegalArgumentException("maxAttestations must be positive, got " + maxAttestations);
        }
        this.maxAttestations = maxAttestations;
    }

    /**
     * @return the circuit input, or null when no attestation is usable at all
     */
    public CircuitInput prepareCircuitInputs(List<? extends Attestation> attestations, String targetTag, long threshold) {
        if (attestations == null || attestations.isEmpty()) {
            return null;
        }
        List<Attestation> usable = attestations.stream()
                .filter(CircuitInputBuilder::isUsable)
                .map(Attestation.class::cast)
                .toList();
        if (usable.isEmpty()) {
            log.info("None of {} attestations is usable for a proof", attestations.size());
            return null;
        }

        String wanted = normalize(targetTag);
        List<Attestation> matching = usable.stream()
                .filter(a -> normalize(a.getTag()).equals(wanted))
                .toList();
        if (matching.size() > maxAttestations) {
            log.warn("{} attestations match tag {}, only the first {} are used", matching.size(), targetTag, maxAttestations);
            matching = matching.subList(0, maxAttestations);
        }

        List<Integer> scores = new ArrayList<>(Collections.nCopies(maxAttestations, 0));
        List<Long> ids = new ArrayList<>();
        long totalScore = 0;
        for (int i = 0; i < matching.size(); i++) {
            Attestation attestation = matching.get(i);
            scores.set(i, attestation.getScore());
            totalScore += attestation.getScore();
            if (attestation instanceof StoredAttestation stored) {
                ids.add(stored.getId());
            }
        }

        int targetTagId = InterestTag.resolveIdOrDefault(targetTag);
        int hasValidProof = totalScore >= threshold ? 1 : 0;
        log.info("Prepared circuit input for tag {} ({}): {} attestations, total score {}, threshold {}",
                targetTag, targetTagId, matching.size(), totalScore, threshold);

        return new CircuitInput(Collections.unmodifiableList(scores), targetTagId, threshold,
                totalScore, hasValidProof, matching.size(), List.copyOf(ids));
    }

    private static boolean isUsable(Attestation attestation) {
        if (attestation == null) return false;
        if (attestation.getTag() == null || attestation.getTag().isBlank()) return false;
        if (attestation.getSignature() == null || attestation.getSignature().isBlank()) return false;
        Integer score = attestation.getScore();
        return score != null && score >= 0 && score <= Attestation.MAX_SCORE;
    }

    private static String normalize(String tag) {
        return tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
    }

}
