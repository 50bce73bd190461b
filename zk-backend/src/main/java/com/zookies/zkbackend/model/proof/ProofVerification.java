package com.zookies.zkbackend.model.proof;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProofVerification {

    public enum Reason {
        VERIFIED,
        VERIFICATION_FAILED,
        INVALID_PROOF_FORMAT,
        INVALID_PUBLIC_SIGNALS_LENGTH,
        INVALID_PUBLIC_SIGNAL_TYPE,
        VERIFIER_ERROR
    }

    private boolean verified;
    private Reason reason;
    private String detail;
    private Metadata metadata;

    /**
     * Public signals decoded back into domain terms.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        // Tag name for the id, or "unknown"
        private String tag;
        private BigInteger threshold;
        // Third public signal; ThresholdProof emits its validity flag here
        private BigInteger validityFlagOrScore;
        private boolean hasValidProof;
        private boolean attestationsSufficient;
    }

    public static ProofVerification verified(Metadata metadata) {
        return new ProofVerification(true, Reason.VERIFIED, null, metadata);
    }

    public static ProofVerification rejected(Reason reason, String detail, Metadata metadata) {
        return new ProofVerification(false, reason, detail, metadata);
    }

}
