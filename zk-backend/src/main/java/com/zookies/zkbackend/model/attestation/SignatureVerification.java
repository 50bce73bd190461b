package com.zookies.zkbackend.model.attestation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignatureVerification {

    public enum Reason {
        VERIFIED,
        MISSING_FIELD,
        MALFORMED_SIGNATURE,
        RECOVERY_FAILED,
        SIGNER_MISMATCH,
        MALFORMED_EXPECTED_KEY
    }

    private boolean valid;
    private Reason reason;
    private String detail;
    private String recoveredAddress;

    public static SignatureVerification verified(String recoveredAddress) {
        return new SignatureVerification(true, Reason.VERIFIED, null, recoveredAddress);
    }

    public static SignatureVerification rejected(Reason reason, String detail) {
        return new SignatureVerification(false, reason, detail, null);
    }

    public static SignatureVerification rejected(Reason reason, String detail, String recoveredAddress) {
        return new SignatureVerification(false, reason, detail, recoveredAddress);
    }

}
