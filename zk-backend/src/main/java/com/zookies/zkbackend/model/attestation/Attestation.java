package com.zookies.zkbackend.model.attestation;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A publisher-signed statement binding a wallet to an interest tag.
 * Tag and score are kept as raw values so that records arriving from outside can be
 * validated rather than rejected during deserialization.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Attestation {

    public static final int DEFAULT_SCORE = 1;

    // Inclusive upper bound for a single score
    public static final int MAX_SCORE = 100;

    private String tag;

    // Engagement weight assigned by the publisher; not part of the signed message
    private Integer score;

    // Unix seconds
    private Long timestamp;

    private String nonce;

    // 0x-prefixed r || s || v
    private String signature;

    private String publisher;

    @JsonAlias({"user_wallet", "userWallet"})
    private String subjectWallet;

    @JsonAlias("signer_address")
    private String signerAddress;

    // Canonical message that was signed; informational only, verification recomputes it
    private String message;

}
