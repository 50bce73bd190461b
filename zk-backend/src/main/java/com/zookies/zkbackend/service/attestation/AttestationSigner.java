package com.zookies.zkbackend.service.attestation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.zookies.zkbackend.exception.AttestationValidationException;
import com.zookies.zkbackend.exception.CryptographyException;
import com.zookies.zkbackend.model.attestation.Attestation;
import com.zookies.zkbackend.model.attestation.InterestTag;
import com.zookies.zkbackend.model.attestation.SignatureVerification;
import com.zookies.zkbackend.model.attestation.SignatureVerification.Reason;
import com.zookies.zkbackend.util.EthereumSignatureUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;

import java.time.Clock;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Signs interest attestations on behalf of one publisher domain.
 * <p>
 * The signed message is the JSON object {@code {nonce, publisherDomain, tag, timestamp, userWallet}}
 * with keys in lexicographic order and no whitespace. Embedding the publisher domain keeps a signature
 * issued for one publisher from being replayed as another's. Verification is static and needs only the
 * record and the expected signer.
 */
@Slf4j
public class AttestationSigner {

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final ECKey signingKey;
    private final Clock clock;

    @Getter
    private final String publisherDomain;
    @Getter
    private final String address;
    @Getter
    private final String publicKey;

    public AttestationSigner(String privateKeyHex, String publisherDomain) {
        this(privateKeyHex, publisherDomain, Clock.systemUTC());
    }

    public AttestationSigner(String privateKeyHex, String publisherDomain, Clock clock) {
        if (publisherDomain == null || publisherDomain.isBlank()) {
            throw new CryptographyException("Publisher domain is required");
        }
        if (!EthereumSignatureUtils.isValidPrivateKey(privateKeyHex)) {
            throw new CryptographyException("Private key must be a 66-character hex string starting with 0x");
        }
        try {
            this.signingKey = EthereumSignatureUtils.keyFromPrivateHex(privateKeyHex);
            this.address = EthereumSignatureUtils.addressOf(signingKey);
            this.publicKey = EthereumSignatureUtils.publicKeyHex(signingKey);
        } catch (RuntimeException e) {
            throw new CryptographyException("Failed to initialize signing key for " + publisherDomain, e);
        }
        this.publisherDomain = publisherDomain;
        this.clock = clock;
    }

    public Attestation signAttestation(String tag, String subjectWallet) {
        return signAttestation(tag, subjectWallet, Attestation.DEFAULT_SCORE);
    }

    public Attestation signAttestation(String tag, String subjectWallet, int score) {
        InterestTag interestTag = InterestTag.fromName(tag)
                .orElseThrow(() -> new AttestationValidationException("Invalid tag: " + tag + ". Must be one of: "
                        + Arrays.toString(InterestTag.values())));
        if (!EthereumSignatureUtils.isValidAddress(subjectWallet)) {
            throw new AttestationValidationException("Invalid wallet address format: " + subjectWallet);
        }
        if (score < 0 || score > Attestation.MAX_SCORE) {
            throw new AttestationValidationException("Score must be between 0 and " + Attestation.MAX_SCORE + ", got " + score);
        }

        long timestamp = clock.instant().getEpochSecond();
        String nonce = UUID.randomUUID().toString();
        String message = canonicalMessage(interestTag.getTagName(), timestamp, nonce, subjectWallet, publisherDomain);
        String signature;
        try {
            signature = EthereumSignatureUtils.signPersonalMessage(message, signingKey);
        } catch (RuntimeException e) {
            log.error("Failed to sign attestation for publisher {}", publisherDomain, e);
            throw new CryptographyException("Attestation signing failed: " + e.getMessage(), e);
        }
        log.info("Signed {} attestation for wallet {} by {}", interestTag, subjectWallet, publisherDomain);

        return Attestation.builder()
                .tag(interestTag.getTagName())
                .score(score)
                .timestamp(timestamp)
                .nonce(nonce)
                .signature(signature)
                .publisher(publisherDomain)
                .subjectWallet(subjectWallet)
                .signerAddress(address)
                .message(message)
                .build();
    }

    public static String canonicalMessage(String tag, long timestamp, String nonce, String subjectWallet, String publisherDomain) {
        Map<String, Object> fields = new TreeMap<>();
        fields.put("tag", tag);
        fields.put("timestamp", timestamp);
        fields.put("nonce", nonce);
        fields.put("userWallet", subjectWallet);
        fields.put("publisherDomain", publisherDomain);
        try {
            return CANONICAL_MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new CryptographyException("Failed to canonicalize attestation message", e);
        }
    }

    public static boolean verifyAttestation(Attestation attestation, String expectedPublicKeyOrAddress) {
        return verifyAttestationDetailed(attestation, expectedPublicKeyOrAddress).isValid();
    }

    /**
     * Never throws; every failure is reported as a rejected {@link SignatureVerification}.
     */
    public static SignatureVerification verifyAttestationDetailed(Attestation attestation, String expectedPublicKeyOrAddress) {
        try {
            String missing = firstMissingField(attestation);
            if (missing != null) {
                return SignatureVerification.rejected(Reason.MISSING_FIELD, "Missing required field: " + missing);
            }

            String expectedAddress;
            try {
                expectedAddress = resolveExpectedAddress(expectedPublicKeyOrAddress);
            } catch (RuntimeException e) {
                return SignatureVerification.rejected(Reason.MALFORMED_EXPECTED_KEY, e.getMessage());
            }

            String message = canonicalMessage(attestation.getTag(), attestation.getTimestamp(), attestation.getNonce(),
                    attestation.getSubjectWallet(), attestation.getPublisher());

            String recovered;
            try {
                recovered = EthereumSignatureUtils.recoverPersonalMessageSigner(message, attestation.getSignature());
            } catch (IllegalArgumentException e) {
                return SignatureVerification.rejected(Reason.MALFORMED_SIGNATURE, e.getMessage());
            }

            if (!recovered.equalsIgnoreCase(expectedAddress)) {
                return SignatureVerification.rejected(Reason.SIGNER_MISMATCH,
                        "Recovered signer does not match expected " + expectedAddress, recovered);
            }
            return SignatureVerification.verified(recovered);
        } catch (RuntimeException e) {
            log.warn("Signature verification failed: {}", e.getMessage());
            return SignatureVerification.rejected(Reason.RECOVERY_FAILED, e.getMessage());
        }
    }

    private static String resolveExpectedAddress(String expected) {
        if (expected == null || expected.isBlank()) {
            throw new IllegalArgumentException("Expected signer is required");
        }
        if (EthereumSignatureUtils.isValidAddress(expected)) {
            return expected;
        }
        return EthereumSignatureUtils.addressOfPublicKey(expected);
    }

    private static String firstMissingField(Attestation attestation) {
        if (attestation == null) return "attestation";
        if (isBlank(attestation.getTag())) return "tag";
        if (attestation.getTimestamp() == null) return "timestamp";
        if (isBlank(attestation.getNonce())) return "nonce";
        if (isBlank(attestation.getSignature())) return "signature";
        if (isBlank(attestation.getPublisher())) return "publisher";
        if (isBlank(attestation.getSubjectWallet())) return "subjectWallet";
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

}
