package com.zookies.zkbackend.service.attestation;

import com.zookies.zkbackend.exception.ZkBackendException;
import com.zookies.zkbackend.model.OperationResult;
import com.zookies.zkbackend.model.attestation.Attestation;
import com.zookies.zkbackend.model.attestation.SignatureVerification;
import com.zookies.zkbackend.model.attestation.SignatureVerification.Reason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AttestationSigningService {

    private final PublisherKeyService publisherKeyService;

    public OperationResult<Attestation> sign(String publisherDomain, String tag, String subjectWallet, Integer score) {
        log.info("Sign {} attestation for wallet {} as {}", tag, subjectWallet, publisherDomain);
        try {
            AttestationSigner signer = publisherKeyService.getSigner(publisherDomain);
            int effectiveScore = score == null ? Attestation.DEFAULT_SCORE : score;
            return OperationResult.success(signer.signAttestation(tag, subjectWallet, effectiveScore));
        } catch (ZkBackendException e) {
            log.error("Failed to sign attestation for publisher {}: {}", publisherDomain, e.getMessage());
            return OperationResult.failure(e);
        }
    }

    /**
     * Verifies an attestation against the registered key of the publisher it names.
     */
    public SignatureVerification verify(Attestation attestation) {
        String publisher = attestation == null ? null : attestation.getPublisher();
        Optional<AttestationSigner> signer = publisherKeyService.findSigner(publisher);
        if (signer.isEmpty()) {
            return SignatureVerification.rejected(Reason.MALFORMED_EXPECTED_KEY, "Unknown publisher: " + publisher);
        }
        return AttestationSigner.verifyAttestationDetailed(attestation, signer.get().getAddress());
    }

}
