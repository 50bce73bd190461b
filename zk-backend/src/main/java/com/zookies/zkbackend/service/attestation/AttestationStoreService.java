package com.zookies.zkbackend.service.attestation;

import com.zookies.zkbackend.exception.AttestationStorageException;
import com.zookies.zkbackend.exception.AttestationValidationException;
import com.zookies.zkbackend.exception.ErrorCode;
import com.zookies.zkbackend.exception.ZkBackendException;
import com.zookies.zkbackend.model.OperationResult;
import com.zookies.zkbackend.model.attestation.Attestation;
import com.zookies.zkbackend.model.attestation.AttestationStatistics;
import com.zookies.zkbackend.model.attestation.InterestTag;
import com.zookies.zkbackend.model.attestation.SignatureVerification;
import com.zookies.zkbackend.model.attestation.StoredAttestation;
import com.zookies.zkbackend.repository.attestation.AttestationRegistry;
import com.zookies.zkbackend.util.EthereumSignatureUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for attestation persistence. Every method reports failures through
 * {@link OperationResult} except {@link #markConsumed}, which is best-effort.
 */
@Slf4j
@Service
public class AttestationStoreService {

    private final AttestationRegistry attestationRegistry;
    private final AttestationSigningService signingService;
    private final Clock clock;

    @Autowired
    public AttestationStoreService(AttestationRegistry attestationRegistry, AttestationSigningService signingService) {
        this(attestationRegistry, signingService, Clock.systemUTC());
    }

    public AttestationStoreService(AttestationRegistry attestationRegistry, AttestationSigningService signingService, Clock clock) {
        this.attestationRegistry = attestationRegistry;
        this.signingService = signingService;
        this.clock = clock;
    }

    public OperationResult<StoredAttestation> storeAttestation(Attestation attestation) {
        return call("store attestation", () -> {
            Attestation normalized = validate(attestation);
            StoredAttestation stored = attestationRegistry.insert(normalized, now());
            log.info("Stored attestation {} with id {}", stored.getNonce(), stored.getId());
            return stored;
        });
    }

    public OperationResult<StoredAttestation> verifyAndStoreAttestation(Attestation attestation) {
        SignatureVerification verification = signingService.verify(attestation);
        if (!verification.isValid()) {
            log.warn("Rejected attestation from {}: {} {}", attestation == null ? null : attestation.getPublisher(),
                    verification.getReason(), verification.getDetail());
            return OperationResult.failure(ErrorCode.VALIDATION_ERROR, "Invalid attestation signature: " + verification.getReason());
        }
        Attestation withSigner = attestation.toBuilder().signerAddress(verification.getRecoveredAddress()).build();
        return storeAttestation(withSigner);
    }

    public OperationResult<List<StoredAttestation>> getAttestations(String subjectWallet, String tag) {
        return call("load attestations", () -> {
            requireWallet(subjectWallet);
            String tagFilter = tag == null || tag.isBlank() ? null : tag.trim();
            return attestationRegistry.findByWallet(subjectWallet, tagFilter);
        });
    }

    /**
     * Best-effort bookkeeping; failures are logged and reported as zero records marked.
     */
    public int markConsumed(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        try {
            return attestationRegistry.markConsumed(ids, now());
        } catch (RuntimeException e) {
            log.warn("Failed to mark {} attestations as consumed", ids.size(), e);
            return 0;
        }
    }

    /**
     * Statistics for one wallet, or for the whole store when the wallet is null.
     */
    public OperationResult<AttestationStatistics> getStatistics(String subjectWallet) {
        return call("compute statistics", () -> {
            List<StoredAttestation> records = subjectWallet == null
                    ? attestationRegistry.findAll()
                    : attestationRegistry.findByWallet(subjectWallet, null);
            return summarize(records);
        });
    }

    public OperationResult<Integer> purgeOlderThan(int days) {
        return call("purge attestations", () -> {
            if (days < 0) {
                throw new AttestationValidationException("Retention days must not be negative, got " + days);
            }
            long cutoff = now() - Duration.ofDays(days).toSeconds();
            int deleted = attestationRegistry.deleteCreatedBefore(cutoff);
            log.info("Purged {} attestations older than {} days", deleted, days);
            return deleted;
        });
    }

    public OperationResult<Integer> resetWallet(String subjectWallet) {
        return call("reset wallet", () -> {
            requireWallet(subjectWallet);
            int deleted = attestationRegistry.deleteByWallet(subjectWallet);
            log.info("Deleted {} attestations of wallet {}", deleted, subjectWallet);
            return deleted;
        });
    }

    static AttestationStatistics summarize(List<StoredAttestation> records) {
        Map<String, Long> tagCounts = records.stream()
                .collect(Collectors.groupingBy(StoredAttestation::getTag, TreeMap::new, Collectors.counting()));
        Map<String, Long> publisherCounts = records.stream()
                .collect(Collectors.groupingBy(StoredAttestation::getPublisher, TreeMap::new, Collectors.counting()));
        long consumed = records.stream().filter(StoredAttestation::isConsumed).count();
        Long oldest = records.stream().map(StoredAttestation::getTimestamp).min(Long::compare).orElse(null);
        Long newest = records.stream().map(StoredAttestation::getTimestamp).max(Long::compare).orElse(null);
        return new AttestationStatistics(records.size(), tagCounts, publisherCounts, consumed, oldest, newest);
    }

    private Attestation validate(Attestation attestation) {
        if (attestation == null) {
            throw new AttestationValidationException("Attestation is required");
        }
        requireField(attestation.getTag(), "tag");
        requireField(attestation.getNonce(), "nonce");
        requireField(attestation.getSignature(), "signature");
        requireField(attestation.getPublisher(), "publisher");
        requireField(attestation.getSubjectWallet(), "subjectWallet");
        if (attestation.getTimestamp() == null) {
            throw new AttestationValidationException("Missing required field: timestamp");
        }
        InterestTag tag = InterestTag.fromName(attestation.getTag())
                .orElseThrow(() -> new AttestationValidationException("Unsupported tag: " + attestation.getTag()));
        requireWallet(attestation.getSubjectWallet());
        int score = attestation.getScore() == null ? Attestation.DEFAULT_SCORE : attestation.getScore();
        if (score < 0 || score > Attestation.MAX_SCORE) {
            throw new AttestationValidationException("Score must be between 0 and " + Attestation.MAX_SCORE + ", got " + score);
        }
        return attestation.toBuilder().tag(tag.getTagName()).score(score).build();
    }

    private static void requireField(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new AttestationValidationException("Missing required field: " + name);
        }
    }

    private static void requireWallet(String subjectWallet) {
        if (!EthereumSignatureUtils.isValidAddress(subjectWallet)) {
            throw new AttestationValidationException("Invalid wallet address format: " + subjectWallet);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private <T> OperationResult<T> call(String operation, Supplier<T> action) {
        try {
            return OperationResult.success(action.get());
        } catch (ZkBackendException e) {
            log.warn("Failed to {}: {}", operation, e.getMessage());
            return OperationResult.failure(e);
        } catch (RuntimeException e) {
            log.error("Failed to {}", operation, e);
            return OperationResult.failure(new AttestationStorageException("Failed to " + operation, e));
        }
    }

}
