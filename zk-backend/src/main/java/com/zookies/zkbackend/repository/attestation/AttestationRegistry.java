package com.zookies.zkbackend.repository.attestation;

import com.zookies.zkbackend.model.attestation.Attestation;
import com.zookies.zkbackend.model.attestation.StoredAttestation;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Persistent attestation store. Nonces are unique across the whole store and records are never
 * changed after insertion except for the consumed marker. Returned records are copies.
 */
public interface AttestationRegistry {

    Comparator<StoredAttestation> NEWEST_FIRST = Comparator
            .comparing(StoredAttestation::getTimestamp, Comparator.reverseOrder())
            .thenComparing(StoredAttestation::getId, Comparator.reverseOrder());

    /**
     * Inserts the record atomically and assigns its id.
     *
     * @throws com.zookies.zkbackend.exception.DuplicateAttestationException if the nonce is already stored
     */
    StoredAttestation insert(Attestation attestation, long createdAt);

    /**
     * Records of one wallet, newest first. A null tag returns every tag.
     */
    List<StoredAttestation> findByWallet(String subjectWallet, String tag);

    List<StoredAttestation> findAll();

    Optional<StoredAttestation> findByNonce(String nonce);

    boolean existsByNonce(String nonce);

    /**
     * Sets the consumed marker; unknown or already consumed ids are skipped.
     *
     * @return number of records newly marked
     */
    int markConsumed(Collection<Long> ids, long consumedAt);

    int deleteCreatedBefore(long createdAtCutoff);

    int deleteByWallet(String subjectWallet);

}
