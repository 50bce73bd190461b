package com.zookies.zkbackend.repository.attestation;

import com.zookies.zkbackend.exception.DuplicateAttestationException;
import com.zookies.zkbackend.model.attestation.Attestation;
import com.zookies.zkbackend.model.attestation.StoredAttestation;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

@Slf4j
public class InMemoryAttestationRegistry implements AttestationRegistry {

    private final Map<Long, StoredAttestation> attestationStore = new ConcurrentHashMap<>();
    private final Map<String, Long> nonceIndex = new ConcurrentHashMap<>();
    private final Map<String, Set<Long>> walletIndex = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public StoredAttestation insert(Attestation attestation, long createdAt) {
        log.info("Save attestation {} for wallet {}", attestation.getNonce(), attestation.getSubjectWallet());
        lock.writeLock().lock();
        try {
            if (nonceIndex.containsKey(attestation.getNonce())) {
                throw new DuplicateAttestationException(attestation.getNonce());
            }
            long id = sequence.incrementAndGet();
            StoredAttestation stored = StoredAttestation.of(id, attestation, createdAt);
            attestationStore.put(id, stored);
            nonceIndex.put(stored.getNonce(), id);
            walletIndex.computeIfAbsent(walletKey(stored.getSubjectWallet()), k -> ConcurrentHashMap.newKeySet()).add(id);
            return stored.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<StoredAttestation> findByWallet(String subjectWallet, String tag) {
        log.info("Load attestations for wallet {} with tag {}", subjectWallet, tag);
        lock.readLock().lock();
        try {
            Set<Long> ids = walletIndex.getOrDefault(walletKey(subjectWallet), Set.of());
            return ids.stream()
                    .map(attestationStore::get)
                    .filter(a -> tag == null || tag.equalsIgnoreCase(a.getTag()))
                    .map(StoredAttestation::copy)
                    .sorted(NEWEST_FIRST)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<StoredAttestation> findAll() {
        lock.readLock().lock();
        try {
            return attestationStore.values().stream()
                    .map(StoredAttestation::copy)
                    .sorted(NEWEST_FIRST)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<StoredAttestation> findByNonce(String nonce) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nonceIndex.get(nonce))
                    .map(attestationStore::get)
                    .map(StoredAttestation::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean existsByNonce(String nonce) {
        return nonceIndex.containsKey(nonce);
    }

    @Override
    public int markConsumed(Collection<Long> ids, long consumedAt) {
        lock.writeLock().lock();
        try {
            int marked = 0;
            for (Long id : ids) {
                StoredAttestation stored = attestationStore.get(id);
                if (stored != null && !stored.isConsumed()) {
                    stored.setConsumed(true);
                    stored.setConsumedAt(consumedAt);
                    marked++;
                }
            }
            log.info("Marked {} of {} attestations as consumed", marked, ids.size());
            return marked;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int deleteCreatedBefore(long createdAtCutoff) {
        return deleteWhere(a -> a.getCreatedAt() < createdAtCutoff);
    }

    @Override
    public int deleteByWallet(String subjectWallet) {
        String key = walletKey(subjectWallet);
        return deleteWhere(a -> walletKey(a.getSubjectWallet()).equals(key));
    }

    private int deleteWhere(Predicate<StoredAttestation> condition) {
        lock.writeLock().lock();
        try {
            List<StoredAttestation> doomed = attestationStore.values().stream().filter(condition).toList();
            for (StoredAttestation stored : doomed) {
                attestationStore.remove(stored.getId());
                nonceIndex.remove(stored.getNonce());
                walletIndex.computeIfPresent(walletKey(stored.getSubjectWallet()), (key, ids) -> {
                    ids.remove(stored.getId());
                    return ids.isEmpty() ? null : ids;
                });
            }
            return doomed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    int indexedWalletCount() {
        return walletIndex.size();
    }

    private static String walletKey(String subjectWallet) {
        return subjectWallet == null ? "" : subjectWallet.toLowerCase(Locale.ROOT);
    }

}
