package com.zookies.zkbackend.repository.attestation;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.zookies.zkbackend.exception.AttestationStorageException;
import com.zookies.zkbackend.exception.DuplicateAttestationException;
import com.zookies.zkbackend.model.attestation.Attestation;
import com.zookies.zkbackend.model.attestation.StoredAttestation;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Keeps all attestations in one JSON document and rewrites it on every change.
 * The new content goes to a temporary file that then replaces the store file, so a crash
 * leaves either the old or the new document on disk.
 */
@Slf4j
public class JsonFileAttestationRegistry implements AttestationRegistry {

    static final String STORE_FILE = "attestations.json";

    private final Path storageDir;
    private final Path storeFile;
    private final ObjectMapper mapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private StoreDocument document;

    public JsonFileAttestationRegistry(String path) throws IOException {
        this.storageDir = Paths.get(path);
        Files.createDirectories(storageDir);
        this.storeFile = storageDir.resolve(STORE_FILE);
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.document = Files.exists(storeFile)
                ? mapper.readValue(storeFile.toFile(), StoreDocument.class)
                : new StoreDocument();
        log.info("Loaded {} attestations from {}", document.getAttestations().size(), storeFile);
    }

    @Override
    public StoredAttestation insert(Attestation attestation, long createdAt) {
        log.info("Save attestation {} for wallet {}", attestation.getNonce(), attestation.getSubjectWallet());
        lock.writeLock().lock();
        try {
            boolean duplicate = document.getAttestations().stream()
                    .anyMatch(a -> a.getNonce().equals(attestation.getNonce()));
            if (duplicate) {
                throw new DuplicateAttestationException(attestation.getNonce());
            }
            long id = document.getNextId();
            StoredAttestation stored = StoredAttestation.of(id, attestation, createdAt);

            StoreDocument updated = document.copy();
            updated.getAttestations().add(stored);
            updated.setNextId(id + 1);
            persist(updated);
            return stored.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<StoredAttestation> findByWallet(String subjectWallet, String tag) {
        log.info("Load attestations for wallet {} with tag {}", subjectWallet, tag);
        String key = walletKey(subjectWallet);
        return select(a -> walletKey(a.getSubjectWallet()).equals(key)
                && (tag == null || tag.equalsIgnoreCase(a.getTag())));
    }

    @Override
    public List<StoredAttestation> findAll() {
        return select(a -> true);
    }

    @Override
    public Optional<StoredAttestation> findByNonce(String nonce) {
        return select(a -> a.getNonce().equals(nonce)).stream().findFirst();
    }

    @Override
    public boolean existsByNonce(String nonce) {
        return findByNonce(nonce).isPresent();
    }

    @Override
    public int markConsumed(Collection<Long> ids, long consumedAt) {
        lock.writeLock().lock();
        try {
            Set<Long> wanted = new HashSet<>(ids);
            StoreDocument updated = document.copy();
            int marked = 0;
            for (StoredAttestation stored : updated.getAttestations()) {
                if (wanted.contains(stored.getId()) && !stored.isConsumed()) {
                    stored.setConsumed(true);
                    stored.setConsumedAt(consumedAt);
                    marked++;
                }
            }
            if (marked > 0) {
                persist(updated);
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

    private List<StoredAttestation> select(Predicate<StoredAttestation> condition) {
        lock.readLock().lock();
        try {
            return document.getAttestations().stream()
                    .filter(condition)
                    .map(StoredAttestation::copy)
                    .sorted(NEWEST_FIRST)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    private int deleteWhere(Predicate<StoredAttestation> condition) {
        lock.writeLock().lock();
        try {
            StoreDocument updated = document.copy();
            int before = updated.getAttestations().size();
            updated.getAttestations().removeIf(condition);
            int deleted = before - updated.getAttestations().size();
            if (deleted > 0) {
                persist(updated);
            }
            return deleted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock. The in-memory document is only replaced once the file is written.
    private void persist(StoreDocument updated) {
        Path tempFile = storageDir.resolve(STORE_FILE + ".tmp");
        try {
            mapper.writeValue(tempFile.toFile(), updated);
            Files.move(tempFile, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            document = updated;
        } catch (IOException e) {
            log.error("Failed to write attestation store {}", storeFile, e);
            throw new AttestationStorageException("Failed to write attestation store: " + storeFile, e);
        }
    }

    private static String walletKey(String subjectWallet) {
        return subjectWallet == null ? "" : subjectWallet.toLowerCase(Locale.ROOT);
    }

    @Data
    @NoArgsConstructor
    static class StoreDocument {
        private long nextId = 1;
        private List<StoredAttestation> attestations = new ArrayList<>();

        StoreDocument copy() {
            StoreDocument copy = new StoreDocument();
            copy.setNextId(nextId);
            copy.setAttestations(new ArrayList<>(attestations.stream().map(StoredAttestation::copy).toList()));
            return copy;
        }
    }

}
