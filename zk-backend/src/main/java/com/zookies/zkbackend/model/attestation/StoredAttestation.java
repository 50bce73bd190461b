package com.zookies.zkbackend.model.attestation;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class StoredAttestation extends Attestation {

    private long id;

    private boolean consumed;

    // Unix seconds, null until consumed
    private Long consumedAt;

    // Unix seconds
    private long createdAt;

    public static StoredAttestation of(long id, Attestation source, long createdAt) {
        StoredAttestation stored = new StoredAttestation();
        stored.setId(id);
        stored.setTag(source.getTag());
        stored.setScore(source.getScore());
        stored.setTimestamp(source.getTimestamp());
        stored.setNonce(source.getNonce());
        stored.setSignature(source.getSignature());
        stored.setPublisher(source.getPublisher());
        stored.setSubjectWallet(source.getSubjectWallet());
        stored.setSignerAddress(source.getSignerAddress());
        stored.setMessage(source.getMessage());
        stored.setCreatedAt(createdAt);
        return stored;
    }

    public StoredAttestation copy() {
        StoredAttestation copy = of(id, this, createdAt);
        copy.setConsumed(consumed);
        copy.setConsumedAt(consumedAt);
        return copy;
    }

}
