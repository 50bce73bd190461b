package com.zookies.zkbackend.model.attestation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttestationStatistics {

    private long totalAttestations;
    private Map<String, Long> tagCounts;
    private Map<String, Long> publisherCounts;
    private long consumedAttestations;
    // Unix seconds, null for an empty set
    private Long oldestTimestamp;
    private Long newestTimestamp;

}
