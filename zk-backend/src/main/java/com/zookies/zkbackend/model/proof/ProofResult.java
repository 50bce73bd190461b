package com.zookies.zkbackend.model.proof;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.zookies.zkbackend.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one proof request. {@code proof} and {@code publicSignals} are present only on success.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProofResult {

    private boolean success;
    private JsonNode proof;
    private List<String> publicSignals;
    private String error;
    private ErrorCode errorCode;
    private Metadata metadata;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Metadata {
        private String tag;
        private Long threshold;
        private Long totalScore;
        private Integer attestationCount;
        // ISO-8601 instant
        private String timestamp;

        public static Metadata of(String tag, Long threshold, Long totalScore, Integer attestationCount) {
            return new Metadata(tag, threshold, totalScore, attestationCount, Instant.now().toString());
        }
    }

    public static ProofResult success(JsonNode proof, List<String> publicSignals, Metadata metadata) {
        return new ProofResult(true, proof, publicSignals, null, null, metadata);
    }

    public static ProofResult failure(ErrorCode errorCode, String error, Metadata metadata) {
        return new ProofResult(false, null, null, error, errorCode, metadata);
    }

}
