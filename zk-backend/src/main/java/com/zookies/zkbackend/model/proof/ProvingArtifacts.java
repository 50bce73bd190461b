package com.zookies.zkbackend.model.proof;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Loaded circuit artifacts. The wasm and zkey files stay on disk and are identified by their SHA-256;
 * the verification key is parsed once.
 */
@Getter
@ToString
@AllArgsConstructor
public class ProvingArtifacts {

    private final Path wasmPath;
    private final Path zkeyPath;
    private final String wasmSha256;
    private final String zkeySha256;
    @ToString.Exclude
    private final JsonNode verificationKey;

    public String getProtocol() {
        return verificationKey.path("protocol").asText();
    }

    public String getCurve() {
        return verificationKey.path("curve").asText();
    }

    public int getPublicSignalCount() {
        return verificationKey.path("nPublic").asInt(-1);
    }

}
