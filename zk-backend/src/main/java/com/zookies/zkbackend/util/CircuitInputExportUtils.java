package com.zookies.zkbackend.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.zookies.zkbackend.config.ProofCircuitProperties;
import com.zookies.zkbackend.model.proof.CircuitInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Files exchanged with the snarkjs CLI. Each proof or verification gets its own work directory.
 */
@Slf4j
@Component
public class CircuitInputExportUtils {

    private final Path workRoot;
    private final ObjectMapper mapper;

    @Autowired
    public CircuitInputExportUtils(ProofCircuitProperties properties) {
        this(Paths.get(properties.getSnarkjs().getWorkDir()));
    }

    public CircuitInputExportUtils(Path workRoot) {
        this.workRoot = workRoot;
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path createWorkDirectory(String prefix) {
        try {
            Files.createDirectories(workRoot);
            return Files.createTempDirectory(workRoot, prefix).toAbsolutePath();
        } catch (IOException e) {
            throw new RuntimeException("Failed to create work directory under " + workRoot, e);
        }
    }

    /**
     * Writes the prover input with the signal names of the ThresholdProof circuit.
     */
    public Path writeCircuitInput(CircuitInput input, Path dir) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("attestationScores", input.getScores().stream().map(String::valueOf).toList());
        json.put("targetTag", String.valueOf(input.getTargetTagId()));
        json.put("threshold", String.valueOf(input.getThreshold()));
        return writeJson(json, dir, "input.json");
    }

    public Path writeJson(Object value, Path dir, String fileName) {
        Path path = dir.resolve(fileName);
        try {
            mapper.writeValue(path.toFile(), value);
            return path;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write " + path, e);
        }
    }

    public <T> T readJson(Path path, Class<T> type) {
        try {
            return mapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + path, e);
        }
    }

    public List<String> readPublicSignals(Path path) {
        try {
            return List.of(mapper.readValue(path.toFile(), String[].class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read public signals from " + path, e);
        }
    }

    public void deleteWorkDirectory(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.warn("Failed to clean up work directory {}", dir, e);
        }
    }

}
