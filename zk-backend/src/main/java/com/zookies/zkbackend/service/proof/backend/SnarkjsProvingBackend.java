package com.zookies.zkbackend.service.proof.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.zookies.zkbackend.exception.ErrorCode;
import com.zookies.zkbackend.exception.ProofGenerationException;
import com.zookies.zkbackend.model.proof.BackendProof;
import com.zookies.zkbackend.model.proof.CircuitInput;
import com.zookies.zkbackend.model.proof.ProvingArtifacts;
import com.zookies.zkbackend.util.CircuitInputExportUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs {@code snarkjs groth16 fullprove} and {@code snarkjs groth16 verify} as child processes.
 * An interrupt while waiting kills the child.
 */
@Slf4j
public class SnarkjsProvingBackend implements ProvingBackend {

    private static final String LOG_FILE = "snarkjs.log";

    private final List<String> command;
    private final CircuitInputExportUtils exportUtils;

    public SnarkjsProvingBackend(String command, CircuitInputExportUtils exportUtils) {
        // Allows "npx snarkjs" as well as a plain binary
        this.command = Arrays.asList(command.trim().split("\\s+"));
        this.exportUtils = exportUtils;
    }

    @Override
    public BackendProof prove(CircuitInput input, ProvingArtifacts artifacts) throws InterruptedException {
        Path dir = exportUtils.createWorkDirectory("prove-");
        try {
            Path inputFile = exportUtils.writeCircuitInput(input, dir);
            Path proofFile = dir.resolve("proof.json");
            Path publicFile = dir.resolve("public.json");
            int exitCode = run(dir, "groth16", "fullprove", inputFile.toString(),
                    artifacts.getWasmPath().toString(), artifacts.getZkeyPath().toString(),
                    proofFile.toString(), publicFile.toString());
            if (exitCode != 0 || !Files.exists(proofFile) || !Files.exists(publicFile)) {
                throw new ProofGenerationException(ErrorCode.BACKEND_FAILURE,
                        "Proof generation failed (snarkjs exit code " + exitCode + "): " + tail(dir));
            }
            return new BackendProof(exportUtils.readJson(proofFile, JsonNode.class), exportUtils.readPublicSignals(publicFile));
        } finally {
            exportUtils.deleteWorkDirectory(dir);
        }
    }

    @Override
    public boolean verify(JsonNode verificationKey, List<String> publicSignals, JsonNode proof) throws InterruptedException {
        Path dir = exportUtils.createWorkDirectory("verify-");
        try {
            Path vkFile = exportUtils.writeJson(verificationKey, dir, "verification_key.json");
            Path publicFile = exportUtils.writeJson(publicSignals, dir, "public.json");
            Path proofFile = exportUtils.writeJson(proof, dir, "proof.json");
            int exitCode = run(dir, "groth16", "verify", vkFile.toString(), publicFile.toString(), proofFile.toString());
            String output = tail(dir);
            if (exitCode == 0 && output.contains("OK")) {
                return true;
            }
            if (output.contains("Invalid proof")) {
                return false;
            }
            throw new ProofGenerationException(ErrorCode.BACKEND_FAILURE,
                    "Proof verification failed (snarkjs exit code " + exitCode + "): " + output);
        } finally {
            exportUtils.deleteWorkDirectory(dir);
        }
    }

    private int run(Path dir, String... args) throws InterruptedException {
        List<String> cmds = new ArrayList<>(command);
        cmds.addAll(Arrays.asList(args));
        log.info("Run {}", String.join(" ", cmds));

        ProcessBuilder pb = new ProcessBuilder(cmds);
        pb.directory(dir.toFile());
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(dir.resolve(LOG_FILE).toFile()));
        Process proc;
        try {
            proc = pb.start();
        } catch (IOException e) {
            throw new ProofGenerationException(ErrorCode.BACKEND_FAILURE, "Failed to start snarkjs: " + e.getMessage(), e);
        }
        try {
            return proc.waitFor();
        } catch (InterruptedException e) {
            log.warn("Interrupted, killing snarkjs process {}", proc.pid());
            proc.destroyForcibly();
            throw e;
        }
    }

    private String tail(Path dir) {
        Path logFile = dir.resolve(LOG_FILE);
        try {
            String output = Files.exists(logFile) ? Files.readString(logFile, StandardCharsets.UTF_8).trim() : "";
            return output.length() > 500 ? output.substring(output.length() - 500) : output;
        } catch (IOException e) {
            return "<no output: " + e.getMessage() + ">";
        }
    }

}
