package com.zookies.zkbackend.config;

import com.zookies.zkbackend.repository.attestation.AttestationRegistry;
import com.zookies.zkbackend.repository.attestation.InMemoryAttestationRegistry;
import com.zookies.zkbackend.repository.attestation.JsonFileAttestationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class AttestationRegistryConfig {

    private final AttestationProperties properties;

    @Bean
    public AttestationRegistry attestationRegistry() throws IOException {
        String registryType = properties.getRegistry().getType();
        log.info("Use {} attestation registry", registryType);
        return switch (registryType.toLowerCase()) {
            case "json" -> new JsonFileAttestationRegistry(properties.getStorage().getPath());
            case "memory" -> new InMemoryAttestationRegistry();
            default -> throw new IllegalArgumentException("Unsupported registry type: " + registryType);
        };
    }

}
