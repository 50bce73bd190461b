package com.zookies.zkbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "attestation")
public class AttestationProperties {

    private RegistryProperties registry = new RegistryProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class RegistryProperties {
        private String type = "memory";
    }

    @Data
    public static class StorageProperties {
        private String path = "data/attestations";
    }

}
