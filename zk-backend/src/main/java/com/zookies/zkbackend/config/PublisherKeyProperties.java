package com.zookies.zkbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "zookies")
public class PublisherKeyProperties {

    private List<Publisher> publishers = new ArrayList<>();

    @Data
    public static class Publisher {
        private String domain;
        // 0x + 64 hex chars
        private String privateKey;
        // Optional; checked against the key derived from privateKey when present
        private String publicKey;
        private String address;
    }

}
