package com.zookies.zkbackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI zookiesOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Zookies Attestation and Threshold Proof API")
                        .version("0.1.0")
                        .description("API for signing and storing publisher interest attestations and proving interest thresholds with Groth16."));
    }

    @Bean
    public GroupedOpenApi attestationGroup() {
        return GroupedOpenApi.builder()
                .group("attestations")
                .pathsToMatch("/api/attestations/**", "/api/profile/**", "/api/publishers/**")
                .build();
    }

    @Bean
    public GroupedOpenApi proofGroup() {
        return GroupedOpenApi.builder()
                .group("proof")
                .pathsToMatch("/api/proof/**")
                .build();
    }

}
