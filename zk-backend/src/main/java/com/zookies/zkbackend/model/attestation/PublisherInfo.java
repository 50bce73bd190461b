package com.zookies.zkbackend.model.attestation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public half of a configured publisher key. Never carries the private key.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PublisherInfo {

    private String domain;
    private String publicKey;
    private String address;

}
