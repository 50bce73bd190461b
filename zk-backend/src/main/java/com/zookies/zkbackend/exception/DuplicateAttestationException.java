package com.zookies.zkbackend.exception;

import lombok.Getter;

@Getter
public class DuplicateAttestationException extends ZkBackendException {

    private final String nonce;

    public DuplicateAttestationException(String nonce) {
        super(ErrorCode.DUPLICATE_ERROR, "Attestation with nonce " + nonce + " already stored");
        this.nonce = nonce;
    }

}
