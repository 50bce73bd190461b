package com.zookies.zkbackend.exception;

public class AttestationValidationException extends ZkBackendException {

    public AttestationValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

}
