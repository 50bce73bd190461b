package com.zookies.zkbackend.exception;

public class ProofGenerationException extends ZkBackendException {

    public ProofGenerationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ProofGenerationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

}
