package com.zookies.zkbackend.exception;

public class CryptographyException extends ZkBackendException {

    public CryptographyException(String message) {
        super(ErrorCode.CRYPTOGRAPHY_ERROR, message);
    }

    public CryptographyException(String message, Throwable cause) {
        super(ErrorCode.CRYPTOGRAPHY_ERROR, message, cause);
    }

}
