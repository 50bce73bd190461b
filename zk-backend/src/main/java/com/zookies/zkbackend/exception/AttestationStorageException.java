package com.zookies.zkbackend.exception;

/**
 * The attestation store could not be read or written. Callers may retry.
 */
public class AttestationStorageException extends ZkBackendException {

    public AttestationStorageException(String message, Throwable cause) {
        super(ErrorCode.DATABASE_ERROR, message, cause);
    }

}
