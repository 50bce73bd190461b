package com.zookies.zkbackend.exception;

import lombok.Getter;

@Getter
public class ZkBackendException extends RuntimeException {

    private final ErrorCode errorCode;

    public ZkBackendException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ZkBackendException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

}
