package com.zookies.zkbackend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.zookies.zkbackend.exception.ErrorCode;
import com.zookies.zkbackend.exception.ZkBackendException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a signing or storage call: either a value or an error code with a message.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OperationResult<T> {

    private final boolean success;
    private final T value;
    private final ErrorCode errorCode;
    private final String error;

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(true, value, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorCode errorCode, String error) {
        return new OperationResult<>(false, null, errorCode, error);
    }

    public static <T> OperationResult<T> failure(ZkBackendException e) {
        return failure(e.getErrorCode(), e.getMessage());
    }

    @JsonIgnore
    public boolean isRetryable() {
        return errorCode != null && errorCode.isRetryable();
    }

}
