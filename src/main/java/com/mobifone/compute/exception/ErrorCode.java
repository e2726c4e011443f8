package com.mobifone.compute.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

@Getter
public enum ErrorCode {
    UNCATEGORIZED_EXCEPTION(9999, "Uncategorized error", HttpStatus.INTERNAL_SERVER_ERROR),
    INVALID_KEY(1001, "Invalid request", HttpStatus.BAD_REQUEST),
    REQUEST_REJECTED(1002, "Request rejected", HttpStatus.BAD_REQUEST),
    COMPUTE_PROVIDER_NOT_FOUND(1101, "COMPUTE_PROVIDER_NOT_FOUND", HttpStatus.INTERNAL_SERVER_ERROR),
    COMPUTE_API_ERR(1102, "COMPUTE_API_ERR", HttpStatus.INTERNAL_SERVER_ERROR),
    OPERATION_FAILED(1103, "OPERATION_FAILED", HttpStatus.INTERNAL_SERVER_ERROR),
    OPERATION_TIMEOUT(1104, "OPERATION_TIMEOUT", HttpStatus.INTERNAL_SERVER_ERROR),
    OPERATION_INTERRUPTED(1105, "OPERATION_INTERRUPTED", HttpStatus.INTERNAL_SERVER_ERROR),

    ;

    ErrorCode(int code, String message, HttpStatusCode statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    private final int code;
    private final String message;
    private final HttpStatusCode statusCode;
}
