package com.mobifone.compute.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class OperationTimeoutException extends AppException {

    private final String operationName;
    private final Duration timeout;

    public OperationTimeoutException(String label, String operationName, Duration timeout) {
        super(ErrorCode.OPERATION_TIMEOUT,
                "Timed out after " + timeout.toSeconds() + "s waiting for " + label + " (" + operationName + ")");
        this.operationName = operationName;
        this.timeout = timeout;
    }
}
