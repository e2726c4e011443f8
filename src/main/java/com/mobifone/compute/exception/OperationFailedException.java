package com.mobifone.compute.exception;

import lombok.Getter;

/**
 * A long-running operation completed with an error code set.
 */
@Getter
public class OperationFailedException extends AppException {

    private final String operationName;
    private final String operationErrorCode;

    public OperationFailedException(String operationName, String operationErrorCode, String message) {
        super(ErrorCode.OPERATION_FAILED, message);
        this.operationName = operationName;
        this.operationErrorCode = operationErrorCode;
    }

    public OperationFailedException(String operationName, String operationErrorCode, String message, Throwable cause) {
        super(ErrorCode.OPERATION_FAILED, message, cause);
        this.operationName = operationName;
        this.operationErrorCode = operationErrorCode;
    }
}
