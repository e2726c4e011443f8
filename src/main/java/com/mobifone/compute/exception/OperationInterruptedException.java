package com.mobifone.compute.exception;

public class OperationInterruptedException extends AppException {

    public OperationInterruptedException(String label, InterruptedException cause) {
        super(ErrorCode.OPERATION_INTERRUPTED, "Interrupted while waiting for " + label, cause);
    }
}
