package com.mobifone.compute.operation;

import lombok.Value;

@Value
public class OperationWarning {
    String code;
    String message;
}
