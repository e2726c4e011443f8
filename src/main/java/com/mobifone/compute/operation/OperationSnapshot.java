package com.mobifone.compute.operation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.FieldDefaults;

import java.util.List;

/**
 * State of a {@link LongRunningOperation} observed by a single {@code poll()}.
 * <p>
 * PENDING carries nothing. DONE carries the result and zero or more warnings.
 * FAILED carries the provider error code, its message and, when the provider
 * raised one, the underlying exception.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class OperationSnapshot<T> {

    public enum Status {
        PENDING,
        DONE,
        FAILED
    }

    Status status;
    T result;
    List<OperationWarning> warnings;
    String errorCode;
    String errorMessage;
    Throwable cause;

    public static <T> OperationSnapshot<T> pending() {
        return new OperationSnapshot<>(Status.PENDING, null, List.of(), null, null, null);
    }

    public static <T> OperationSnapshot<T> done(T result) {
        return done(result, List.of());
    }

    public static <T> OperationSnapshot<T> done(T result, List<OperationWarning> warnings) {
        return new OperationSnapshot<>(Status.DONE, result,
                warnings == null ? List.of() : List.copyOf(warnings), null, null, null);
    }

    public static <T> OperationSnapshot<T> failed(String errorCode, String errorMessage) {
        return failed(errorCode, errorMessage, null);
    }

    public static <T> OperationSnapshot<T> failed(String errorCode, String errorMessage, Throwable cause) {
        return new OperationSnapshot<>(Status.FAILED, null, List.of(), errorCode, errorMessage, cause);
    }

    public boolean isTerminal() {
        return status != Status.PENDING;
    }

}
