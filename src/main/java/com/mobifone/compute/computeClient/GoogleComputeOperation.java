package com.mobifone.compute.computeClient;

import com.google.api.gax.longrunning.OperationFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.cloud.compute.v1.Operation;
import com.google.cloud.compute.v1.Warnings;
import com.mobifone.compute.exception.OperationInterruptedException;
import com.mobifone.compute.operation.LongRunningOperation;
import com.mobifone.compute.operation.OperationSnapshot;
import com.mobifone.compute.operation.OperationWarning;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Adapts a GCE zonal {@link OperationFuture} to {@link LongRunningOperation}.
 * The first terminal snapshot is kept and returned by every later poll.
 */
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
class GoogleComputeOperation implements LongRunningOperation<Operation> {

    OperationFuture<Operation, Operation> future;

    @NonFinal
    volatile String name;

    @NonFinal
    volatile OperationSnapshot<Operation> terminal;

    GoogleComputeOperation(String description, OperationFuture<Operation, Operation> future) {
        this.name = description;
        this.future = future;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized OperationSnapshot<Operation> poll() {
        if (terminal != null) {
            return terminal;
        }
        if (!future.isDone()) {
            return OperationSnapshot.pending();
        }
        try {
            terminal = fromOperation(future.get());
        } catch (ExecutionException e) {
            // gax fails the future on a provider error, fromOperation never sees it
            resolveProviderName();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            terminal = OperationSnapshot.failed(codeOf(cause), cause.getMessage(), cause);
        } catch (CancellationException e) {
            resolveProviderName();
            terminal = OperationSnapshot.failed("CANCELLED", "Operation " + name + " was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationInterruptedException(name, e);
        }
        return terminal;
    }

    private void resolveProviderName() {
        try {
            String providerName = future.getName();
            if (providerName != null && !providerName.isEmpty()) {
                name = providerName;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while resolving operation ID of '{}'", name);
        } catch (ExecutionException | CancellationException e) {
            log.debug("Operation ID of '{}' unavailable: {}", name, e.getMessage());
        }
    }

    private OperationSnapshot<Operation> fromOperation(Operation operation) {
        if (!operation.getName().isEmpty()) {
            name = operation.getName();
        }
        if (operation.hasError()) {
            return OperationSnapshot.failed(errorCodeOf(operation), errorMessageOf(operation));
        }
        List<OperationWarning> warnings = operation.getWarningsList().stream()
                .map(GoogleComputeOperation::toWarning)
                .collect(Collectors.toList());
        return OperationSnapshot.done(operation, warnings);
    }

    private static String errorCodeOf(Operation operation) {
        if (operation.hasHttpErrorStatusCode()) {
            return String.valueOf(operation.getHttpErrorStatusCode());
        }
        return operation.getError().getErrorsList().stream()
                .map(e -> e.getCode())
                .findFirst()
                .orElse("UNKNOWN");
    }

    private static String errorMessageOf(Operation operation) {
        if (operation.hasHttpErrorMessage() && !operation.getHttpErrorMessage().isEmpty()) {
            return operation.getHttpErrorMessage();
        }
        return operation.getError().getErrorsList().stream()
                .map(e -> e.getMessage())
                .collect(Collectors.joining("; "));
    }

    private static OperationWarning toWarning(Warnings warning) {
        return new OperationWarning(warning.getCode(), warning.getMessage());
    }

    private static String codeOf(Throwable cause) {
        if (cause instanceof ApiException apiException) {
            return apiException.getStatusCode().getCode().name();
        }
        return cause.getClass().getSimpleName();
    }
}
