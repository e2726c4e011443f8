package com.mobifone.compute.operation;

/**
 * Handle of an asynchronous provider-side action (start/stop an instance, ...).
 * <p>
 * Implementations must be non-blocking in {@link #poll()} and must keep returning
 * the same snapshot once a terminal one has been observed; polling never
 * re-submits the underlying action.
 *
 * @param <T> type of the value the operation yields on success
 */
public interface LongRunningOperation<T> {

    /** Provider identifier of the operation, used in diagnostics. */
    String getName();

    OperationSnapshot<T> poll();
}
