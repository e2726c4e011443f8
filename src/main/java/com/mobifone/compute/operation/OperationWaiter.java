package com.mobifone.compute.operation;

import com.mobifone.compute.configuration.ComputeProperties;
import com.mobifone.compute.exception.OperationFailedException;
import com.mobifone.compute.exception.OperationInterruptedException;
import com.mobifone.compute.exception.OperationTimeoutException;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the caller until a {@link LongRunningOperation} reaches a terminal state.
 * <p>
 * Success returns the operation result. A provider error is logged together with the
 * operation ID and raised, as the operation's own exception when it carries one or as
 * {@link OperationFailedException} otherwise. Warnings are logged one record per warning
 * and do not fail the call. Exceeding the timeout raises {@link OperationTimeoutException};
 * the remote action keeps running on the provider side.
 */
@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class OperationWaiter {

    ComputeProperties properties;

    /** Waits with the configured default timeout. */
    public <T> T await(LongRunningOperation<T> operation, String label) {
        return await(operation, label, properties.getOperation().getTimeout());
    }

    public <T> T awaitIndefinitely(LongRunningOperation<T> operation, String label) {
        return await(operation, label, null);
    }

    /**
     * @param timeout upper bound of the wait, {@code null} to wait indefinitely
     */
    public <T> T await(LongRunningOperation<T> operation, String label, Duration timeout) {
        OperationSnapshot<T> snapshot = pollUntilTerminal(operation, label, timeout);

        if (snapshot.getStatus() == OperationSnapshot.Status.FAILED) {
            log.error("Error during {}: [Code: {}]: {} (Operation ID: {})",
                    label, snapshot.getErrorCode(), snapshot.getErrorMessage(), operation.getName());
            throw toFailure(operation, snapshot);
        }

        for (OperationWarning warning : snapshot.getWarnings()) {
            log.warn("Warning during {} - {}: {}", label, warning.getCode(), warning.getMessage());
        }
        return snapshot.getResult();
    }

    private <T> OperationSnapshot<T> pollUntilTerminal(LongRunningOperation<T> operation, String label, Duration timeout) {
        boolean bounded = timeout != null;
        long deadline = bounded ? System.nanoTime() + timeout.toNanos() : 0L;

        long maxInterval = properties.getOperation().getMaxPollInterval().toMillis();
        long interval = Math.max(1L, properties.getOperation().getPollInterval().toMillis());
        long increment = 0L;

        while (true) {
            OperationSnapshot<T> snapshot = operation.poll();
            if (snapshot.isTerminal()) {
                return snapshot;
            }

            long sleepMillis = interval;
            if (bounded) {
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    log.debug("Gave up waiting for {} ({}) after {}", label, operation.getName(), timeout);
                    throw new OperationTimeoutException(label, operation.getName(), timeout);
                }
                sleepMillis = Math.min(interval, Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remainingNanos)));
            }
            sleep(sleepMillis, label);

            // Fibonacci backoff, capped
            long previous = increment;
            increment = interval;
            interval = Math.min(maxInterval, interval + previous);
        }
    }

    private void sleep(long millis, String label) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationInterruptedException(label, e);
        }
    }

    private RuntimeException toFailure(LongRunningOperation<?> operation, OperationSnapshot<?> snapshot) {
        Throwable cause = snapshot.getCause();
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        String message = snapshot.getErrorMessage() != null
                ? snapshot.getErrorMessage()
                : "Operation " + operation.getName() + " failed with code " + snapshot.getErrorCode();
        return cause == null
                ? new OperationFailedException(operation.getName(), snapshot.getErrorCode(), message)
                : new OperationFailedException(operation.getName(), snapshot.getErrorCode(), message, cause);
    }
}
