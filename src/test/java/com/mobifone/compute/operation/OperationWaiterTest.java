package com.mobifone.compute.operation;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.mobifone.compute.configuration.ComputeProperties;
import com.mobifone.compute.exception.ErrorCode;
import com.mobifone.compute.exception.OperationFailedException;
import com.mobifone.compute.exception.OperationInterruptedException;
import com.mobifone.compute.exception.OperationTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationWaiterTest {

    private ComputeProperties properties;
    private OperationWaiter waiter;

    private Logger waiterLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        properties = new ComputeProperties();
        properties.getOperation().setTimeout(Duration.ofSeconds(5));
        properties.getOperation().setPollInterval(Duration.ofMillis(2));
        properties.getOperation().setMaxPollInterval(Duration.ofMillis(10));
        waiter = new OperationWaiter(properties);

        waiterLogger = (Logger) LoggerFactory.getLogger(OperationWaiter.class);
        appender = new ListAppender<>();
        appender.start();
        waiterLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        waiterLogger.detachAppender(appender);
        Thread.interrupted();
    }

    @Test
    void returns_result_of_operation_done_without_warnings() {
        var operation = new ScriptedOperation<>("op-1", 2, OperationSnapshot.done("started"));

        String result = waiter.await(operation, "instance starting");

        assertThat(result).isEqualTo("started");
        assertThat(operation.polls()).isEqualTo(3);
        assertThat(diagnostics()).isEmpty();
    }

    @Test
    void logs_every_warning_and_still_returns_result() {
        var warnings = List.of(
                new OperationWarning("DISK_SIZE_LARGER_THAN_IMAGE_SIZE", "disk is larger than image"),
                new OperationWarning("NO_RESULTS_ON_PAGE", "empty page"),
                new OperationWarning("UNREACHABLE", "zone unreachable"));
        var operation = new ScriptedOperation<>("op-2", 1, OperationSnapshot.done("stopped", warnings));

        String result = waiter.await(operation, "instance stopping");

        assertThat(result).isEqualTo("stopped");
        List<ILoggingEvent> diagnostics = diagnostics();
        assertThat(diagnostics).hasSize(3);
        assertThat(diagnostics).allMatch(e -> e.getLevel() == Level.WARN);
        assertThat(messages(diagnostics))
                .anyMatch(m -> m.contains("instance stopping") && m.contains("DISK_SIZE_LARGER_THAN_IMAGE_SIZE"))
                .anyMatch(m -> m.contains("NO_RESULTS_ON_PAGE") && m.contains("empty page"))
                .anyMatch(m -> m.contains("UNREACHABLE") && m.contains("zone unreachable"));
    }

    @Test
    void failed_operation_is_logged_with_label_and_id_then_raised() {
        var operation = new ScriptedOperation<String>("operation-1700", 0,
                OperationSnapshot.failed("400", "Instance is not ready"));

        assertThatThrownBy(() -> waiter.await(operation, "instance stopping"))
                .isInstanceOfSatisfying(OperationFailedException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.OPERATION_FAILED);
                    assertThat(e.getOperationErrorCode()).isEqualTo("400");
                    assertThat(e.getOperationName()).isEqualTo("operation-1700");
                    assertThat(e.getMessage()).isEqualTo("Instance is not ready");
                });

        List<ILoggingEvent> diagnostics = diagnostics();
        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).getLevel()).isEqualTo(Level.ERROR);
        assertThat(diagnostics.get(0).getFormattedMessage())
                .contains("instance stopping")
                .contains("400")
                .contains("Instance is not ready")
                .contains("operation-1700");
    }

    @Test
    void failed_operation_rethrows_its_own_runtime_exception() {
        var own = new IllegalStateException("quota exceeded");
        var operation = new ScriptedOperation<String>("op-3", 0,
                OperationSnapshot.failed("RESOURCE_EXHAUSTED", "quota exceeded", own));

        assertThatThrownBy(() -> waiter.await(operation, "instance starting")).isSameAs(own);
        assertThat(diagnostics()).hasSize(1);
    }

    @Test
    void failed_operation_wraps_checked_exception() {
        var own = new IOException("connection reset");
        var operation = new ScriptedOperation<String>("op-4", 0,
                OperationSnapshot.failed("IOException", "connection reset", own));

        assertThatThrownBy(() -> waiter.await(operation, "instance starting"))
                .isInstanceOf(OperationFailedException.class)
                .hasCause(own);
    }

    @Test
    void times_out_when_operation_stays_pending() {
        var operation = new ScriptedOperation<String>("op-5", Integer.MAX_VALUE, OperationSnapshot.done("never"));

        assertThatThrownBy(() -> waiter.await(operation, "instance starting", Duration.ofMillis(40)))
                .isInstanceOfSatisfying(OperationTimeoutException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.OPERATION_TIMEOUT);
                    assertThat(e.getOperationName()).isEqualTo("op-5");
                    assertThat(e.getTimeout()).isEqualTo(Duration.ofMillis(40));
                });
        assertThat(operation.resultObserved()).isFalse();
        assertThat(diagnostics()).isEmpty();
    }

    @Test
    void zero_timeout_polls_once() {
        var operation = new ScriptedOperation<String>("op-6", Integer.MAX_VALUE, OperationSnapshot.done("never"));

        assertThatThrownBy(() -> waiter.await(operation, "instance starting", Duration.ZERO))
                .isInstanceOf(OperationTimeoutException.class);
        assertThat(operation.polls()).isEqualTo(1);
    }

    @Test
    void default_timeout_comes_from_properties() {
        properties.getOperation().setTimeout(Duration.ofMillis(25));
        var operation = new ScriptedOperation<String>("op-7", Integer.MAX_VALUE, OperationSnapshot.done("never"));

        assertThatThrownBy(() -> waiter.await(operation, "instance starting"))
                .isInstanceOfSatisfying(OperationTimeoutException.class,
                        e -> assertThat(e.getTimeout()).isEqualTo(Duration.ofMillis(25)));
    }

    @Test
    void await_indefinitely_returns_once_operation_completes() {
        properties.getOperation().setTimeout(Duration.ZERO);
        var operation = new ScriptedOperation<>("op-8", 8, OperationSnapshot.done("done"));

        assertThat(waiter.awaitIndefinitely(operation, "instance starting")).isEqualTo("done");
        assertThat(operation.polls()).isEqualTo(9);
    }

    @Test
    void waiting_twice_on_completed_operation_returns_same_result() {
        Object payload = new Object();
        var operation = new ScriptedOperation<>("op-9", 1, OperationSnapshot.done(payload));

        Object first = waiter.await(operation, "instance starting");
        Object second = waiter.await(operation, "instance starting");

        assertThat(first).isSameAs(payload);
        assertThat(second).isSameAs(payload);
        assertThat(operation.polls()).isEqualTo(3);
    }

    @Test
    void interrupt_while_waiting_raises_and_keeps_interrupt_flag() {
        var operation = new ScriptedOperation<String>("op-10", Integer.MAX_VALUE, OperationSnapshot.done("never"));
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> waiter.await(operation, "instance stopping"))
                .isInstanceOf(OperationInterruptedException.class)
                .hasCauseInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    private List<ILoggingEvent> diagnostics() {
        return appender.list.stream()
                .filter(e -> e.getLevel().isGreaterOrEqual(Level.WARN))
                .collect(Collectors.toList());
    }

    private static List<String> messages(List<ILoggingEvent> events) {
        return events.stream().map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
    }

    /**
     * Reports PENDING for a fixed number of polls, then the given terminal snapshot forever.
     */
    private static final class ScriptedOperation<T> implements LongRunningOperation<T> {
        private final String name;
        private final int pendingPolls;
        private final OperationSnapshot<T> terminal;
        private int polls;

        ScriptedOperation(String name, int pendingPolls, OperationSnapshot<T> terminal) {
            this.name = name;
            this.pendingPolls = pendingPolls;
            this.terminal = terminal;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public OperationSnapshot<T> poll() {
            polls++;
            return polls > pendingPolls ? terminal : OperationSnapshot.pending();
        }

        int polls() {
            return polls;
        }

        boolean resultObserved() {
            return polls > pendingPolls;
        }
    }
}
