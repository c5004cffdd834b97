package io.typeflow.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.typeflow.core.error.DecodeFailureException;
import io.typeflow.core.schema.TypeRef;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Every invocation logs {@code operation.invoked} and then either {@code decode.completed} or
 * {@code decode.failed}, each tagged with the invocation id in the MDC.
 */
@DisplayName("Invocation logging")
class InvocationLoggingTest {

    /** Snapshots the MDC when the event is appended, while the invocation id is still set. */
    private static final class CapturingAppender extends ListAppender<ILoggingEvent> {
        @Override
        protected void append(ILoggingEvent event) {
            event.prepareForDeferredProcessing();
            super.append(event);
        }
    }

    private OperationRegistry registry;
    private CapturingAppender appender;
    private Logger invocationLogger;
    private Level previousLevel;

    @BeforeEach
    void setUp() {
        registry = new OperationRegistry(Fixtures.schema());
        registry.register("extractUser", "v1", TypeRef.named("User"), args -> new RecordingPayload(
                "{\"name\": \"Ada\"", ", \"age\": 36}"));
        registry.register("classify", "v2", TypeRef.named("Account"), args -> new RecordingPayload(
                "{\"owner\": \"ann\", \"status\": \"unknown\"}"));

        invocationLogger = (Logger) LoggerFactory.getLogger(Invocation.class);
        previousLevel = invocationLogger.getLevel();
        invocationLogger.setLevel(Level.DEBUG);
        appender = new CapturingAppender();
        appender.start();
        invocationLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        invocationLogger.detachAppender(appender);
        invocationLogger.setLevel(previousLevel);
        appender.stop();
    }

    private List<ILoggingEvent> eventsContaining(String marker) {
        return appender.list.stream()
                .filter(e -> e.getFormattedMessage().contains(marker))
                .toList();
    }

    @Test
    @DisplayName("A successful call logs invocation and completion at INFO")
    void successfulCall() {
        registry.call("extractUser", null);

        List<ILoggingEvent> invoked = eventsContaining("operation.invoked");
        List<ILoggingEvent> completed = eventsContaining("decode.completed");
        assertThat(invoked).hasSize(1);
        assertThat(invoked.get(0).getLevel()).isEqualTo(Level.INFO);
        assertThat(invoked.get(0).getFormattedMessage())
                .isEqualTo("operation.invoked operation=extractUser version=v1 target=User");
        assertThat(completed).hasSize(1);
        assertThat(completed.get(0).getFormattedMessage())
                .startsWith("decode.completed operation=extractUser version=v1 target=User partials=2 duration_ms=");
        assertThat(eventsContaining("decode.failed")).isEmpty();
    }

    @Test
    @DisplayName("Every event of one invocation carries its invocation id")
    void invocationIdInMdc() {
        StreamHandle handle = registry.stream("extractUser", null);
        handle.finalValue();

        assertThat(appender.list)
                .isNotEmpty()
                .allSatisfy(e -> assertThat(e.getMDCPropertyMap()).containsEntry(Invocation.MDC_KEY, handle.invocationId()));
        assertThat(MDC.get(Invocation.MDC_KEY)).isNull();
    }

    @Test
    @DisplayName("A caller's MDC value is restored after each pull")
    void callerMdcRestored() {
        MDC.put(Invocation.MDC_KEY, "outer");
        try {
            registry.call("extractUser", null);
            assertThat(MDC.get(Invocation.MDC_KEY)).isEqualTo("outer");
        } finally {
            MDC.remove(Invocation.MDC_KEY);
        }
    }

    @Test
    @DisplayName("A failed decode logs decode.failed at WARN with the error")
    void failedCall() {
        assertThatThrownBy(() -> registry.call("classify", null)).isInstanceOf(DecodeFailureException.class);

        List<ILoggingEvent> failed = eventsContaining("decode.failed");
        assertThat(failed).hasSize(1);
        assertThat(failed.get(0).getLevel()).isEqualTo(Level.WARN);
        assertThat(failed.get(0).getFormattedMessage())
                .startsWith("decode.failed operation=classify version=v2 target=Account duration_ms=")
                .contains("status");
        assertThat(eventsContaining("decode.completed")).isEmpty();
    }

    @Test
    @DisplayName("Cancelling a stream logs operation.cancelled at DEBUG")
    void cancelledStream() {
        try (StreamHandle handle = registry.stream("extractUser", null)) {
            handle.next();
        }

        List<ILoggingEvent> cancelled = eventsContaining("operation.cancelled");
        assertThat(cancelled).hasSize(1);
        assertThat(cancelled.get(0).getLevel()).isEqualTo(Level.DEBUG);
    }
}
