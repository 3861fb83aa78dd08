package io.github.simpleiam.log.core.internal;

import io.github.simpleiam.log.api.Field;
import io.github.simpleiam.log.api.InfoLogger;
import io.github.simpleiam.log.api.Level;
import io.github.simpleiam.log.api.LogPanicException;
import io.github.simpleiam.log.api.Logger;
import io.github.simpleiam.log.api.config.Options;
import io.github.simpleiam.log.api.context.LogContext;
import io.github.simpleiam.log.api.domain.LogRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DefaultLogger")
class DefaultLoggerTest {

    private CaptureSupport capture;
    private DefaultLogger logger;

    @BeforeEach
    void setUp() {
        capture = CaptureSupport.debug();
        logger = capture.logger();
    }

    @Nested
    @DisplayName("Call shapes")
    class CallShapeTests {

        @Test
        @DisplayName("should emit typed fields at the requested level")
        void shouldEmitTypedFields() {
            logger.warn("disk almost full", Field.of("usage", 93L), Field.duration("elapsed", Duration.ofMillis(5)));

            LogRecord record = capture.last();
            assertThat(record.getLevel()).isEqualTo(Level.WARN);
            assertThat(record.getMessage()).isEqualTo("disk almost full");
            assertThat(record.getFieldMap())
                    .containsEntry("usage", 93L)
                    .containsEntry("elapsed", Duration.ofMillis(5));
        }

        @Test
        @DisplayName("should format message for f-shape calls")
        void shouldFormatMessage() {
            logger.infof("user %s created in %d ms", "colin", 12);

            assertThat(capture.last().getMessage()).isEqualTo("user colin created in 12 ms");
        }

        @Test
        @DisplayName("should convert key/value pairs for w-shape calls")
        void shouldConvertKeyValues() {
            logger.errorw("a", "a", "1");

            LogRecord record = capture.last();
            assertThat(record.getLevel()).isEqualTo(Level.ERROR);
            assertThat(record.getMessage()).isEqualTo("a");
            assertThat(record.getFieldMap()).containsExactly(entry("a", "1"));
        }

        @Test
        @DisplayName("should keep a user field named stacktrace as an ordinary field")
        void shouldKeepUserStacktraceField() {
            logger.infow("m", "stacktrace", "user-value");

            LogRecord record = capture.last();
            assertThat(record.getStacktrace()).isNull();
            assertThat(record.getFields()).containsExactly(Field.any("stacktrace", "user-value"));
        }

        @Test
        @DisplayName("should keep a user stacktrace field beside the captured one")
        void shouldSeparateCapturedStacktrace() {
            catchThrowable(() -> logger.panicw("m", "stacktrace", "user-value"));

            LogRecord record = capture.last();
            assertThat(record.getField("stacktrace")).isEqualTo("user-value");
            assertThat(record.getStacktrace()).contains("\tat ").doesNotContain("user-value");
        }

        @Test
        @DisplayName("should keep the raw format when arguments do not match")
        void shouldSurviveBadFormat() {
            logger.infof("count=%d", "not-a-number");

            assertThat(capture.records())
                    .extracting(LogRecord::getMessage)
                    .containsExactly(DefaultLogger.FORMAT_ERROR_MESSAGE, "count=%d [not-a-number]");
        }

        @Test
        @DisplayName("should tag levels above ERROR with their own name")
        void shouldPreserveDpanicLevel() {
            logger.log(Level.DPANIC, "contract broken");

            assertThat(capture.last().getLevel()).isEqualTo(Level.DPANIC);
        }
    }

    @Nested
    @DisplayName("Self-diagnostics")
    class DiagnosticTests {

        @Test
        @DisplayName("should report odd key/value count and keep the complete pairs")
        void shouldReportOddArguments() {
            logger.infow("msg", "a", 1, "dangling");

            assertThat(capture.records()).hasSize(2);
            LogRecord diagnostic = capture.records().get(0);
            assertThat(diagnostic.getLevel()).isEqualTo(Level.DPANIC);
            assertThat(diagnostic.getMessage()).isEqualTo(KeyValues.ODD_ARGUMENTS_MESSAGE);
            assertThat(diagnostic.getFieldMap()).containsEntry("ignored key", "dangling");

            LogRecord record = capture.records().get(1);
            assertThat(record.getMessage()).isEqualTo("msg");
            assertThat(record.getFieldMap()).containsExactly(entry("a", 1));
        }

        @Test
        @DisplayName("should never escalate diagnostics emitted by a filtered logger")
        void shouldNotThrowForDiagnostics() {
            CaptureSupport errorOnly = CaptureSupport.create(Options.builder().level("error"));

            assertThatCode(() -> errorOnly.logger().withValues(42, "x").errorw("m", Field.string("k", "v")))
                    .doesNotThrowAnyException();
            assertThat(errorOnly.records())
                    .extracting(LogRecord::getLevel)
                    .containsExactly(Level.DPANIC, Level.DPANIC, Level.ERROR);
        }
    }

    @Nested
    @DisplayName("Gating")
    class GatingTests {

        @Test
        @DisplayName("should drop records below the threshold without converting key/values")
        void shouldDropBelowThreshold() {
            CaptureSupport warnOnly = CaptureSupport.create(Options.builder().level("warn"));
            DefaultLogger warnLogger = warnOnly.logger();

            warnLogger.info("ignored");
            warnLogger.debugw("ignored", "dangling");
            warnLogger.warn("kept");

            assertThat(warnOnly.records()).extracting(LogRecord::getMessage).containsExactly("kept");
            assertThat(warnLogger.enabled()).isFalse();
        }

        @Test
        @DisplayName("should return the shared no-op logger for disabled verbosity")
        void shouldReturnNoopForDisabledVerbosity() {
            CaptureSupport infoOnly = CaptureSupport.create(Options.builder().level("info"));
            DefaultLogger infoLogger = infoOnly.logger();

            InfoLogger disabled = infoLogger.v(-1);
            assertThat(disabled).isSameAs(NoopInfoLogger.INSTANCE).isSameAs(infoLogger.v(-5));
            assertThat(disabled.enabled()).isFalse();

            disabled.info("never");
            assertThat(infoOnly.records()).isEmpty();
        }

        @Test
        @DisplayName("should emit at the verbosity level without escalating")
        void shouldEmitAtVerbosityLevel() {
            InfoLogger v = logger.v(4);

            assertThat(v.enabled()).isTrue();
            assertThat(((LevelInfoLogger) v).level()).isEqualTo(Level.PANIC);
            assertThatCode(() -> v.infow("verbose", "k", "v")).doesNotThrowAnyException();
            assertThat(capture.last().getLevel()).isEqualTo(Level.PANIC);
            assertThat(logger.v(9).enabled()).isTrue();
            assertThat(capture.exitCodes()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Derivation")
    class DerivationTests {

        @Test
        @DisplayName("should not mutate the parent when binding values")
        void shouldNotMutateParent() {
            Logger child = logger.withValues("user", "colin");
            Logger grandChild = child.withValues("role", "admin");

            logger.info("parent");
            child.info("child");
            grandChild.info("grandchild");

            assertThat(capture.records().get(0).getFieldMap()).isEmpty();
            assertThat(capture.records().get(1).getFieldMap()).containsExactly(entry("user", "colin"));
            assertThat(capture.records().get(2).getFieldMap())
                    .containsExactly(entry("user", "colin"), entry("role", "admin"));
        }

        @Test
        @DisplayName("should append repeated keys instead of replacing them")
        void shouldAppendRepeatedKeys() {
            logger.withValues("k", "a").withValues("k", "b").infow("m", "k", "c");

            LogRecord record = capture.last();
            assertThat(record.getFields()).containsExactly(
                    Field.any("k", "a"), Field.any("k", "b"), Field.any("k", "c"));
            assertThat(record.getFieldValues("k")).containsExactly("a", "b", "c");
            assertThat(record.getField("k")).isEqualTo("c");
        }

        @Test
        @DisplayName("should join names with dots")
        void shouldJoinNames() {
            Logger named = logger.withName("apiserver").withName("user");

            named.info("hello");

            assertThat(named.name()).isEqualTo("apiserver.user");
            assertThat(capture.last().getLoggerName()).isEqualTo("apiserver.user");
            assertThat(logger.name()).isEmpty();
            assertThat(logger.withName("")).isSameAs(logger);
        }

        @Test
        @DisplayName("should bind only the context keys that are present")
        void shouldBindPresentContextKeys() {
            LogContext context = LogContext.builder().requestId("r-1").build();

            logger.withContext(context).info("request");

            assertThat(capture.last().getFieldMap()).containsExactly(entry(LogContext.KEY_REQUEST_ID, "r-1"));
        }

        @Test
        @DisplayName("should bind all three context keys in order")
        void shouldBindAllContextKeys() {
            LogContext context = LogContext.builder()
                    .requestId("r-2")
                    .username("colin")
                    .watcher("clean")
                    .with("ignored", "value")
                    .build();

            logger.withContext(context).info("request");

            assertThat(capture.last().getFieldMap()).containsExactly(
                    entry(LogContext.KEY_REQUEST_ID, "r-2"),
                    entry(LogContext.KEY_USERNAME, "colin"),
                    entry(LogContext.KEY_WATCHER_NAME, "clean"));
        }

        @Test
        @DisplayName("should read the thread-bound context")
        void shouldReadCurrentContext() {
            try (LogContext.Scope ignored = LogContext.builder().username("admin").build().makeCurrent()) {
                logger.withCurrentContext().info("scoped");
            }

            assertThat(capture.last().getFieldMap()).containsExactly(entry(LogContext.KEY_USERNAME, "admin"));
        }
    }

    @Nested
    @DisplayName("Escalation")
    class EscalationTests {

        @Test
        @DisplayName("should throw after the panic record is written")
        void shouldPanicAfterWrite() {
            assertThatThrownBy(() -> logger.withName("worker").panicw("state corrupted", "id", 7))
                    .isInstanceOf(LogPanicException.class)
                    .hasMessage("state corrupted")
                    .extracting("loggerName").isEqualTo("worker");

            LogRecord record = capture.last();
            assertThat(record.getLevel()).isEqualTo(Level.PANIC);
            assertThat(record.getFieldMap()).containsEntry("id", 7);
            assertThat(record.getStacktrace()).contains("DefaultLoggerTest");
        }

        @Test
        @DisplayName("should panic with the formatted message")
        void shouldPanicWithFormattedMessage() {
            assertThatThrownBy(() -> logger.panicf("bad %s", "state"))
                    .isInstanceOf(LogPanicException.class)
                    .hasMessage("bad state");
        }

        @Test
        @DisplayName("should call the termination hook after a fatal record")
        void shouldTerminateOnFatal() {
            logger.fatal("cannot continue");

            assertThat(capture.last().getLevel()).isEqualTo(Level.FATAL);
            assertThat(capture.exitCodes()).containsExactly(1);
        }

        @Test
        @DisplayName("should escalate even when the level is filtered")
        void shouldEscalateWhenFiltered() {
            CaptureSupport silent = CaptureSupport.create(Options.builder().level("fatal"));
            DefaultLogger silentLogger = silent.logger();

            assertThatThrownBy(() -> silentLogger.panic("filtered")).isInstanceOf(LogPanicException.class);
            assertThat(silent.records()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Byte sink")
    class ByteSinkTests {

        @Test
        @DisplayName("should emit one INFO record and report the full length")
        void shouldWriteBytes() {
            byte[] bytes = "plain text line\n".getBytes(StandardCharsets.UTF_8);

            int written = logger.write(bytes);

            assertThat(written).isEqualTo(bytes.length);
            assertThat(capture.last().getLevel()).isEqualTo(Level.INFO);
            assertThat(capture.last().getMessage()).isEqualTo("plain text line");
        }

        @Test
        @DisplayName("should report full length even when INFO is disabled")
        void shouldWriteWhenDisabled() {
            CaptureSupport errorOnly = CaptureSupport.create(Options.builder().level("error"));

            assertThat(errorOnly.logger().write(new byte[]{'x', 'y'})).isEqualTo(2);
            assertThat(errorOnly.records()).isEmpty();
        }

        @Test
        @DisplayName("should split output stream content into line records")
        void shouldSplitLines() throws IOException {
            try (OutputStream out = logger.asOutputStream(Level.WARN)) {
                out.write("first\nsecond\r\nthi".getBytes(StandardCharsets.UTF_8));
                out.write("rd".getBytes(StandardCharsets.UTF_8));
            }

            assertThat(capture.records())
                    .extracting(LogRecord::getMessage)
                    .containsExactly("first", "second", "third");
            assertThat(capture.records()).extracting(LogRecord::getLevel).containsOnly(Level.WARN);
        }
    }

    @Test
    @DisplayName("should expose the underlying SLF4J logger")
    void shouldExposeSlf4jLogger() {
        Logger named = logger.withName("bridge");

        named.slf4j().info("through slf4j");

        assertThat(named.slf4j().getName()).isEqualTo("bridge");
        assertThat(capture.last().getMessage()).isEqualTo("through slf4j");
        assertThat(capture.last().getFieldMap()).isEqualTo(Map.of());
    }
}
