package io.github.simpleiam.log.test;

import io.github.simpleiam.log.api.Field;
import io.github.simpleiam.log.api.Level;
import io.github.simpleiam.log.api.domain.LogRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.simpleiam.log.test.LogRecordAssert.assertThatRecord;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Test LogRecordAssert utility
 */
class LogRecordAssertTest {

    private static LogRecord record(Level level, String message, Field... fields) {
        return LogRecord.builder()
                .timestamp(System.currentTimeMillis())
                .level(level)
                .loggerName("iam.apiserver")
                .message(message)
                .fields(List.of(fields))
                .build();
    }

    @Test
    void testFieldValue() {
        LogRecord record = record(Level.INFO, "user created", Field.string("username", "colin"), Field.any("age", 30));

        assertThatRecord(record)
                .hasLevel(Level.INFO)
                .hasMessage("user created")
                .hasLoggerName("iam.apiserver")
                .hasField("username", "colin")
                .hasField("age").withValue(30)
                .doesNotHaveField("password");
    }

    @Test
    void testRepeatedFieldValues() {
        LogRecord record = record(Level.INFO, "m", Field.any("k", "a"), Field.any("k", "b"));

        assertThatRecord(record)
                .hasFieldValues("k", "a", "b")
                .hasField("k", "b");

        assertThatThrownBy(() -> assertThatRecord(record).hasFieldValues("k", "b"))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Expected field <k> to have values <[b]> but was <[a, b]>");
    }

    @Test
    void testNoFields() {
        assertThatRecord(record(Level.WARN, "disk almost full"))
                .hasNoFields()
                .messageContains("disk");
    }

    @Test
    void testMissingFieldFails() {
        LogRecord record = record(Level.INFO, "message", Field.any("a", 1));

        assertThatThrownBy(() -> assertThatRecord(record).hasField("b"))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Expected log to have field <b>");
    }

    @Test
    void testWrongValueFails() {
        LogRecord record = record(Level.INFO, "message", Field.any("a", 1));

        assertThatThrownBy(() -> assertThatRecord(record).hasField("a", 2))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Expected field <a> to be <2> but was <1>");
    }

    @Test
    void testWrongLevelFails() {
        LogRecord record = record(Level.ERROR, "message");

        assertThatThrownBy(() -> assertThatRecord(record).hasLevel(Level.WARN))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Expected log level to be <WARN> but was <ERROR>");
    }

    @Test
    void testWithValueWithoutField() {
        LogRecord record = record(Level.INFO, "message");

        assertThatThrownBy(() -> assertThatRecord(record).withValue("x"))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("No field selected");
    }

    @Test
    void testMissingStacktraceFails() {
        assertThatThrownBy(() -> assertThatRecord(record(Level.PANIC, "m")).hasStacktrace())
                .isInstanceOf(AssertionError.class);
    }
}
