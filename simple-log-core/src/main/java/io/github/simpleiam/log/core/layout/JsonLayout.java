package io.github.simpleiam.log.core.layout;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonGenerator;
import io.github.simpleiam.log.api.domain.LogRecord;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * 한 줄에 JSON 객체 하나. 고정 키(level, timestamp, logger, caller, message) 뒤에 필드, 마지막에 stacktrace.
 *
 * <p>고정 키는 항상 먼저 기록된다. 같은 이름의 필드는 고정 키를 덮어쓰지 않고 뒤에 중복 키로 기록된다.</p>
 */
public class JsonLayout extends LayoutBase<ILoggingEvent> {

    public static final String LEVEL_KEY = "level";
    public static final String TIMESTAMP_KEY = "timestamp";
    public static final String LOGGER_KEY = "logger";
    public static final String CALLER_KEY = "caller";
    public static final String MESSAGE_KEY = "message";

    private boolean includeCaller = true;

    @Override
    public String doLayout(ILoggingEvent event) {
        LogRecord record = LogRecord.fromEvent(event, includeCaller);

        StringWriter out = new StringWriter(256);
        try (JsonGenerator generator = FieldRenderer.newGenerator(out)) {
            generator.writeStartObject();
            generator.writeStringField(LEVEL_KEY, record.getLevel().name());
            generator.writeStringField(TIMESTAMP_KEY, FieldRenderer.formatTimestamp(record.getTimestamp()));
            if (!record.getLoggerName().isEmpty()) {
                generator.writeStringField(LOGGER_KEY, record.getLoggerName());
            }
            if (record.getCaller() != null) {
                generator.writeStringField(CALLER_KEY, record.getCaller());
            }
            generator.writeStringField(MESSAGE_KEY, record.getMessage());
            FieldRenderer.writeFields(generator, record.getFields());
            if (record.getStacktrace() != null) {
                generator.writeStringField(LogRecord.STACKTRACE_KEY, record.getStacktrace());
            }
            generator.writeEndObject();
        } catch (IOException e) {
            // StringWriter 출력은 실패하지 않는다
            throw new UncheckedIOException(e);
        }

        return out + CoreConstants.LINE_SEPARATOR;
    }

    public void setIncludeCaller(boolean includeCaller) {
        this.includeCaller = includeCaller;
    }
}
