package io.github.simpleiam.log.core.internal;

import io.github.simpleiam.log.api.Field;
import io.github.simpleiam.log.api.InfoLogger;
import io.github.simpleiam.log.api.Level;
import io.github.simpleiam.log.api.LogPanicException;
import io.github.simpleiam.log.api.Logger;
import io.github.simpleiam.log.api.context.LogContext;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.List;

/**
 * LogEngine 기반 Logger 구현.
 *
 * <p>레코드 기록은 엔진에 맡기고, PANIC/FATAL 에스컬레이션은 기록 이후 여기서 수행한다.</p>
 */
public class DefaultLogger implements Logger {

    static final String FORMAT_ERROR_MESSAGE = "invalid format string passed to logging";

    private final LogEngine engine;
    private final String name;
    private final List<Field> boundFields;
    private final org.slf4j.Logger delegate;

    public DefaultLogger(LogEngine engine) {
        this(engine, engine.getOptions().getName(), List.of());
    }

    private DefaultLogger(LogEngine engine, String name, List<Field> boundFields) {
        this.engine = engine;
        this.name = name == null ? "" : name;
        this.boundFields = boundFields;
        this.delegate = engine.loggerFor(this.name);
    }

    @Override
    public void log(Level level, String message, Field... fields) {
        emit(level, message, fields);
        escalate(level, message);
    }

    @Override
    public void logf(Level level, String format, Object... args) {
        String message = emitf(level, format, args);
        if (level == Level.PANIC || level == Level.FATAL) {
            escalate(level, message != null ? message : formatMessage(format, args));
        }
    }

    @Override
    public void logw(Level level, String message, Object... keysAndValues) {
        emitw(level, message, keysAndValues);
        escalate(level, message);
    }

    @Override
    public InfoLogger v(int verbosity) {
        if (!engine.isEnabled(verbosity)) {
            return NoopInfoLogger.INSTANCE;
        }
        return new LevelInfoLogger(this, Level.fromCode(verbosity));
    }

    @Override
    public Logger withValues(Object... keysAndValues) {
        List<Field> extra = KeyValues.convert(keysAndValues, this::diagnose);
        if (extra.isEmpty()) {
            return this;
        }
        return derive(name, extra);
    }

    @Override
    public Logger withName(String childName) {
        if (childName == null || childName.isEmpty()) {
            return this;
        }
        return derive(name.isEmpty() ? childName : name + "." + childName, List.of());
    }

    @Override
    public Logger withContext(LogContext context) {
        if (context == null || context.isEmpty()) {
            return this;
        }
        List<Field> extra = new ArrayList<>(3);
        context.getRequestId().ifPresent(value -> extra.add(Field.any(LogContext.KEY_REQUEST_ID, value)));
        context.getUsername().ifPresent(value -> extra.add(Field.any(LogContext.KEY_USERNAME, value)));
        context.getWatcherName().ifPresent(value -> extra.add(Field.any(LogContext.KEY_WATCHER_NAME, value)));
        if (extra.isEmpty()) {
            return this;
        }
        return derive(name, extra);
    }

    @Override
    public int write(byte[] bytes) {
        if (bytes == null) {
            return 0;
        }
        String text = new String(bytes, StandardCharsets.UTF_8);
        if (text.endsWith("\r\n")) {
            text = text.substring(0, text.length() - 2);
        } else if (text.endsWith("\n")) {
            text = text.substring(0, text.length() - 1);
        }
        emit(Level.INFO, text);
        return bytes.length;
    }

    @Override
    public OutputStream asOutputStream(Level level) {
        return new LoggerOutputStream(this, level);
    }

    @Override
    public void flush() {
        engine.flush();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public org.slf4j.Logger slf4j() {
        return delegate;
    }

    /** INFO 레벨 활성 여부 */
    @Override
    public boolean enabled() {
        return engine.isEnabled(Level.INFO);
    }

    @Override
    public String toString() {
        return "DefaultLogger{name='" + name + "', fields=" + boundFields.size() + "}";
    }

    // 에스컬레이션 없이 기록. v() 로거와 OutputStream 어댑터가 공유한다.

    void emit(Level level, String message, Field... fields) {
        if (engine.isEnabled(level)) {
            engine.write(delegate, level, message, boundFields,
                    fields == null ? List.of() : Arrays.asList(fields));
        }
    }

    /** @return 기록된 메시지, 비활성이면 null */
    String emitf(Level level, String format, Object... args) {
        if (!engine.isEnabled(level)) {
            return null;
        }
        String message = formatMessage(format, args);
        engine.write(delegate, level, message, boundFields, List.of());
        return message;
    }

    void emitw(Level level, String message, Object... keysAndValues) {
        if (engine.isEnabled(level)) {
            engine.write(delegate, level, message, boundFields, KeyValues.convert(keysAndValues, this::diagnose));
        }
    }

    private String formatMessage(String format, Object... args) {
        if (format == null) {
            return "";
        }
        if (args == null || args.length == 0) {
            return format;
        }
        try {
            return String.format(format, args);
        } catch (IllegalFormatException e) {
            diagnose(FORMAT_ERROR_MESSAGE, Field.string("format", format));
            return format + " " + Arrays.toString(args);
        }
    }

    /** 호출 계약 위반을 DPANIC 레코드로 보고. 예외를 던지지 않는다. */
    private void diagnose(String message, Field detail) {
        if (engine.isEnabled(Level.DPANIC)) {
            engine.write(delegate, Level.DPANIC, message, boundFields, List.of(detail));
        }
    }

    private void escalate(Level level, String message) {
        if (level == Level.PANIC) {
            engine.flush();
            throw new LogPanicException(name, message);
        }
        if (level == Level.FATAL) {
            engine.terminate(1);
        }
    }

    private DefaultLogger derive(String childName, List<Field> extra) {
        List<Field> fields = new ArrayList<>(boundFields.size() + extra.size());
        fields.addAll(boundFields);
        fields.addAll(extra);
        return new DefaultLogger(engine, childName, Collections.unmodifiableList(fields));
    }
}
