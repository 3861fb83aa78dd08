package io.github.simpleiam.log.core.layout;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import io.github.simpleiam.log.api.Level;
import io.github.simpleiam.log.api.domain.LogRecord;

/**
 * 사람이 읽는 탭 구분 형식.
 *
 * <pre>
 * 2024-03-01 12:00:00.000	INFO	iam.apiserver	UserService.java:42	user created	{"requestID":"r-1"}
 * </pre>
 */
public class ConsoleLayout extends LayoutBase<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";

    private boolean includeCaller = true;
    private boolean color;

    @Override
    public String doLayout(ILoggingEvent event) {
        LogRecord record = LogRecord.fromEvent(event, includeCaller);

        StringBuilder sb = new StringBuilder(128);
        sb.append(FieldRenderer.formatTimestamp(record.getTimestamp()));
        sb.append('\t').append(levelText(record.getLevel()));
        if (!record.getLoggerName().isEmpty()) {
            sb.append('\t').append(record.getLoggerName());
        }
        if (record.getCaller() != null) {
            sb.append('\t').append(record.getCaller());
        }
        sb.append('\t').append(record.getMessage());

        if (!record.getFields().isEmpty()) {
            sb.append('\t').append(FieldRenderer.writeObject(record.getFields()));
        }

        sb.append(CoreConstants.LINE_SEPARATOR);

        if (record.getStacktrace() != null) {
            sb.append(record.getStacktrace());
            if (!record.getStacktrace().endsWith(CoreConstants.LINE_SEPARATOR)) {
                sb.append(CoreConstants.LINE_SEPARATOR);
            }
        }
        return sb.toString();
    }

    private String levelText(Level level) {
        String text = level.name();
        if (!color) {
            return text;
        }
        return ansiColor(level) + text + RESET;
    }

    private static String ansiColor(Level level) {
        switch (level) {
            case DEBUG:
                return "\u001B[35m";
            case INFO:
                return "\u001B[34m";
            case WARN:
                return "\u001B[33m";
            default:
                return "\u001B[31m";
        }
    }

    public void setIncludeCaller(boolean includeCaller) {
        this.includeCaller = includeCaller;
    }

    public void setColor(boolean color) {
        this.color = color;
    }
}
