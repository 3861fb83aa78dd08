package io.github.simpleiam.log.api.domain;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import io.github.simpleiam.log.api.Field;
import io.github.simpleiam.log.api.Level;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.slf4j.Marker;
import org.slf4j.event.KeyValuePair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 기록된 로그 레코드. 레이아웃 렌더링과 테스트 검증의 공통 단위.
 */
@Getter
@Builder
@ToString
public class LogRecord {

    /** 출력에서 stacktrace를 담는 키. 이벤트에서는 {@link CapturedStacktrace} 값으로 구분한다. */
    public static final String STACKTRACE_KEY = "stacktrace";

    private static final String ROOT_LOGGER_NAME = org.slf4j.Logger.ROOT_LOGGER_NAME;

    /** 타임스탬프 (epoch millis) */
    private final long timestamp;

    private final Level level;

    /** 계층형 로거 이름 (루트는 빈 문자열) */
    private final String loggerName;

    /** "File.java:line" 형식. 수집하지 않았으면 null. */
    private final String caller;

    private final String message;

    /** 구조화 필드 (바인딩 필드 먼저, 호출 필드 나중). 같은 키가 반복되어도 모두 유지한다. */
    private final List<Field> fields;

    private final String stacktrace;

    /** Logback ILoggingEvent에서 LogRecord 생성 */
    public static LogRecord fromEvent(ILoggingEvent event, boolean includeCaller) {
        List<Field> fields = new ArrayList<>();
        String stacktrace = null;

        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs != null) {
            for (KeyValuePair pair : pairs) {
                if (pair.value instanceof CapturedStacktrace) {
                    stacktrace = ((CapturedStacktrace) pair.value).getText();
                } else {
                    fields.add(Field.any(String.valueOf(pair.key), pair.value));
                }
            }
        }

        if (stacktrace == null && event.getThrowableProxy() != null) {
            stacktrace = ThrowableProxyUtil.asString(event.getThrowableProxy());
        }

        return LogRecord.builder()
                .timestamp(event.getTimeStamp())
                .level(extractLevel(event))
                .loggerName(extractLoggerName(event))
                .caller(includeCaller ? extractCaller(event) : null)
                .message(event.getFormattedMessage())
                .fields(Collections.unmodifiableList(fields))
                .stacktrace(stacktrace)
                .build();
    }

    public static LogRecord fromEvent(ILoggingEvent event) {
        return fromEvent(event, false);
    }

    public boolean hasField(String key) {
        return fields.stream().anyMatch(field -> field.getKey().equals(key));
    }

    /** 키의 마지막 값. 없으면 null. */
    public Object getField(String key) {
        Object value = null;
        for (Field field : fields) {
            if (field.getKey().equals(key)) {
                value = field.getValue();
            }
        }
        return value;
    }

    /** 키의 모든 값 (기록 순서) */
    public List<Object> getFieldValues(String key) {
        return fields.stream()
                .filter(field -> field.getKey().equals(key))
                .map(Field::getValue)
                .collect(Collectors.toList());
    }

    /** 키별 마지막 값의 Map 뷰 (키 순서는 첫 등장 순서) */
    public Map<String, Object> getFieldMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Field field : fields) {
            map.put(field.getKey(), field.getValue());
        }
        return Collections.unmodifiableMap(map);
    }

    private static Level extractLevel(ILoggingEvent event) {
        List<Marker> markers = event.getMarkerList();
        if (markers != null) {
            for (Marker marker : markers) {
                Level fromMarker = Level.fromMarkerName(marker.getName()).orElse(null);
                if (fromMarker != null) {
                    return fromMarker;
                }
            }
        }

        switch (event.getLevel().toInt()) {
            case ch.qos.logback.classic.Level.ERROR_INT:
                return Level.ERROR;
            case ch.qos.logback.classic.Level.WARN_INT:
                return Level.WARN;
            case ch.qos.logback.classic.Level.INFO_INT:
                return Level.INFO;
            default:
                return Level.DEBUG;
        }
    }

    private static String extractLoggerName(ILoggingEvent event) {
        String name = event.getLoggerName();
        return name == null || ROOT_LOGGER_NAME.equals(name) ? "" : name;
    }

    private static String extractCaller(ILoggingEvent event) {
        StackTraceElement[] callerData = event.getCallerData();
        if (callerData == null || callerData.length == 0) {
            return null;
        }
        StackTraceElement frame = callerData[0];
        String file = frame.getFileName() != null ? frame.getFileName() : frame.getClassName();
        return file + ":" + frame.getLineNumber();
    }
}
