package io.github.simpleiam.log.api;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * 타입이 지정된 구조화 필드 (key, type, value).
 *
 * 키는 항상 문자열이므로 key/value 가변 인자 변환에서 발생하는 형 검사 실패가 컴파일 시점에 차단된다.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Field {

    /** Field.error(Throwable)이 사용하는 키 */
    public static final String ERROR_KEY = "error";

    public enum Type {
        STRING,
        LONG,
        DOUBLE,
        BOOLEAN,
        DURATION,
        ERROR,
        MAP,
        ANY
    }

    private final String key;
    private final Type type;
    private final Object value;

    private Field(String key, Type type, Object value) {
        this.key = Objects.requireNonNull(key, "key");
        this.type = type;
        this.value = value;
    }

    public static Field string(String key, String value) {
        return new Field(key, Type.STRING, value);
    }

    public static Field of(String key, long value) {
        return new Field(key, Type.LONG, value);
    }

    public static Field of(String key, double value) {
        return new Field(key, Type.DOUBLE, value);
    }

    public static Field bool(String key, boolean value) {
        return new Field(key, Type.BOOLEAN, value);
    }

    public static Field duration(String key, Duration value) {
        return new Field(key, Type.DURATION, value);
    }

    public static Field error(Throwable throwable) {
        return error(ERROR_KEY, throwable);
    }

    public static Field error(String key, Throwable throwable) {
        return new Field(key, Type.ERROR, throwable);
    }

    public static Field map(String key, Map<String, ?> value) {
        return new Field(key, Type.MAP, value);
    }

    /** 값의 런타임 타입으로 Type 추론 */
    public static Field any(String key, Object value) {
        return new Field(key, inferType(value), value);
    }

    private static Type inferType(Object value) {
        if (value instanceof String) {
            return Type.STRING;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Type.LONG;
        }
        if (value instanceof Double || value instanceof Float) {
            return Type.DOUBLE;
        }
        if (value instanceof Boolean) {
            return Type.BOOLEAN;
        }
        if (value instanceof Duration) {
            return Type.DURATION;
        }
        if (value instanceof Throwable) {
            return Type.ERROR;
        }
        if (value instanceof Map) {
            return Type.MAP;
        }
        return Type.ANY;
    }
}
