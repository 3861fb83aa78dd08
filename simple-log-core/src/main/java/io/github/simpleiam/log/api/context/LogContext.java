package io.github.simpleiam.log.api.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * 요청 범위 로깅 Context. 불변 값이며 ThreadLocal로 현재 스레드에 바인딩할 수 있다.
 *
 * requestID, username, watcher 세 키가 {@link io.github.simpleiam.log.api.Logger#withContext}의 추출 대상이다.
 */
public final class LogContext {

    public static final String KEY_REQUEST_ID = "requestID";
    public static final String KEY_USERNAME = "username";
    public static final String KEY_WATCHER_NAME = "watcher";

    private static final LogContext EMPTY = new LogContext(Map.of());
    private static final ThreadLocal<LogContext> CURRENT = ThreadLocal.withInitial(() -> EMPTY);

    private final Map<String, Object> values;

    private LogContext(Map<String, Object> values) {
        this.values = values;
    }

    public static LogContext empty() {
        return EMPTY;
    }

    /** 현재 ThreadLocal Context 반환 */
    public static LogContext current() {
        return CURRENT.get();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 기존 값을 복사한 Builder */
    public Builder toBuilder() {
        return new Builder().values(values);
    }

    /** ThreadLocal에 설정. 반환된 Scope close 시 이전 Context 복원. */
    public Scope makeCurrent() {
        LogContext previous = CURRENT.get();
        CURRENT.set(this);
        return () -> CURRENT.set(previous);
    }

    /** Runnable 래핑. 실행 시 이 Context 활성화. */
    public Runnable wrap(Runnable runnable) {
        return () -> {
            try (Scope ignored = this.makeCurrent()) {
                runnable.run();
            }
        };
    }

    /** Callable 래핑. 실행 시 이 Context 활성화. */
    public <T> Callable<T> wrap(Callable<T> callable) {
        return () -> {
            try (Scope ignored = this.makeCurrent()) {
                return callable.call();
            }
        };
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<Object> getRequestId() {
        return get(KEY_REQUEST_ID);
    }

    public Optional<Object> getUsername() {
        return get(KEY_USERNAME);
    }

    public Optional<Object> getWatcherName() {
        return get(KEY_WATCHER_NAME);
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "LogContext" + values;
    }

    /** Context 스코프 관리 (AutoCloseable) */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    public static class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder requestId(Object requestId) {
            return with(KEY_REQUEST_ID, requestId);
        }

        public Builder username(Object username) {
            return with(KEY_USERNAME, username);
        }

        public Builder watcher(Object watcherName) {
            return with(KEY_WATCHER_NAME, watcherName);
        }

        /** null 값은 키 제거 */
        public Builder with(String key, Object value) {
            if (value == null) {
                values.remove(key);
            } else {
                values.put(key, value);
            }
            return this;
        }

        public Builder values(Map<String, ?> values) {
            values.forEach(this::with);
            return this;
        }

        public LogContext build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new LogContext(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
