package io.github.simpleiam.log.api;

import io.github.simpleiam.log.api.context.LogContext;

import java.io.OutputStream;

/**
 * 구조화 로깅 Facade.
 *
 * <p>레벨마다 세 가지 호출 형태를 제공한다:</p>
 * <ul>
 *   <li>{@code info(msg, Field...)} - 타입 지정 필드</li>
 *   <li>{@code infof(format, args...)} - printf 형식 메시지</li>
 *   <li>{@code infow(msg, k1, v1, k2, v2...)} - key/value 교대 인자</li>
 * </ul>
 *
 * <p>인스턴스는 불변이다. with* 메서드는 엔진을 공유하는 새 인스턴스를 반환하고 원본은 변경하지 않는다.</p>
 *
 * <p>PANIC 레벨은 기록 후 {@link LogPanicException}을 던지고, FATAL 레벨은 기록과 flush 후
 * {@link TerminationHook}으로 프로세스를 종료한다. 두 동작은 레벨이 비활성이어도 수행된다.</p>
 */
public interface Logger extends InfoLogger {

    void log(Level level, String message, Field... fields);

    void logf(Level level, String format, Object... args);

    void logw(Level level, String message, Object... keysAndValues);

    /** verbosity 레벨 로거. 비활성이면 공유 no-op 인스턴스. */
    InfoLogger v(int verbosity);

    /** 바인딩 필드를 추가한 자식 로거 */
    Logger withValues(Object... keysAndValues);

    /** 이름을 '.'으로 연결한 자식 로거 */
    Logger withName(String name);

    /** LogContext의 requestID, username, watcher 값을 바인딩한 자식 로거 */
    Logger withContext(LogContext context);

    default Logger withCurrentContext() {
        return withContext(LogContext.current());
    }

    /** 바이트를 하나의 INFO 레코드로 기록. 항상 전체 길이를 반환. */
    int write(byte[] bytes);

    default OutputStream asOutputStream() {
        return asOutputStream(Level.INFO);
    }

    /** 지정 레벨로 기록하는 OutputStream 어댑터 */
    OutputStream asOutputStream(Level level);

    /** 버퍼링된 레코드를 모든 sink에 기록. 종료 전 반드시 호출. */
    void flush();

    /** 계층형 로거 이름. 루트는 빈 문자열. */
    String name();

    /** 내부 SLF4J 로거 */
    org.slf4j.Logger slf4j();

    @Override
    default void info(String message, Field... fields) {
        log(Level.INFO, message, fields);
    }

    @Override
    default void infof(String format, Object... args) {
        logf(Level.INFO, format, args);
    }

    @Override
    default void infow(String message, Object... keysAndValues) {
        logw(Level.INFO, message, keysAndValues);
    }

    default void debug(String message, Field... fields) {
        log(Level.DEBUG, message, fields);
    }

    default void debugf(String format, Object... args) {
        logf(Level.DEBUG, format, args);
    }

    default void debugw(String message, Object... keysAndValues) {
        logw(Level.DEBUG, message, keysAndValues);
    }

    default void warn(String message, Field... fields) {
        log(Level.WARN, message, fields);
    }

    default void warnf(String format, Object... args) {
        logf(Level.WARN, format, args);
    }

    default void warnw(String message, Object... keysAndValues) {
        logw(Level.WARN, message, keysAndValues);
    }

    default void error(String message, Field... fields) {
        log(Level.ERROR, message, fields);
    }

    default void errorf(String format, Object... args) {
        logf(Level.ERROR, format, args);
    }

    default void errorw(String message, Object... keysAndValues) {
        logw(Level.ERROR, message, keysAndValues);
    }

    default void panic(String message, Field... fields) {
        log(Level.PANIC, message, fields);
    }

    default void panicf(String format, Object... args) {
        logf(Level.PANIC, format, args);
    }

    default void panicw(String message, Object... keysAndValues) {
        logw(Level.PANIC, message, keysAndValues);
    }

    default void fatal(String message, Field... fields) {
        log(Level.FATAL, message, fields);
    }

    default void fatalf(String format, Object... args) {
        logf(Level.FATAL, format, args);
    }

    default void fatalw(String message, Object... keysAndValues) {
        logw(Level.FATAL, message, keysAndValues);
    }
}
