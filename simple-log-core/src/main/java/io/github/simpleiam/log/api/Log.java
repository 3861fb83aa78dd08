package io.github.simpleiam.log.api;

import io.github.simpleiam.log.api.config.Options;
import io.github.simpleiam.log.api.context.LogContext;
import io.github.simpleiam.log.core.internal.DefaultLogger;
import io.github.simpleiam.log.core.internal.LogEngine;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 프로세스 기본 로거와 정적 호출 진입점.
 *
 * <p>기본 로거 참조는 volatile로 읽고, 교체(init/replaceDefault)만 락으로 보호한다.
 * 교체 중 진행 중인 호출은 이전 인스턴스로 완료된다. 교체된 로거는 닫지 않는다.</p>
 *
 * <pre>{@code
 * Log.init(Options.builder().level("debug").format("json").build());
 * Log.infow("user created", "username", "colin");
 * Log.withContext(ctx).errorw("request failed", "status", 500);
 * Log.flush();
 * }</pre>
 */
public final class Log {

    private static final ReentrantLock LOCK = new ReentrantLock();
    private static volatile Logger defaultLogger;

    private Log() {}

    /** 기본 로거. 처음 호출 시 기본 설정으로 생성한다. */
    public static Logger defaultLogger() {
        Logger logger = defaultLogger;
        if (logger != null) {
            return logger;
        }
        LOCK.lock();
        try {
            if (defaultLogger == null) {
                defaultLogger = newLogger(Options.defaults());
            }
            return defaultLogger;
        } finally {
            LOCK.unlock();
        }
    }

    /**
     * 설정으로 로거를 생성해 기본 로거로 교체.
     *
     * @throws LoggerBuildException sink를 열 수 없는 경우 (기존 기본 로거 유지)
     */
    public static Logger init(Options options) {
        Logger logger = newLogger(options);
        replaceDefault(logger);
        return logger;
    }

    /** 기본 로거 교체 */
    public static void replaceDefault(Logger logger) {
        if (logger == null) {
            throw new IllegalArgumentException("logger must not be null");
        }
        LOCK.lock();
        try {
            defaultLogger = logger;
        } finally {
            LOCK.unlock();
        }
    }

    /** 독립 Logback 컨텍스트 위의 로거. 전역 상태를 변경하지 않는다. */
    public static Logger newLogger(Options options) {
        return newLogger(options, TerminationHook.SYSTEM_EXIT);
    }

    public static Logger newLogger(Options options, TerminationHook terminationHook) {
        return new DefaultLogger(LogEngine.create(options, terminationHook, false));
    }

    public static void log(Level level, String message, Field... fields) {
        defaultLogger().log(level, message, fields);
    }

    public static void debug(String message, Field... fields) {
        defaultLogger().debug(message, fields);
    }

    public static void debugf(String format, Object... args) {
        defaultLogger().debugf(format, args);
    }

    public static void debugw(String message, Object... keysAndValues) {
        defaultLogger().debugw(message, keysAndValues);
    }

    public static void info(String message, Field... fields) {
        defaultLogger().info(message, fields);
    }

    public static void infof(String format, Object... args) {
        defaultLogger().infof(format, args);
    }

    public static void infow(String message, Object... keysAndValues) {
        defaultLogger().infow(message, keysAndValues);
    }

    public static void warn(String message, Field... fields) {
        defaultLogger().warn(message, fields);
    }

    public static void warnf(String format, Object... args) {
        defaultLogger().warnf(format, args);
    }

    public static void warnw(String message, Object... keysAndValues) {
        defaultLogger().warnw(message, keysAndValues);
    }

    public static void error(String message, Field... fields) {
        defaultLogger().error(message, fields);
    }

    public static void errorf(String format, Object... args) {
        defaultLogger().errorf(format, args);
    }

    public static void errorw(String message, Object... keysAndValues) {
        defaultLogger().errorw(message, keysAndValues);
    }

    public static void panic(String message, Field... fields) {
        defaultLogger().panic(message, fields);
    }

    public static void panicf(String format, Object... args) {
        defaultLogger().panicf(format, args);
    }

    public static void panicw(String message, Object... keysAndValues) {
        defaultLogger().panicw(message, keysAndValues);
    }

    public static void fatal(String message, Field... fields) {
        defaultLogger().fatal(message, fields);
    }

    public static void fatalf(String format, Object... args) {
        defaultLogger().fatalf(format, args);
    }

    public static void fatalw(String message, Object... keysAndValues) {
        defaultLogger().fatalw(message, keysAndValues);
    }

    public static InfoLogger v(int verbosity) {
        return defaultLogger().v(verbosity);
    }

    public static boolean enabled() {
        return defaultLogger().enabled();
    }

    public static Logger withValues(Object... keysAndValues) {
        return defaultLogger().withValues(keysAndValues);
    }

    public static Logger withName(String name) {
        return defaultLogger().withName(name);
    }

    public static Logger withContext(LogContext context) {
        return defaultLogger().withContext(context);
    }

    public static Logger withCurrentContext() {
        return defaultLogger().withCurrentContext();
    }

    public static int write(byte[] bytes) {
        return defaultLogger().write(bytes);
    }

    public static void flush() {
        defaultLogger().flush();
    }

    /** 기본 로거에 INFO로 기록하는 PrintStream (줄 단위) */
    public static PrintStream stdInfoStream() {
        return new PrintStream(defaultLogger().asOutputStream(Level.INFO), true, StandardCharsets.UTF_8);
    }

    /** 기본 로거에 ERROR로 기록하는 PrintStream (줄 단위) */
    public static PrintStream stdErrorStream() {
        return new PrintStream(defaultLogger().asOutputStream(Level.ERROR), true, StandardCharsets.UTF_8);
    }

    public static org.slf4j.Logger slf4j() {
        return defaultLogger().slf4j();
    }
}
