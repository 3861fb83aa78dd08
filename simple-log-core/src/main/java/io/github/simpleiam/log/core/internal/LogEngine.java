package io.github.simpleiam.log.core.internal;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.util.LogbackMDCAdapter;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.status.StatusListener;
import ch.qos.logback.core.status.WarnStatus;
import io.github.simpleiam.log.api.Field;
import io.github.simpleiam.log.api.Level;
import io.github.simpleiam.log.api.Log;
import io.github.simpleiam.log.api.LoggerBuildException;
import io.github.simpleiam.log.api.TerminationHook;
import io.github.simpleiam.log.api.config.Options;
import io.github.simpleiam.log.api.domain.CapturedStacktrace;
import io.github.simpleiam.log.api.domain.LogRecord;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.CallerBoundaryAware;
import org.slf4j.spi.LoggingEventBuilder;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Options로 구성된 Logback 엔진.
 *
 * <p>레벨 게이트, 샘플링, stacktrace 수집을 담당하고 레코드를 SLF4J fluent API로 기록한다.
 * 기본은 독립 LoggerContext를 사용하고, ambient 모드에서는 전역 컨텍스트를 재구성한다.</p>
 *
 * <p>스레드 안전. 생성 후 상태는 변경되지 않는다.</p>
 */
public class LogEngine implements AutoCloseable {

    private static final String CALLER_BOUNDARY = DefaultLogger.class.getName();
    private static final String INTERNAL_PACKAGE = LogEngine.class.getPackageName() + ".";
    private static final String FACADE_PREFIX = Log.class.getName();
    private static final int MAX_STACK_DEPTH = 64;
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final LoggerContext context;
    private final Options options;
    private final Level threshold;
    private final Level stacktraceLevel;
    private final Sampler sampler;
    private final TerminationHook terminationHook;
    private final List<OutputStreamAppender<ILoggingEvent>> sinks;
    private final ErrorSinkStatusListener errorSinks;
    private final boolean ambient;

    private LogEngine(LoggerContext context, Options options, TerminationHook terminationHook,
                      List<OutputStreamAppender<ILoggingEvent>> sinks, ErrorSinkStatusListener errorSinks,
                      boolean ambient) {
        this.context = context;
        this.options = options;
        this.threshold = options.getThreshold();
        this.stacktraceLevel = options.isDisableStacktrace()
                ? null
                : (options.isDevelopment() ? Level.WARN : Level.PANIC);
        this.sampler = options.isSamplingEnabled()
                ? new Sampler(options.getSamplingInitial(), options.getSamplingThereafter())
                : null;
        this.terminationHook = terminationHook;
        this.sinks = sinks;
        this.errorSinks = errorSinks;
        this.ambient = ambient;
    }

    /**
     * 엔진 생성.
     *
     * @param ambient true면 전역 Logback 컨텍스트를 재구성하고 java.util.logging을 연결
     * @throws LoggerBuildException 출력 sink를 열 수 없는 경우
     */
    public static LogEngine create(Options options, TerminationHook terminationHook, boolean ambient) {
        LoggerContext context = ambient ? ambientContext() : privateContext();
        if (!context.getFrameworkPackages().contains(INTERNAL_PACKAGE)) {
            context.getFrameworkPackages().add(INTERNAL_PACKAGE);
            context.getFrameworkPackages().add(FACADE_PREFIX);
        }

        ErrorSinkStatusListener errorSinks = ErrorSinkStatusListener.open(options.getErrorOutputPaths());
        context.getStatusManager().add(errorSinks);

        if (ambient) {
            AmbientRedirect.install(context);
        }

        ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(ch.qos.logback.classic.Level.toLevel(options.getThreshold().toSlf4j().name()));

        List<OutputStreamAppender<ILoggingEvent>> sinks = new ArrayList<>();
        try {
            for (String path : new LinkedHashSet<>(options.getOutputPaths())) {
                OutputStreamAppender<ILoggingEvent> appender = SinkFactory.open(context, path, options);
                root.addAppender(appender);
                sinks.add(appender);
            }
        } catch (LoggerBuildException e) {
            root.detachAndStopAllAppenders();
            errorSinks.close();
            if (!ambient) {
                context.stop();
            }
            throw e;
        }

        context.start();
        return new LogEngine(context, options, terminationHook, List.copyOf(sinks), errorSinks, ambient);
    }

    private static LoggerContext privateContext() {
        LoggerContext context = new LoggerContext();
        context.setName("simple-log-" + SEQUENCE.incrementAndGet());
        context.setMDCAdapter(new LogbackMDCAdapter());
        return context;
    }

    private static LoggerContext ambientContext() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            throw new LoggerBuildException("SLF4J is not bound to Logback: " + factory.getClass().getName());
        }
        LoggerContext context = (LoggerContext) factory;
        // reset은 리스너를 떼어내기만 하므로 이전 구성의 error sink는 여기서 닫는다
        for (StatusListener listener : context.getStatusManager().getCopyOfStatusListenerList()) {
            if (listener instanceof ErrorSinkStatusListener) {
                ((ErrorSinkStatusListener) listener).close();
            }
        }
        context.reset();
        return context;
    }

    /** O(1) 레벨 게이트 */
    public boolean isEnabled(Level level) {
        return level.isEnabled(threshold);
    }

    /** verbosity 코드 기준 게이트. 범위 밖 코드도 그대로 비교한다. */
    public boolean isEnabled(int verbosity) {
        return verbosity >= threshold.code();
    }

    /** 이름에 해당하는 SLF4J 로거. 빈 이름은 루트. */
    public org.slf4j.Logger loggerFor(String name) {
        return context.getLogger(name == null || name.isEmpty() ? org.slf4j.Logger.ROOT_LOGGER_NAME : name);
    }

    /**
     * 레코드 기록. 호출자는 {@link #isEnabled(Level)}로 미리 게이트를 통과해야 한다.
     */
    public void write(org.slf4j.Logger target, Level level, String message, List<Field> bound, List<Field> fields) {
        String text = message == null ? "" : message;
        if (sampler != null && !sampler.sample(level, text)) {
            return;
        }

        LoggingEventBuilder builder = target.atLevel(level.toSlf4j());
        if (builder instanceof CallerBoundaryAware) {
            ((CallerBoundaryAware) builder).setCallerBoundary(CALLER_BOUNDARY);
        }
        if (level.marker() != null) {
            builder.addMarker(level.marker());
        }
        for (Field field : bound) {
            builder.addKeyValue(field.getKey(), field.getValue());
        }
        for (Field field : fields) {
            builder.addKeyValue(field.getKey(), field.getValue());
        }
        if (stacktraceLevel != null && level.isEnabled(stacktraceLevel)) {
            builder.addKeyValue(LogRecord.STACKTRACE_KEY, CapturedStacktrace.of(captureStack()));
        }
        builder.log(text);
    }

    /**
     * 버퍼링된 출력을 모든 sink에 기록. 실패는 error output으로 보고한다.
     */
    public void flush() {
        for (OutputStreamAppender<ILoggingEvent> sink : sinks) {
            OutputStream out = sink.getOutputStream();
            if (out == null) {
                continue;
            }
            try {
                out.flush();
            } catch (IOException e) {
                context.getStatusManager().add(new WarnStatus("Failed to flush " + sink.getName(), this, e));
            }
        }
        errorSinks.flush();
    }

    /** flush 후 종료 훅 호출 */
    public void terminate(int status) {
        flush();
        terminationHook.terminate(status);
    }

    /** 추가 appender 연결 (테스트 캡처용) */
    public void attach(Appender<ILoggingEvent> appender) {
        if (appender.getContext() == null) {
            appender.setContext(context);
        }
        if (!appender.isStarted()) {
            appender.start();
        }
        context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).addAppender(appender);
    }

    public Options getOptions() {
        return options;
    }

    public Level getThreshold() {
        return threshold;
    }

    public boolean isAmbient() {
        return ambient;
    }

    ErrorSinkStatusListener errorSinks() {
        return errorSinks;
    }

    /**
     * flush 후 sink를 닫는다. 전역 컨텍스트는 다음 구성 때 재설정되므로 appender만 유지한다.
     */
    @Override
    public void close() {
        flush();
        if (!ambient) {
            context.stop();
        }
        errorSinks.close();
    }

    private static String captureStack() {
        return StackWalker.getInstance().walk(frames -> frames
                .dropWhile(frame -> isInternalFrame(frame.getClassName()))
                .limit(MAX_STACK_DEPTH)
                .map(frame -> "\tat " + frame.toStackTraceElement())
                .collect(Collectors.joining(System.lineSeparator())));
    }

    private static boolean isInternalFrame(String className) {
        return className.startsWith(INTERNAL_PACKAGE) || className.startsWith(FACADE_PREFIX);
    }
}
