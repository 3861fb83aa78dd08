package io.github.simpleiam.log.core.internal;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.LayoutBase;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import io.github.simpleiam.log.api.LoggerBuildException;
import io.github.simpleiam.log.api.config.Options;
import io.github.simpleiam.log.core.layout.ConsoleLayout;
import io.github.simpleiam.log.core.layout.JsonLayout;

import java.nio.charset.StandardCharsets;

/**
 * 출력 경로 문자열로 Logback appender 생성.
 *
 * "stdout", "stderr"는 콘솔, 나머지는 파일 경로("file://" 접두사 허용)로 해석한다.
 * 파일 sink는 버퍼링되므로 flush가 필요하다.
 */
final class SinkFactory {

    static final String STDOUT = "stdout";
    static final String STDERR = "stderr";

    private static final String FILE_SCHEME = "file://";

    private SinkFactory() {}

    static OutputStreamAppender<ILoggingEvent> open(LoggerContext context, String path, Options options) {
        OutputStreamAppender<ILoggingEvent> appender;

        if (STDOUT.equals(path) || STDERR.equals(path)) {
            ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
            console.setTarget(STDOUT.equals(path) ? "System.out" : "System.err");
            appender = console;
        } else {
            FileAppender<ILoggingEvent> file = new FileAppender<>();
            file.setFile(toFile(path));
            file.setAppend(true);
            file.setImmediateFlush(false);
            appender = file;
        }

        appender.setContext(context);
        appender.setName("sink:" + path);
        appender.setEncoder(newEncoder(context, options));
        appender.start();

        if (!appender.isStarted()) {
            throw new LoggerBuildException("Cannot open output path: " + path);
        }
        return appender;
    }

    static String toFile(String path) {
        return path.startsWith(FILE_SCHEME) ? path.substring(FILE_SCHEME.length()) : path;
    }

    private static LayoutWrappingEncoder<ILoggingEvent> newEncoder(LoggerContext context, Options options) {
        LayoutBase<ILoggingEvent> layout;
        if (options.isJsonFormat()) {
            JsonLayout json = new JsonLayout();
            json.setIncludeCaller(!options.isDisableCaller());
            layout = json;
        } else {
            ConsoleLayout console = new ConsoleLayout();
            console.setIncludeCaller(!options.isDisableCaller());
            console.setColor(options.isEnableColor());
            layout = console;
        }
        layout.setContext(context);
        layout.start();

        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(context);
        encoder.setLayout(layout);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.start();
        return encoder;
    }
}
