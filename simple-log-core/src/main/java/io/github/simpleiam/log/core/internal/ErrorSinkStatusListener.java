package io.github.simpleiam.log.core.internal;

import ch.qos.logback.core.status.Status;
import ch.qos.logback.core.status.StatusListener;
import io.github.simpleiam.log.api.LoggerBuildException;

import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 엔진 내부 오류(Logback status WARN 이상)를 error output sink로 출력.
 */
class ErrorSinkStatusListener implements StatusListener {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private final List<PrintStream> sinks;
    private final List<PrintStream> owned;
    private volatile boolean closed;

    private ErrorSinkStatusListener(List<PrintStream> sinks, List<PrintStream> owned) {
        this.sinks = sinks;
        this.owned = owned;
    }

    static ErrorSinkStatusListener open(List<String> paths) {
        List<PrintStream> sinks = new ArrayList<>();
        List<PrintStream> owned = new ArrayList<>();

        for (String path : new LinkedHashSet<>(paths)) {
            if (SinkFactory.STDOUT.equals(path)) {
                sinks.add(System.out);
            } else if (SinkFactory.STDERR.equals(path)) {
                sinks.add(System.err);
            } else {
                try {
                    PrintStream stream = new PrintStream(
                            new FileOutputStream(SinkFactory.toFile(path), true), true, StandardCharsets.UTF_8);
                    sinks.add(stream);
                    owned.add(stream);
                } catch (FileNotFoundException e) {
                    owned.forEach(PrintStream::close);
                    throw new LoggerBuildException("Cannot open error output path: " + path, e);
                }
            }
        }
        return new ErrorSinkStatusListener(List.copyOf(sinks), List.copyOf(owned));
    }

    @Override
    public void addStatusEvent(Status status) {
        if (closed || status.getEffectiveLevel() < Status.WARN) {
            return;
        }

        String level = status.getEffectiveLevel() == Status.ERROR ? "ERROR" : "WARN";
        String line = TIME_FORMAT.format(Instant.ofEpochMilli(status.getTimestamp()))
                + "\t" + level + "\t" + status.getMessage();

        for (PrintStream sink : sinks) {
            sink.println(line);
            if (status.getThrowable() != null) {
                status.getThrowable().printStackTrace(sink);
            }
        }
    }

    void flush() {
        sinks.forEach(PrintStream::flush);
    }

    void close() {
        closed = true;
        owned.forEach(PrintStream::close);
    }

    boolean isClosed() {
        return closed;
    }
}
