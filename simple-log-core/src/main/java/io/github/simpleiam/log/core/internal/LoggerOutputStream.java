package io.github.simpleiam.log.core.internal;

import io.github.simpleiam.log.api.Level;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * 줄 단위로 레코드를 남기는 OutputStream 어댑터.
 *
 * 줄바꿈마다 한 레코드를 기록하고, flush/close 시 남은 내용을 기록한다.
 */
class LoggerOutputStream extends OutputStream {

    private final DefaultLogger logger;
    private final Level level;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);

    LoggerOutputStream(DefaultLogger logger, Level level) {
        this.logger = logger;
        this.level = level;
    }

    @Override
    public synchronized void write(int b) {
        if (b == '\n') {
            emitLine();
        } else {
            buffer.write(b);
        }
    }

    @Override
    public synchronized void write(byte[] bytes, int offset, int length) {
        int start = offset;
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            if (bytes[i] == '\n') {
                buffer.write(bytes, start, i - start);
                emitLine();
                start = i + 1;
            }
        }
        buffer.write(bytes, start, end - start);
    }

    @Override
    public synchronized void flush() {
        if (buffer.size() > 0) {
            emitLine();
        }
        logger.flush();
    }

    @Override
    public void close() {
        flush();
    }

    private void emitLine() {
        String line = buffer.toString(StandardCharsets.UTF_8);
        buffer.reset();
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        logger.emit(level, line);
    }
}
