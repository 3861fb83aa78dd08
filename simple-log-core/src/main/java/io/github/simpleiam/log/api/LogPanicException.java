package io.github.simpleiam.log.api;

import lombok.Getter;

/**
 * PANIC 레벨 로그 기록 후 발생하는 예외. 레코드는 이미 기록되고 flush된 상태.
 */
@Getter
public class LogPanicException extends RuntimeException {

    private final String loggerName;

    public LogPanicException(String loggerName, String message) {
        super(message);
        this.loggerName = loggerName;
    }
}
