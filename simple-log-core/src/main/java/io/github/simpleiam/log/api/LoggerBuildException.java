package io.github.simpleiam.log.api;

/**
 * 로깅 엔진 구성 실패 (sink를 열 수 없는 경우 등).
 */
public class LoggerBuildException extends RuntimeException {

    public LoggerBuildException(String message) {
        super(message);
    }

    public LoggerBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
