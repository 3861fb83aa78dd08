package io.github.simpleiam.log.api;

/**
 * 단일 레벨에 고정된 최소 로거. {@link Logger#v(int)}가 반환한다.
 */
public interface InfoLogger {

    /** 구조화 필드와 함께 기록 */
    void info(String message, Field... fields);

    /** printf 형식 메시지. 비활성 시 포맷팅하지 않음. */
    void infof(String format, Object... args);

    /** key/value 교대 인자. 비활성 시 변환하지 않음. */
    void infow(String message, Object... keysAndValues);

    /** no-op 로거만 false */
    boolean enabled();
}
