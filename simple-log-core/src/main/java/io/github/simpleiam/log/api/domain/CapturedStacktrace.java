package io.github.simpleiam.log.api.domain;

/**
 * 엔진이 수집한 호출 지점 stacktrace.
 *
 * 이벤트에는 {@link LogRecord#STACKTRACE_KEY} key/value로 실리지만 레코드는 값의 타입으로 구분하므로,
 * 같은 이름의 사용자 필드는 일반 필드로 남는다.
 */
public final class CapturedStacktrace {

    private final String text;

    private CapturedStacktrace(String text) {
        this.text = text;
    }

    public static CapturedStacktrace of(String text) {
        return new CapturedStacktrace(text == null ? "" : text);
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
