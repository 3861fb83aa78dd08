package io.github.simpleiam.log.api;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * 로그 심각도. DEBUG &lt; INFO &lt; WARN &lt; ERROR &lt; DPANIC &lt; PANIC &lt; FATAL 순서.
 *
 * SLF4J에는 ERROR 위 레벨이 없으므로 DPANIC/PANIC/FATAL은 ERROR로 기록하고 동명의 Marker를 붙인다.
 */
public enum Level {

    DEBUG(-1, org.slf4j.event.Level.DEBUG),
    INFO(0, org.slf4j.event.Level.INFO),
    WARN(1, org.slf4j.event.Level.WARN),
    ERROR(2, org.slf4j.event.Level.ERROR),
    /** 개발 중 발견된 계약 위반 (자가 진단 로그) */
    DPANIC(3, org.slf4j.event.Level.ERROR),
    /** 기록 후 LogPanicException 발생 */
    PANIC(4, org.slf4j.event.Level.ERROR),
    /** 기록 후 프로세스 종료 */
    FATAL(5, org.slf4j.event.Level.ERROR);

    private final int code;
    private final org.slf4j.event.Level slf4jLevel;
    private final Marker marker;

    Level(int code, org.slf4j.event.Level slf4jLevel) {
        this.code = code;
        this.slf4jLevel = slf4jLevel;
        this.marker = code > 2 ? MarkerFactory.getDetachedMarker(name()) : null;
    }

    /** 레벨 텍스트 파싱. 대소문자 무시, 빈 문자열은 INFO. */
    public static Optional<Level> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        if (text.isEmpty()) {
            return Optional.of(INFO);
        }
        for (Level level : values()) {
            if (level.name().equals(text.toUpperCase(Locale.ROOT))) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /** 파싱 실패 시 INFO로 대체 */
    public static Level parseOrInfo(String text) {
        return parse(text).orElse(INFO);
    }

    /** verbosity 코드에 대응하는 레벨. 범위를 벗어나면 양 끝 레벨로 고정. */
    public static Level fromCode(int code) {
        if (code <= DEBUG.code) {
            return DEBUG;
        }
        if (code >= FATAL.code) {
            return FATAL;
        }
        return values()[code - DEBUG.code];
    }

    /** threshold 이상이면 기록 대상 */
    public boolean isEnabled(Level threshold) {
        return code >= threshold.code;
    }

    public int code() {
        return code;
    }

    public org.slf4j.event.Level toSlf4j() {
        return slf4jLevel;
    }

    /** ERROR 위 레벨 식별용 Marker. 나머지는 null. */
    public Marker marker() {
        return marker;
    }

    /** Marker 이름에서 레벨 복원 */
    public static Optional<Level> fromMarkerName(String markerName) {
        for (Level level : values()) {
            if (level.marker != null && level.marker.getName().equals(markerName)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /** 설정 파일 표기 (소문자) */
    public String text() {
        return name().toLowerCase(Locale.ROOT);
    }
}
