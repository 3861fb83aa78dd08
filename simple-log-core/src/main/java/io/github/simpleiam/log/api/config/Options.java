package io.github.simpleiam.log.api.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.simpleiam.log.api.Level;
import io.github.simpleiam.log.api.Log;
import io.github.simpleiam.log.api.Logger;
import io.github.simpleiam.log.api.TerminationHook;
import io.github.simpleiam.log.core.internal.DefaultLogger;
import io.github.simpleiam.log.core.internal.LogEngine;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 로깅 설정. 출력 sink, 레벨, 인코딩 형식, 표시 옵션 포함.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Options {

    public static final String CONSOLE_FORMAT = "console";
    public static final String JSON_FORMAT = "json";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {};

    /** 출력 sink: "stdout", "stderr" 또는 파일 경로 */
    @Builder.Default
    @JsonProperty("output-paths")
    private final List<String> outputPaths = List.of("stdout");

    /** 로거 내부 오류 출력 sink */
    @Builder.Default
    @JsonProperty("error-output-paths")
    private final List<String> errorOutputPaths = List.of("stderr");

    /** 최소 레벨: debug, info, warn, error, dpanic, panic, fatal */
    @Builder.Default
    @JsonProperty("level")
    private final String level = Level.INFO.text();

    /** 인코딩 형식: console, json */
    @Builder.Default
    @JsonProperty("format")
    private final String format = CONSOLE_FORMAT;

    @JsonProperty("disable-caller")
    private final boolean disableCaller;

    @JsonProperty("disable-stacktrace")
    private final boolean disableStacktrace;

    /** console 형식에서 레벨 색상 표시 */
    @JsonProperty("enable-color")
    private final boolean enableColor;

    /** 개발 모드: WARN 이상에서 stacktrace 수집 */
    @JsonProperty("development")
    private final boolean development;

    /** 루트 로거 이름 */
    @Builder.Default
    @JsonProperty("name")
    private final String name = "";

    /** 1초 동안 (레벨, 메시지)별로 그대로 기록할 개수 */
    @Builder.Default
    @JsonProperty("sampling-initial")
    private final int samplingInitial = 100;

    /** initial 초과 후 N번째마다 1건 기록 */
    @Builder.Default
    @JsonProperty("sampling-thereafter")
    private final int samplingThereafter = 100;

    /** 기본 설정 */
    public static Options defaults() {
        return Options.builder().build();
    }

    /**
     * 설정 검증. 모든 검사를 수행하고 발견된 문제를 순서대로 반환한다.
     *
     * @return 문제 목록 (정상이면 빈 목록)
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (Level.parse(level).isEmpty()) {
            errors.add(String.format("unrecognized level: \"%s\"", level));
        }

        String normalized = format == null ? "" : format.toLowerCase(Locale.ROOT);
        if (!CONSOLE_FORMAT.equals(normalized) && !JSON_FORMAT.equals(normalized)) {
            errors.add(String.format("not a valid log format: \"%s\"", format));
        }

        if (samplingInitial < 0 || samplingThereafter < 0) {
            errors.add(String.format("sampling values must not be negative: initial=%d, thereafter=%d",
                    samplingInitial, samplingThereafter));
        }

        return errors;
    }

    /** 출력 sink 목록. null 목록과 null 항목은 비어 있는 것으로 취급한다. */
    public List<String> getOutputPaths() {
        return normalize(outputPaths);
    }

    public List<String> getErrorOutputPaths() {
        return normalize(errorOutputPaths);
    }

    private static List<String> normalize(List<String> paths) {
        if (paths == null) {
            return List.of();
        }
        return paths.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    /** JSON 형식 여부 (대소문자 무시) */
    @JsonIgnore
    public boolean isJsonFormat() {
        return JSON_FORMAT.equalsIgnoreCase(format);
    }

    /** initial, thereafter가 모두 양수일 때만 샘플링 */
    @JsonIgnore
    public boolean isSamplingEnabled() {
        return samplingInitial > 0 && samplingThereafter > 0;
    }

    /** 알 수 없는 레벨은 INFO로 대체 */
    @JsonIgnore
    public Level getThreshold() {
        return Level.parseOrInfo(level);
    }

    /**
     * 전역 Logback 컨텍스트에 엔진을 구성하고 기본 로거로 설치한다.
     * java.util.logging 출력도 같은 sink로 전달된다.
     *
     * @throws io.github.simpleiam.log.api.LoggerBuildException sink를 열 수 없는 경우
     */
    public Logger build() {
        LogEngine engine = LogEngine.create(this, TerminationHook.SYSTEM_EXIT, true);
        Logger logger = new DefaultLogger(engine);
        Log.replaceDefault(logger);
        return logger;
    }

    /** 범용 구조(Map)로 변환 */
    public Map<String, Object> toMap() {
        return MAPPER.convertValue(this, MAP_TYPE_REF);
    }

    public static Options fromMap(Map<String, ?> values) {
        return MAPPER.convertValue(values, Options.class);
    }

    public static Options fromJson(String json) {
        try {
            return MAPPER.readValue(json, Options.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid options JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String toString() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return "Options{level=" + level + ", format=" + format + ", outputPaths=" + outputPaths + "}";
        }
    }
}
