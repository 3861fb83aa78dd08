package io.github.simpleiam.log.starter;

import io.github.simpleiam.log.api.config.Options;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 로깅 설정 Properties (prefix: simple-iam.log).
 */
@Data
@ConfigurationProperties(prefix = "simple-iam.log")
public class SimpleLogProperties {

    /** 자동 설정 활성화 여부 */
    private boolean enabled = true;

    /** 전역 Logback 컨텍스트를 재구성하고 기본 로거로 설치할지 여부 */
    private boolean installDefault = true;

    /** 출력 sink: stdout, stderr 또는 파일 경로 */
    private List<String> outputPaths = new ArrayList<>(List.of("stdout"));

    /** 로거 내부 오류 출력 sink */
    private List<String> errorOutputPaths = new ArrayList<>(List.of("stderr"));

    /** 최소 레벨: debug, info, warn, error, dpanic, panic, fatal */
    private String level = "info";

    /** 인코딩 형식: console, json */
    private String format = Options.CONSOLE_FORMAT;

    private boolean disableCaller;

    private boolean disableStacktrace;

    private boolean enableColor;

    private boolean development;

    /** 루트 로거 이름 */
    private String name = "";

    private SamplingProperties sampling = new SamplingProperties();

    private WatcherProperties watcher = new WatcherProperties();

    /** Properties를 Options로 변환 (검증은 하지 않음) */
    public Options toOptions() {
        return Options.builder()
                .outputPaths(List.copyOf(outputPaths))
                .errorOutputPaths(List.copyOf(errorOutputPaths))
                .level(level)
                .format(format)
                .disableCaller(disableCaller)
                .disableStacktrace(disableStacktrace)
                .enableColor(enableColor)
                .development(development)
                .name(name)
                .samplingInitial(sampling.getInitial())
                .samplingThereafter(sampling.getThereafter())
                .build();
    }

    @Data
    public static class SamplingProperties {
        /** 1초 동안 (레벨, 메시지)별로 그대로 기록할 개수. 0이면 샘플링 비활성. */
        private int initial = 100;

        /** initial 초과 후 N번째마다 1건 기록 */
        private int thereafter = 100;
    }

    @Data
    public static class WatcherProperties {
        /** @WatcherContext AOP 활성화 여부 */
        private boolean enabled = true;
    }
}
