package io.github.simpleiam.log.starter;

import io.github.simpleiam.log.api.Log;
import io.github.simpleiam.log.api.Logger;
import io.github.simpleiam.log.api.config.Options;
import io.github.simpleiam.log.starter.aop.SecurityContextUsernameExtractor;
import io.github.simpleiam.log.starter.aop.UsernameExtractor;
import io.github.simpleiam.log.starter.aop.WatcherContextAspect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.util.List;

/**
 * 구조화 로깅 Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(SimpleLogProperties.class)
@ConditionalOnProperty(prefix = "simple-iam.log", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(SimpleLogAutoConfiguration.WatcherContextConfiguration.class)
@Slf4j
public class SimpleLogAutoConfiguration {

    /**
     * @throws IllegalStateException 설정 검증 실패 시 (모든 문제를 메시지에 포함)
     */
    @Bean
    @ConditionalOnMissingBean
    public Options simpleLogOptions(SimpleLogProperties properties) {
        Options options = properties.toOptions();
        List<String> errors = options.validate();
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid simple-iam.log configuration: " + String.join("; ", errors));
        }
        return options;
    }

    /**
     * install-default=true면 전역 Logback 컨텍스트를 재구성하고 기본 로거로 설치한다.
     * 그 외에는 독립 컨텍스트의 로거만 생성한다.
     */
    @Bean
    @ConditionalOnMissingBean
    public Logger simpleLogger(Options options, SimpleLogProperties properties) {
        if (properties.isInstallDefault()) {
            return options.build();
        }
        return Log.newLogger(options);
    }

    @Bean
    public SimpleLogLifecycle simpleLogLifecycle(Logger logger, Options options) {
        return new SimpleLogLifecycle(logger, options);
    }

    /**
     * 시작 시 활성 설정을 기록하고 종료 시 버퍼를 flush하는 SmartLifecycle 구현체.
     */
    static class SimpleLogLifecycle implements SmartLifecycle {

        private final Logger logger;
        private final Options options;
        private volatile boolean running = false;

        SimpleLogLifecycle(Logger logger, Options options) {
            this.logger = logger;
            this.options = options;
        }

        @Override
        public void start() {
            logger.withName("simple-log").infow("logger configured", "options", options.toMap());
            running = true;
        }

        @Override
        public void stop() {
            log.debug("Flushing log sinks before shutdown");
            logger.flush();
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }

    /**
     * AOP 기반 @WatcherContext 지원 설정.
     * simple-iam.log.watcher.enabled=true 시 활성화 (기본값: true)
     */
    @Configuration
    @ConditionalOnProperty(prefix = "simple-iam.log.watcher", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class WatcherContextConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public UsernameExtractor usernameExtractor() {
            return new SecurityContextUsernameExtractor();
        }

        @Bean
        @ConditionalOnMissingBean
        public WatcherContextAspect watcherContextAspect(UsernameExtractor usernameExtractor) {
            log.info("WatcherContextAspect enabled - @WatcherContext annotations will be processed");
            return new WatcherContextAspect(usernameExtractor);
        }
    }
}
