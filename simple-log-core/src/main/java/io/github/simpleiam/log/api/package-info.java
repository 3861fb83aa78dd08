/**
 * 구조화 로깅 공개 API.
 *
 * <h2>주요 진입점:</h2>
 * <ul>
 *   <li>{@link io.github.simpleiam.log.api.Log} - 프로세스 기본 로거와 정적 호출</li>
 *   <li>{@link io.github.simpleiam.log.api.Logger} - 레벨별 로깅 Facade</li>
 *   <li>{@link io.github.simpleiam.log.api.config.Options} - 로거 설정</li>
 *   <li>{@link io.github.simpleiam.log.api.context.LogContext} - 요청 문맥 전파</li>
 * </ul>
 *
 * <h2>사용 예:</h2>
 * <pre>{@code
 * Logger logger = Log.newLogger(Options.builder()
 *         .level("debug")
 *         .format(Options.JSON_FORMAT)
 *         .outputPaths(List.of("stdout", "/var/log/iam/apiserver.log"))
 *         .build());
 *
 * try (var scope = LogContext.builder().requestId("r-1").username("admin").build().makeCurrent()) {
 *     logger.withCurrentContext().infow("secret created", "secret", "app-key", "expires", 3600);
 * }
 * logger.flush();
 * }</pre>
 */
package io.github.simpleiam.log.api;
