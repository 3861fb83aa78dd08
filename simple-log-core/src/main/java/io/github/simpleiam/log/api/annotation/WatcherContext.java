package io.github.simpleiam.log.api.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 메서드 실행 동안 LogContext에 watcher 이름을 바인딩하는 어노테이션.
 *
 * starter의 AOP aspect가 처리한다. 현재 인증 사용자가 있으면 username도 함께 바인딩.
 *
 * <pre>{@code
 * @WatcherContext(value = "user-sync", requestIdParam = "requestId")
 * public void sync(String requestId) {
 *     Log.withCurrentContext().info("sync started");
 *     // watcher=user-sync, requestID=<requestId>, username=<인증 사용자>
 * }
 * }</pre>
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface WatcherContext {

    /** watcher 이름. 비어 있으면 메서드 선언 클래스의 단순 이름. */
    String value() default "";

    /**
     * requestID로 사용할 파라미터 이름.
     * 미지정 시 requestId, requestID 파라미터를 탐색.
     */
    String requestIdParam() default "";
}
