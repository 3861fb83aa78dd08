package io.github.simpleiam.log.starter.aop;

import io.github.simpleiam.log.api.annotation.WatcherContext;
import io.github.simpleiam.log.api.context.LogContext;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;

import java.util.Locale;
import java.util.Optional;

/**
 * @WatcherContext 메서드 실행 동안 LogContext에 watcher, username, requestID를 바인딩하는 Aspect.
 *
 * 메서드 종료 시 이전 LogContext가 복원된다.
 */
@Aspect
@Slf4j
public class WatcherContextAspect {

    private static final String REQUEST_ID_PARAM = "requestid";

    private final UsernameExtractor usernameExtractor;

    public WatcherContextAspect(UsernameExtractor usernameExtractor) {
        this.usernameExtractor = usernameExtractor;
    }

    @Around("@annotation(watcherContext)")
    public Object bindMethodContext(ProceedingJoinPoint joinPoint, WatcherContext watcherContext) throws Throwable {
        return proceedWithin(joinPoint, watcherContext);
    }

    @Around("@within(watcherContext) && !@annotation(io.github.simpleiam.log.api.annotation.WatcherContext)")
    public Object bindTypeContext(ProceedingJoinPoint joinPoint, WatcherContext watcherContext) throws Throwable {
        return proceedWithin(joinPoint, watcherContext);
    }

    private Object proceedWithin(ProceedingJoinPoint joinPoint, WatcherContext watcherContext) throws Throwable {
        LogContext context = buildContext(joinPoint, watcherContext);
        log.trace("Binding log context {} for {}", context, joinPoint.getSignature().toShortString());

        try (LogContext.Scope ignored = context.makeCurrent()) {
            return joinPoint.proceed();
        }
    }

    LogContext buildContext(ProceedingJoinPoint joinPoint, WatcherContext watcherContext) {
        LogContext.Builder builder = LogContext.current().toBuilder()
                .watcher(resolveWatcherName(joinPoint, watcherContext));

        usernameExtractor.extractCurrentUsername().ifPresent(builder::username);
        extractRequestId(joinPoint, watcherContext).ifPresent(builder::requestId);

        return builder.build();
    }

    private String resolveWatcherName(ProceedingJoinPoint joinPoint, WatcherContext watcherContext) {
        if (!watcherContext.value().isEmpty()) {
            return watcherContext.value();
        }
        return joinPoint.getSignature().getDeclaringType().getSimpleName();
    }

    /**
     * requestID 추출: 지정된 파라미터 또는 requestId 이름의 파라미터.
     */
    private Optional<Object> extractRequestId(ProceedingJoinPoint joinPoint, WatcherContext watcherContext) {
        if (!(joinPoint.getSignature() instanceof MethodSignature)) {
            return Optional.empty();
        }
        String[] paramNames = ((MethodSignature) joinPoint.getSignature()).getParameterNames();
        Object[] args = joinPoint.getArgs();
        if (paramNames == null || args == null) {
            return Optional.empty();
        }

        String wanted = watcherContext.requestIdParam();
        for (int i = 0; i < paramNames.length && i < args.length; i++) {
            boolean matches = wanted.isEmpty()
                    ? REQUEST_ID_PARAM.equals(paramNames[i].toLowerCase(Locale.ROOT))
                    : wanted.equals(paramNames[i]);
            if (matches && args[i] != null) {
                return Optional.of(args[i]);
            }
        }
        return Optional.empty();
    }
}
