package io.github.simpleiam.log.starter.aop;

import io.github.simpleiam.log.api.context.LogContext;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Spring Security 기반 사용자 이름 추출기.
 *
 * SecurityContextHolder에서 현재 인증된 사용자 이름을 추출.
 * Spring Security가 없거나 익명 사용자이면 LogContext의 username을 사용.
 */
@Slf4j
public class SecurityContextUsernameExtractor implements UsernameExtractor {

    private static final String ANONYMOUS_USER = "anonymousUser";

    private static final boolean SPRING_SECURITY_PRESENT = isSpringSecurityPresent();

    private static boolean isSpringSecurityPresent() {
        try {
            Class.forName("org.springframework.security.core.context.SecurityContextHolder");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public Optional<String> extractCurrentUsername() {
        if (SPRING_SECURITY_PRESENT) {
            Optional<String> username = extractFromSecurityContext();
            if (username.isPresent()) {
                return username;
            }
        }

        return LogContext.current().getUsername()
                .map(String::valueOf)
                .filter(name -> !name.isEmpty());
    }

    private Optional<String> extractFromSecurityContext() {
        try {
            // 리플렉션으로 Spring Security 호출 (컴파일 의존성 없이)
            Class<?> holderClass = Class.forName("org.springframework.security.core.context.SecurityContextHolder");
            Object securityContext = holderClass.getMethod("getContext").invoke(null);
            if (securityContext == null) {
                return Optional.empty();
            }

            Object authentication = securityContext.getClass()
                    .getMethod("getAuthentication")
                    .invoke(securityContext);
            if (authentication == null) {
                return Optional.empty();
            }

            Boolean authenticated = (Boolean) authentication.getClass()
                    .getMethod("isAuthenticated")
                    .invoke(authentication);
            if (!Boolean.TRUE.equals(authenticated)) {
                return Optional.empty();
            }

            String name = (String) authentication.getClass()
                    .getMethod("getName")
                    .invoke(authentication);
            if (name == null || name.isEmpty() || ANONYMOUS_USER.equals(name)) {
                return Optional.empty();
            }
            return Optional.of(name);

        } catch (ReflectiveOperationException | ClassCastException e) {
            log.debug("Failed to extract user from SecurityContext: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
