package io.github.simpleiam.log.starter.aop;

import java.util.Optional;

/**
 * 현재 사용자 이름 추출 인터페이스.
 *
 * 기본 구현체로 {@link SecurityContextUsernameExtractor}가 제공됨.
 */
@FunctionalInterface
public interface UsernameExtractor {

    /**
     * @return 인증된 사용자 이름. 인증되지 않았으면 empty.
     */
    Optional<String> extractCurrentUsername();
}
