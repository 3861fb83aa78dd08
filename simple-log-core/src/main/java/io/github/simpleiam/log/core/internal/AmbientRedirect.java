package io.github.simpleiam.log.core.internal;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.jul.LevelChangePropagator;
import org.slf4j.bridge.SLF4JBridgeHandler;

/**
 * java.util.logging 출력을 전역 Logback 컨텍스트로 전달.
 *
 * 레벨 변경은 LevelChangePropagator가 JUL 쪽으로 반영한다.
 */
final class AmbientRedirect {

    private AmbientRedirect() {}

    static void install(LoggerContext context) {
        LevelChangePropagator propagator = new LevelChangePropagator();
        propagator.setContext(context);
        propagator.setResetJUL(true);
        propagator.start();
        context.addListener(propagator);

        if (!SLF4JBridgeHandler.isInstalled()) {
            SLF4JBridgeHandler.removeHandlersForRootLogger();
            SLF4JBridgeHandler.install();
        }
    }
}
