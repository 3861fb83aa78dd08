package io.github.simpleiam.log.core.internal;

import io.github.simpleiam.log.api.Field;
import io.github.simpleiam.log.api.InfoLogger;

/**
 * 비활성 verbosity 레벨용 공유 인스턴스.
 */
public enum NoopInfoLogger implements InfoLogger {

    INSTANCE;

    @Override
    public void info(String message, Field... fields) {
    }

    @Override
    public void infof(String format, Object... args) {
    }

    @Override
    public void infow(String message, Object... keysAndValues) {
    }

    @Override
    public boolean enabled() {
        return false;
    }
}
