package io.github.simpleiam.log.core.internal;

import io.github.simpleiam.log.api.Field;
import io.github.simpleiam.log.api.InfoLogger;
import io.github.simpleiam.log.api.Level;

/**
 * 고정 레벨로 기록하는 verbosity 로거. 에스컬레이션하지 않는다.
 */
class LevelInfoLogger implements InfoLogger {

    private final DefaultLogger parent;
    private final Level level;

    LevelInfoLogger(DefaultLogger parent, Level level) {
        this.parent = parent;
        this.level = level;
    }

    @Override
    public void info(String message, Field... fields) {
        parent.emit(level, message, fields);
    }

    @Override
    public void infof(String format, Object... args) {
        parent.emitf(level, format, args);
    }

    @Override
    public void infow(String message, Object... keysAndValues) {
        parent.emitw(level, message, keysAndValues);
    }

    @Override
    public boolean enabled() {
        return true;
    }

    Level level() {
        return level;
    }
}
