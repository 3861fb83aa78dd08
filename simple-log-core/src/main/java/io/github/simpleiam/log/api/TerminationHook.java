package io.github.simpleiam.log.api;

/**
 * FATAL 레코드 기록 후 호출되는 종료 처리.
 */
@FunctionalInterface
public interface TerminationHook {

    /** 기본값: JVM 종료 */
    TerminationHook SYSTEM_EXIT = System::exit;

    void terminate(int status);
}
