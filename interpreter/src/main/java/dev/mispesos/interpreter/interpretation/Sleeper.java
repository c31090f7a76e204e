package dev.mispesos.interpreter.interpretation;

import java.time.Duration;

/**
 * Pauses the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
