package me.golemcore.reasoning.domain;

import java.time.Duration;

/**
 * Blocking pause used for backoff, injectable so tests never wait.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(Math.max(0, duration.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
