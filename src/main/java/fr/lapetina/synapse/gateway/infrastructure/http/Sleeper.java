package fr.lapetina.synapse.gateway.infrastructure.http;

import java.time.Duration;

/**
 * Pause between retry attempts. Replaced in tests to record delays without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
