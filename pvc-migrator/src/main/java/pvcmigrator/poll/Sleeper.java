package pvcmigrator.poll;

import java.time.Duration;

/**
 * Blocking delay between polls. Replaced in tests so waits run instantly.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
