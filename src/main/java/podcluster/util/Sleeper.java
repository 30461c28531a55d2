package podcluster.util;

import java.time.Duration;

/**
 * Blocking wait used by retry and polling loops.
 * Tests substitute a sleeper that records the requested delays instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
