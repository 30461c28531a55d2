package podcluster.provisioner.poll;

import podcluster.provisioner.exception.ProvisionException;
import podcluster.util.Sleeper;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Fixed-interval polling loop.
 * <p>
 * Each attempt reads a value; the loop ends as soon as a value satisfies the
 * condition, or after {@code maxAttempts} reads. It sleeps between reads but not
 * after the last one. {@code maxAttempts == 0} polls until the condition holds.
 */
public final class Poller {

    public static final int UNBOUNDED = 0;

    private final Sleeper sleeper;
    private final Duration interval;
    private final int maxAttempts;

    public Poller(Sleeper sleeper, Duration interval, int maxAttempts) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
        }
        this.sleeper = sleeper;
        this.interval = interval;
        this.maxAttempts = maxAttempts;
    }

    /** Result of a polling run. */
    public record Outcome<T>(T last, int attempts, boolean satisfied) {
    }

    /**
     * Poll {@code fetch} until {@code done} holds.
     *
     * @param onWait called with every value that did not satisfy the condition, before sleeping
     */
    public <T> Outcome<T> await(Supplier<T> fetch, Predicate<? super T> done, Consumer<? super T> onWait) {
        return run(fetch.get(), fetch, done, onWait);
    }

    /**
     * Like {@link #await} but the first value is already known; it counts as the first attempt.
     */
    public <T> Outcome<T> await(T first, Supplier<T> refresh, Predicate<? super T> done, Consumer<? super T> onWait) {
        return run(first, refresh, done, onWait);
    }

    private <T> Outcome<T> run(T first, Supplier<T> refresh, Predicate<? super T> done, Consumer<? super T> onWait) {
        T current = first;
        int attempt = 1;
        while (true) {
            if (done.test(current)) {
                return new Outcome<>(current, attempt, true);
            }
            if (maxAttempts != UNBOUNDED && attempt >= maxAttempts) {
                return new Outcome<>(current, attempt, false);
            }
            onWait.accept(current);
            pause();
            current = refresh.get();
            attempt++;
        }
    }

    private void pause() {
        try {
            sleeper.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisionException("Interrupted while polling", e);
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration interval() {
        return interval;
    }
}
