package pvcmigrator.poll;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.ResourceFailedException;
import pvcmigrator.exceptions.ResourceTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Polls a remote resource at a fixed interval until a condition holds.
 *
 * <p>Each iteration fetches the status, logs it, and then checks in order:
 * success, early failure, deadline. The deadline is {@code start + timeout}
 * measured on the injected {@link Clock}; the wait never gives up before it.
 * A status read that fails counts as one unsatisfied poll. Polling only reads.
 * The resource is never deleted or re-created here.
 *
 * <p>Not thread-safe; one poller per waiting thread.
 */
public class ConditionPoller {

    private static final Logger log = LoggerFactory.getLogger(ConditionPoller.class);

    private final Clock clock;
    private final Sleeper sleeper;

    public ConditionPoller() {
        this(Clock.systemUTC(), Sleeper.THREAD);
    }

    public ConditionPoller(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until {@code expectation} is satisfied.
     *
     * @param resource description used in logs and exceptions, e.g. {@code AutomationControllerBackup ns-a/controller-backup}
     * @param source status reader
     * @param expectation success (and optional failure) criteria
     * @param timeout overall budget
     * @param interval fixed delay between polls
     * @return the status that satisfied the expectation
     * @throws ResourceTimeoutException if the deadline passes first
     * @throws ResourceFailedException if the failure predicate matches
     * @throws MigrateException if the thread is interrupted
     */
    public ResourceStatus waitFor(String resource, StatusSource source, ConditionExpectation expectation,
                                  Duration timeout, Duration interval) throws MigrateException {
        Instant deadline = clock.instant().plus(timeout);
        String lastObserved = "<nothing>";
        int attempt = 0;

        while (true) {
            attempt++;
            Optional<ResourceStatus> fetched = Optional.empty();
            boolean readFailed = false;
            try {
                fetched = source.fetch();
            } catch (MigrateException | RuntimeException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new MigrateException("Interrupted while waiting for " + resource, null, resource, e);
                }
                readFailed = true;
                lastObserved = "<read error: " + e.getMessage() + ">";
                log.warn("[{}] poll #{}: status read failed: {}", resource, attempt, e.getMessage());
            }
            if (fetched.isPresent()) {
                ResourceStatus status = fetched.get();
                lastObserved = status.describe();
                log.info("[{}] poll #{}: {}", resource, attempt, lastObserved);

                if (expectation.isSatisfiedBy(status)) {
                    log.info("[{}] {} reached after {} poll(s)", resource, expectation, attempt);
                    return status;
                }
                if (expectation.isFailedBy(status)) {
                    throw new ResourceFailedException(resource, lastObserved);
                }
            } else if (!readFailed) {
                lastObserved = "<absent>";
                log.info("[{}] poll #{}: not found yet", resource, attempt);
            }

            if (!clock.instant().isBefore(deadline)) {
                throw new ResourceTimeoutException(resource, timeout, lastObserved);
            }

            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MigrateException("Interrupted while waiting for " + resource, null, resource, e);
            }
        }
    }
}
