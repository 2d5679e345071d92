package pvcmigrator.poll;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.ResourceFailedException;
import pvcmigrator.exceptions.ResourceTimeoutException;
import pvcmigrator.testing.ManualClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionPollerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(60);
    private static final Duration INTERVAL = Duration.ofSeconds(10);

    private ManualClock clock;
    private ConditionPoller poller;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        poller = new ConditionPoller(clock, clock.sleeper());
    }

    private static ResourceStatus status(String status, String reason) {
        return new ResourceStatus(status, reason, Map.of());
    }

    private static StatusSource sequence(List<Optional<ResourceStatus>> answers) {
        Deque<Optional<ResourceStatus>> queue = new ArrayDeque<>(answers);
        return () -> queue.size() > 1 ? queue.poll() : queue.peek();
    }

    @Nested
    @DisplayName("success")
    class Success {

        @Test
        void returnsOnFirstSatisfyingPollWithoutSleeping() throws MigrateException {
            ResourceStatus done = status("True", "Successful");

            ResourceStatus result = poller.waitFor("r", () -> Optional.of(done),
                    ConditionExpectation.successful(), TIMEOUT, INTERVAL);

            assertThat(result).isSameAs(done);
            assertThat(clock.sleeps()).isZero();
        }

        @Test
        void keepsPollingWhileAbsentOrRunning() throws MigrateException {
            StatusSource source = sequence(List.of(
                    Optional.empty(),
                    Optional.of(status("Unknown", "Running")),
                    Optional.of(status("True", "Successful"))));

            poller.waitFor("r", source, ConditionExpectation.successful(), TIMEOUT, INTERVAL);

            assertThat(clock.sleeps()).isEqualTo(2);
        }

        @Test
        void extraPredicateMustHoldToo() throws MigrateException {
            StatusSource source = sequence(List.of(
                    Optional.of(new ResourceStatus("True", "Successful", Map.of())),
                    Optional.of(new ResourceStatus("True", "Successful", Map.of("restoreComplete", true)))));
            ConditionExpectation expectation = ConditionExpectation.successful().and(s -> s.isTrue("restoreComplete"));

            ResourceStatus result = poller.waitFor("r", source, expectation, TIMEOUT, INTERVAL);

            assertThat(result.isTrue("restoreComplete")).isTrue();
            assertThat(clock.sleeps()).isEqualTo(1);
        }

        @Test
        void recoversFromTransientReadError() throws MigrateException {
            AtomicInteger polls = new AtomicInteger();
            StatusSource source = () -> {
                int n = polls.incrementAndGet();
                if (n == 2) {
                    throw new MigrateException("Read failed: connection reset", null, "x", null);
                }
                if (n == 3) {
                    return Optional.of(status("True", "Successful"));
                }
                return Optional.of(status("Unknown", "Running"));
            };

            ResourceStatus result = poller.waitFor("x", source, ConditionExpectation.successful(), TIMEOUT, INTERVAL);

            assertThat(result.conditionReason()).isEqualTo("Successful");
            assertThat(polls.get()).isEqualTo(3);
        }

        @Test
        void runtimeReadErrorIsRetriedToo() throws MigrateException {
            AtomicInteger polls = new AtomicInteger();
            StatusSource source = () -> {
                if (polls.incrementAndGet() == 1) {
                    throw new IllegalStateException("stream closed");
                }
                return Optional.of(status("True", "Successful"));
            };

            poller.waitFor("x", source, ConditionExpectation.successful(), TIMEOUT, INTERVAL);

            assertThat(clock.sleeps()).isEqualTo(1);
        }

        @Test
        void successJustBeforeDeadlineIsSeenOnTheDeadlinePoll() throws MigrateException {
            Instant start = clock.instant();
            StatusSource source = () -> clock.instant().isBefore(start.plusSeconds(25))
                    ? Optional.of(status("Unknown", "Running"))
                    : Optional.of(status("True", "Successful"));

            poller.waitFor("r", source, ConditionExpectation.successful(), Duration.ofSeconds(30), INTERVAL);

            assertThat(clock.instant()).isEqualTo(start.plusSeconds(30));
        }

        @Test
        void wrongReasonIsNotSuccess() {
            StatusSource source = () -> Optional.of(status("True", "Running"));

            assertThatThrownBy(() -> poller.waitFor("r", source, ConditionExpectation.successful(), TIMEOUT, INTERVAL))
                    .isInstanceOf(ResourceTimeoutException.class);
        }
    }

    @Nested
    @DisplayName("failure")
    class Failure {

        @Test
        void reportedFailureEndsWaitEarly() {
            StatusSource source = () -> Optional.of(status("False", "Failed"));

            assertThatThrownBy(() -> poller.waitFor("Backup ns/b", source, ConditionExpectation.successful(),
                    TIMEOUT, INTERVAL))
                    .isInstanceOf(ResourceFailedException.class)
                    .hasMessageContaining("Backup ns/b");
            assertThat(clock.sleeps()).isZero();
        }

        @Test
        void withoutFailurePredicateKeepsWaitingUntilDeadline() {
            StatusSource source = () -> Optional.of(status("False", "Failed"));
            ConditionExpectation expectation = ConditionExpectation.successful().failWhen(null);

            assertThatThrownBy(() -> poller.waitFor("r", source, expectation, TIMEOUT, INTERVAL))
                    .isInstanceOf(ResourceTimeoutException.class);
        }

        @Test
        void timeoutCarriesLastObservedStatus() {
            StatusSource source = () -> Optional.of(status("Unknown", "Running"));

            assertThatThrownBy(() -> poller.waitFor("r", source, ConditionExpectation.successful(), TIMEOUT, INTERVAL))
                    .isInstanceOfSatisfying(ResourceTimeoutException.class, e -> {
                        assertThat(e.getTimeout()).isEqualTo(TIMEOUT);
                        assertThat(e.getLastObserved()).contains("reason=Running");
                    });
        }

        @Test
        void neverGivesUpBeforeDeadline() {
            AtomicInteger polls = new AtomicInteger();
            StatusSource source = () -> {
                polls.incrementAndGet();
                return Optional.empty();
            };

            assertThatThrownBy(() -> poller.waitFor("r", source, ConditionExpectation.successful(), TIMEOUT, INTERVAL))
                    .isInstanceOfSatisfying(ResourceTimeoutException.class,
                            e -> assertThat(e.getLastObserved()).isEqualTo("<absent>"));
            // polls at t=0,10,...,60
            assertThat(polls.get()).isEqualTo(7);
        }

        @Test
        void timesOutAtDeadlineAndNotBefore() {
            Instant start = clock.instant();
            AtomicInteger polls = new AtomicInteger();
            StatusSource source = () -> {
                polls.incrementAndGet();
                return Optional.of(status("Unknown", "Running"));
            };

            assertThatThrownBy(() -> poller.waitFor("r", source, ConditionExpectation.successful(),
                    Duration.ofSeconds(30), INTERVAL))
                    .isInstanceOf(ResourceTimeoutException.class);
            assertThat(clock.instant()).isEqualTo(start.plusSeconds(30));
            // t=0,10,20,30
            assertThat(polls.get()).isEqualTo(4);
        }

        @Test
        void persistentReadErrorsEndAtDeadline() {
            StatusSource source = () -> {
                throw new MigrateException("api down");
            };

            assertThatThrownBy(() -> poller.waitFor("r", source, ConditionExpectation.successful(), TIMEOUT, INTERVAL))
                    .isInstanceOfSatisfying(ResourceTimeoutException.class,
                            e -> assertThat(e.getLastObserved()).contains("api down"));
            assertThat(clock.sleeps()).isEqualTo(6);
        }

        @Test
        void interruptionStopsPromptlyAndKeepsFlag() {
            ConditionPoller interrupted = new ConditionPoller(clock, d -> {
                throw new InterruptedException();
            });

            try {
                assertThatThrownBy(() -> interrupted.waitFor("r", Optional::empty,
                        ConditionExpectation.successful(), TIMEOUT, INTERVAL))
                        .isExactlyInstanceOf(MigrateException.class)
                        .hasMessageContaining("Interrupted");
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }
    }
}
