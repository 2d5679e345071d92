package pvcmigrator.phase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.ResourceTimeoutException;
import pvcmigrator.poll.ConditionPoller;
import pvcmigrator.poll.ResourceStatus;

import java.time.Duration;
import java.util.Objects;

/**
 * Drives one custom resource from submission to a terminal state.
 *
 * <p>Sequence: delete any record with the same name and wait until it is
 * gone, create the new record ({@link PhaseState#SUBMITTED}), poll until the
 * expectation holds ({@link PhaseState#POLLING}), then decode the typed result
 * once ({@link PhaseState#SUCCEEDED}). Every failure is fatal and leaves the
 * controller in {@link PhaseState#FAILED} or {@link PhaseState#TIMED_OUT}.
 *
 * <p>A controller instance runs once.
 *
 * @param <R> typed result of the phase
 */
public class PhaseController<R> {

    private static final Logger log = LoggerFactory.getLogger(PhaseController.class);

    private final PhaseDefinition<R> definition;
    private final CustomResourceGateway gateway;
    private final ConditionPoller poller;
    private final Duration deletionTimeout;
    private final Duration phaseTimeout;
    private final Duration pollInterval;

    private volatile PhaseState state = PhaseState.NEW;

    public PhaseController(PhaseDefinition<R> definition, CustomResourceGateway gateway, ConditionPoller poller,
                           Duration deletionTimeout, Duration phaseTimeout, Duration pollInterval) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.poller = Objects.requireNonNull(poller, "poller");
        this.deletionTimeout = deletionTimeout;
        this.phaseTimeout = phaseTimeout;
        this.pollInterval = pollInterval;
    }

    public PhaseState state() {
        return state;
    }

    /**
     * Submits the record and blocks until it reports success.
     *
     * @return the decoded result
     * @throws MigrateException on any failure, with the phase name as stage
     */
    public R run() throws MigrateException {
        if (state != PhaseState.NEW) {
            throw new IllegalStateException(definition.phaseName() + " controller already ran (state=" + state + ")");
        }
        ResourceRef ref = definition.resource();
        try {
            if (gateway.exists(ref)) {
                log.info("[{}] Replacing existing {}", definition.phaseName(), ref);
                gateway.delete(ref, deletionTimeout);
            }

            log.info("[{}] Creating {}", definition.phaseName(), ref);
            gateway.create(ref, definition.spec());
            state = PhaseState.SUBMITTED;

            state = PhaseState.POLLING;
            log.info("[{}] Waiting for {} (timeout {} s)", definition.phaseName(), definition.expectation(),
                    phaseTimeout.toSeconds());
            ResourceStatus status = poller.waitFor(ref.toString(),
                    () -> gateway.status(ref).map(s -> ResourceStatus.decode(s, definition.expectation().conditionType())),
                    definition.expectation(), phaseTimeout, pollInterval);

            R result = definition.decode(status);
            state = PhaseState.SUCCEEDED;
            log.info("[{}] {} succeeded: {}", definition.phaseName(), ref, result);
            return result;
        } catch (ResourceTimeoutException e) {
            state = PhaseState.TIMED_OUT;
            throw e.atStage(definition.phaseName());
        } catch (MigrateException e) {
            state = PhaseState.FAILED;
            throw e.atStage(definition.phaseName());
        } catch (RuntimeException e) {
            state = PhaseState.FAILED;
            throw new MigrateException(String.valueOf(e.getMessage()), definition.phaseName(), ref.toString(), e);
        }
    }
}
