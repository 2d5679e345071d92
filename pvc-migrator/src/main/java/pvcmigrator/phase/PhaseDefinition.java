package pvcmigrator.phase;

import pvcmigrator.poll.ConditionExpectation;
import pvcmigrator.poll.ResourceStatus;

import java.util.Map;

/**
 * Describes one remote phase as data: which record to submit, what success
 * looks like, and how to turn the final status into a typed result.
 *
 * @param <R> typed result of the phase
 */
public interface PhaseDefinition<R> {

    /** Short name used in logs and as exception stage, e.g. {@code BACKUP}. */
    String phaseName();

    ResourceRef resource();

    /** The {@code spec} block of the record to create. */
    Map<String, Object> spec();

    ConditionExpectation expectation();

    /** Decodes the status that satisfied {@link #expectation()}. */
    R decode(ResourceStatus status);
}
