package pvcmigrator.poll;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * What a {@link ConditionPoller} waits for.
 *
 * <p>Success needs the condition status to equal {@link #status()}, the reason
 * to equal {@link #reason()}, and {@link #extra()} to hold. The optional
 * {@link #failWhen()} predicate ends the wait early with a failure.
 */
public final class ConditionExpectation {

    public static final String SUCCESSFUL = "Successful";

    /** Condition status {@code False} with reason {@code Failed}. */
    public static final Predicate<ResourceStatus> REPORTED_FAILED =
            s -> "False".equals(s.conditionStatus()) && "Failed".equals(s.conditionReason());

    private final String conditionType;
    private final String status;
    private final String reason;
    private final Predicate<ResourceStatus> extra;
    private final Predicate<ResourceStatus> failWhen;

    private ConditionExpectation(String conditionType, String status, String reason,
                                 Predicate<ResourceStatus> extra, Predicate<ResourceStatus> failWhen) {
        this.conditionType = Objects.requireNonNull(conditionType, "conditionType");
        this.status = Objects.requireNonNull(status, "status");
        this.reason = Objects.requireNonNull(reason, "reason");
        this.extra = extra;
        this.failWhen = failWhen;
    }

    /**
     * Condition {@code Successful} with status {@code True} and reason {@code Successful},
     * failing early when the operator reports {@code False/Failed}.
     */
    public static ConditionExpectation successful() {
        return new ConditionExpectation(SUCCESSFUL, "True", SUCCESSFUL, s -> true, REPORTED_FAILED);
    }

    public static ConditionExpectation of(String conditionType, String status, String reason) {
        return new ConditionExpectation(conditionType, status, reason, s -> true, null);
    }

    /** Returns a copy that also requires {@code predicate}. */
    public ConditionExpectation and(Predicate<ResourceStatus> predicate) {
        return new ConditionExpectation(conditionType, status, reason, extra.and(predicate), failWhen);
    }

    /** Returns a copy with a different early-failure predicate, or none if null. */
    public ConditionExpectation failWhen(Predicate<ResourceStatus> predicate) {
        return new ConditionExpectation(conditionType, status, reason, extra, predicate);
    }

    public String conditionType() { return conditionType; }

    public String status() { return status; }

    public String reason() { return reason; }

    public Predicate<ResourceStatus> extra() { return extra; }

    public Predicate<ResourceStatus> failWhen() { return failWhen; }

    public boolean isSatisfiedBy(ResourceStatus observed) {
        return status.equals(observed.conditionStatus())
                && reason.equals(observed.conditionReason())
                && extra.test(observed);
    }

    public boolean isFailedBy(ResourceStatus observed) {
        return failWhen != null && failWhen.test(observed);
    }

    @Override
    public String toString() {
        return conditionType + "=" + status + "/" + reason;
    }
}
