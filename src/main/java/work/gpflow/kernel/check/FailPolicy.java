package work.gpflow.kernel.check;

import java.util.Arrays;
import java.util.Optional;
import work.gpflow.kernel.registry.CollisionPolicy;
import work.gpflow.kernel.status.Severity;

/**
 * Escalation applied when a check fails.
 */
public enum FailPolicy {
    /** Log a FAILURE and do not run the effect. */
    FAIL("Fail", Severity.FAILURE, true),
    /** Log a WARNING and run the effect anyway. */
    WARN("Warn", Severity.WARNING, false),
    /** Log a WARNING but do not run the effect. */
    WARN_BUT_DO_NOT_RUN("WarnButDoNotRun", Severity.WARNING, true);

    private final String externalName;
    private final Severity severity;
    private final boolean blocksEffect;

    FailPolicy(String externalName, Severity severity, boolean blocksEffect) {
        this.externalName = externalName;
        this.severity = severity;
        this.blocksEffect = blocksEffect;
    }

    public String externalName() {
        return externalName;
    }

    public Severity severity() {
        return severity;
    }

    public boolean blocksEffect() {
        return blocksEffect;
    }

    /**
     * Escalation for an output-ID collision. Replacing policies never fail the check, so only WARN and FAIL
     * reach this mapping in practice.
     */
    public static FailPolicy forCollision(CollisionPolicy policy) {
        return switch (policy) {
            case FAIL -> FAIL;
            case WARN -> WARN_BUT_DO_NOT_RUN;
            case REPLACE, REPLACE_AND_WARN -> WARN;
        };
    }

    public static Optional<FailPolicy> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        var trimmed = value.trim();
        return Arrays.stream(values()).filter(policy -> policy.externalName.equalsIgnoreCase(trimmed)).findFirst();
    }
}
