package work.gpflow.kernel.check;

import work.gpflow.kernel.status.Severity;

/**
 * Outcome of one check after escalation. {@code condition} is null when the requested name was unknown.
 */
public record CheckResult(
    Condition condition,
    boolean passed,
    Severity severity,
    boolean blocksEffect,
    String message,
    String recommendation,
    boolean unknownCondition
) {
    static CheckResult pass(Condition condition) {
        return new CheckResult(condition, true, Severity.SUCCESS, false, "", "", false);
    }

    static CheckResult fail(Condition condition, FailPolicy policy, String message, String recommendation) {
        return new CheckResult(condition, false, policy.severity(), policy.blocksEffect(), message, recommendation, false);
    }

    static CheckResult unknown(String conditionName) {
        return new CheckResult(
            null,
            false,
            Severity.FAILURE,
            true,
            "Check " + conditionName + " is not a valid check in the condition catalogue.",
            "Contact the maintainers to fix the command.",
            true
        );
    }
}
