package work.gpflow.kernel.commands.files;

import java.util.Optional;
import work.gpflow.kernel.check.FailPolicy;

/**
 * Values of the {@code IfSourceFileNotFound} / {@code IfFolderExists} parameters.
 */
final class MissingSourceHandling {
    static final String IGNORE = "Ignore";
    static final String WARN = "Warn";
    static final String FAIL = "Fail";

    private MissingSourceHandling() {}

    /**
     * Escalation of a missing source; empty for {@code Ignore}, which silently skips the effect.
     */
    static Optional<FailPolicy> failPolicy(String choice) {
        return switch (choice) {
            case WARN -> Optional.of(FailPolicy.WARN_BUT_DO_NOT_RUN);
            case FAIL -> Optional.of(FailPolicy.FAIL);
            default -> Optional.empty();
        };
    }
}
