package work.gpflow.kernel.commands.tables;

import java.util.Optional;

final class Delimiters {
    private Delimiters() {}

    /**
     * Single delimiter character; {@code \t} stands for a tab.
     */
    static Optional<Character> parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Optional.of(',');
        }
        if ("\\t".equals(raw)) {
            return Optional.of('\t');
        }
        return raw.length() == 1 ? Optional.of(raw.charAt(0)) : Optional.empty();
    }
}
