package work.gpflow.kernel.shared;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads timeout values such as {@code 30}, {@code 2.5s}, {@code 2m}, {@code 1h} or {@code 1500ms}.
 * A number without a unit is in seconds.
 */
public final class DurationParser {
    private static final Pattern DURATION = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h)?");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var matcher = DURATION.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new NumberFormatException("Not a duration: " + raw);
        }
        long unitMillis = switch (matcher.group(2) == null ? "s" : matcher.group(2)) {
            case "ms" -> 1L;
            case "m" -> 60_000L;
            case "h" -> 3_600_000L;
            default -> 1_000L;
        };
        var millis = new BigDecimal(matcher.group(1)).multiply(BigDecimal.valueOf(unitMillis));
        try {
            return Optional.of(Duration.ofMillis(millis.setScale(0, RoundingMode.DOWN).longValueExact()));
        } catch (ArithmeticException ex) {
            throw new NumberFormatException("Duration out of range: " + raw);
        }
    }
}
