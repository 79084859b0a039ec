package work.gpflow.kernel.external;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ArchiveFormat {
    ZIP("zip"),
    TAR("tar"),
    TAR_GZ("tar.gz");

    private final String externalName;

    ArchiveFormat(String externalName) {
        this.externalName = externalName;
    }

    public String externalName() {
        return externalName;
    }

    public static Optional<ArchiveFormat> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        var trimmed = value.trim();
        return Arrays.stream(values()).filter(format -> format.externalName.equalsIgnoreCase(trimmed)).findFirst();
    }

    /**
     * Guesses the format from a file name ({@code .zip}, {@code .tar}, {@code .tar.gz}/{@code .tgz}).
     */
    public static Optional<ArchiveFormat> fromFileName(String fileName) {
        var lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".zip")) {
            return Optional.of(ZIP);
        }
        if (lower.endsWith(".tar.gz") || lower.endsWith(".tgz")) {
            return Optional.of(TAR_GZ);
        }
        if (lower.endsWith(".tar")) {
            return Optional.of(TAR);
        }
        return Optional.empty();
    }
}
