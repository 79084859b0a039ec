package work.gpflow.kernel.external;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

/**
 * Extracts zip, tar and tar.gz archives with Apache Commons Compress.
 */
public final class CompressArchiveService implements ArchiveService {
    @Override
    public List<Path> unzip(Path archive, Path destination, ArchiveFormat format) throws IOException {
        var root = destination.toAbsolutePath().normalize();
        Files.createDirectories(root);
        var extracted = new ArrayList<Path>();
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
             ArchiveInputStream<?> in = open(raw, format)) {
            ArchiveEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                if (!in.canReadEntryData(entry)) {
                    continue;
                }
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new IOException("Refusing to extract entry outside destination folder: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                var parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                extracted.add(target);
            }
        }
        return extracted;
    }

    private static ArchiveInputStream<?> open(InputStream raw, ArchiveFormat format) throws IOException {
        return switch (format) {
            case ZIP -> new ZipArchiveInputStream(raw);
            case TAR -> new TarArchiveInputStream(raw);
            case TAR_GZ -> new TarArchiveInputStream(new GzipCompressorInputStream(raw));
        };
    }
}
