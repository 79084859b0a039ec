package work.gpflow.kernel.external;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompressArchiveServiceTest {
    @TempDir
    Path workDir;

    private final CompressArchiveService service = new CompressArchiveService();

    @Test
    void extractsTarGz() throws Exception {
        var archive = workDir.resolve("bundle.tar.gz");
        var payload = "station,elevation\n".getBytes(StandardCharsets.UTF_8);
        try (var out = new TarArchiveOutputStream(new GzipCompressorOutputStream(Files.newOutputStream(archive)))) {
            var entry = new TarArchiveEntry("data/stations.csv");
            entry.setSize(payload.length);
            out.putArchiveEntry(entry);
            out.write(payload);
            out.closeArchiveEntry();
        }

        var extracted = service.unzip(archive, workDir.resolve("out"), ArchiveFormat.TAR_GZ);
        assertEquals(1, extracted.size());
        assertEquals("station,elevation\n", Files.readString(workDir.resolve("out/data/stations.csv")));
    }

    @Test
    void refusesEntriesOutsideTheDestination() throws Exception {
        var archive = workDir.resolve("evil.zip");
        try (var out = new ZipArchiveOutputStream(archive.toFile())) {
            out.putArchiveEntry(new ZipArchiveEntry("../escaped.txt"));
            out.write("x".getBytes(StandardCharsets.UTF_8));
            out.closeArchiveEntry();
        }
        assertThrows(IOException.class, () -> service.unzip(archive, workDir.resolve("out"), ArchiveFormat.ZIP));
        assertFalse(Files.exists(workDir.resolve("escaped.txt")));
    }

    @Test
    void formatFromNameOrParameter() {
        assertEquals(Optional.of(ArchiveFormat.TAR_GZ), ArchiveFormat.fromFileName("x.TGZ"));
        assertEquals(Optional.of(ArchiveFormat.TAR), ArchiveFormat.fromFileName("x.tar"));
        assertEquals(Optional.empty(), ArchiveFormat.fromFileName("x.rar"));
        assertEquals(Optional.of(ArchiveFormat.TAR_GZ), ArchiveFormat.lookup("TAR.GZ"));
    }
}
