package work.gpflow.kernel.external;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;

/**
 * Downloads a URL to a file with {@link HttpClient}.
 */
public final class HttpDownloadService implements DownloadService {
    private static final HttpClient HTTP_CLIENT = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();

    @Override
    public void download(URI url, Path destination, Optional<Duration> timeout) throws IOException {
        var request = HttpRequest.newBuilder(url).GET();
        timeout.filter(value -> !value.isZero()).ifPresent(request::timeout);
        try {
            var response = HTTP_CLIENT.send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() >= 400) {
                response.body().close();
                throw new IOException("HTTP " + response.statusCode() + " while downloading " + url);
            }
            var parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (var body = response.body()) {
                Files.copy(body, destination, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while downloading " + url, ex);
        }
    }
}
