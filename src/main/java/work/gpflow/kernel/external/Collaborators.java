package work.gpflow.kernel.external;

import java.util.Objects;

/**
 * External services consumed by commands. A real geometry engine is plugged in here.
 */
public record Collaborators(
    GeometryEngine geometryEngine,
    LayerCodec layerCodec,
    TableCodec tableCodec,
    ArchiveService archiveService,
    DownloadService downloadService
) {
    public Collaborators {
        Objects.requireNonNull(geometryEngine, "geometryEngine");
        Objects.requireNonNull(layerCodec, "layerCodec");
        Objects.requireNonNull(tableCodec, "tableCodec");
        Objects.requireNonNull(archiveService, "archiveService");
        Objects.requireNonNull(downloadService, "downloadService");
    }

    public static Collaborators defaults() {
        return new Collaborators(
            new GeoJsonGeometryEngine(),
            new GeoJsonLayerCodec(),
            new DelimitedTableCodec(),
            new CompressArchiveService(),
            new HttpDownloadService()
        );
    }

    public Collaborators withGeometryEngine(GeometryEngine engine) {
        return new Collaborators(engine, layerCodec, tableCodec, archiveService, downloadService);
    }

    public Collaborators withLayerCodec(LayerCodec codec) {
        return new Collaborators(geometryEngine, codec, tableCodec, archiveService, downloadService);
    }

    public Collaborators withDownloadService(DownloadService service) {
        return new Collaborators(geometryEngine, layerCodec, tableCodec, archiveService, service);
    }
}
