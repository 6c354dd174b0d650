package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.config.SqlApiProperties;
import org.iceforge.sqlapi.error.ExportFailedException;
import org.iceforge.sqlapi.export.ExportCoalescer;
import org.iceforge.sqlapi.export.ExternalCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class KmlEncoder extends OgrExportEncoder {

    public KmlEncoder(ExportCoalescer coalescer, ExternalCommand command, SqlApiProperties props) {
        super(coalescer, command, props);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.KML;
    }

    @Override
    public String contentType() {
        return "application/vnd.google-earth.kml+xml";
    }

    @Override
    public String fileExtension() {
        return "kml";
    }

    @Override
    protected String driver() {
        return "KML";
    }

    @Override
    protected String outputExtension() {
        return "kml";
    }

    @Override
    protected void collect(Path workDir, Path output, Path target) throws IOException {
        if (!Files.isRegularFile(output)) {
            throw new ExportFailedException("ogr2ogr did not produce " + output.getFileName());
        }
        Files.move(output, target);
    }
}
