package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.config.SqlApiProperties;
import org.iceforge.sqlapi.export.ExportCoalescer;
import org.iceforge.sqlapi.export.ExternalCommand;
import org.iceforge.sqlapi.export.ZipArchives;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Zipped ESRI shapefile (.shp, .shx, .dbf, .prj and friends).
 */
public class ShapefileEncoder extends OgrExportEncoder {

    public ShapefileEncoder(ExportCoalescer coalescer, ExternalCommand command, SqlApiProperties props) {
        super(coalescer, command, props);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.SHP;
    }

    @Override
    public String contentType() {
        return "application/zip";
    }

    @Override
    public String fileExtension() {
        return "zip";
    }

    @Override
    protected String driver() {
        return "ESRI Shapefile";
    }

    @Override
    protected String outputExtension() {
        return "shp";
    }

    @Override
    protected void collect(Path workDir, Path output, Path target) throws IOException {
        ZipArchives.zipDirectory(workDir, target);
    }
}
