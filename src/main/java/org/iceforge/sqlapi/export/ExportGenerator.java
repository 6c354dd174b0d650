package org.iceforge.sqlapi.export;

import java.nio.file.Path;

/**
 * Produces an export artifact on disk. Runs at most once per pending key.
 */
@FunctionalInterface
public interface ExportGenerator {

    Path generate() throws Exception;
}
