package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.error.ValidationException;

import java.util.Locale;

/**
 * Output formats accepted by the {@code format} parameter.
 */
public enum OutputFormat {
    JSON("json"),
    GEOJSON("geojson"),
    CSV("csv"),
    SVG("svg"),
    ARRAYBUFFER("arraybuffer"),
    SHP("shp"),
    KML("kml");

    private final String id;
    OutputFormat(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static OutputFormat fromId(String id) {
        if (id == null) throw new ValidationException("Invalid format: null");
        String wanted = id.toLowerCase(Locale.ROOT);
        for (OutputFormat f : values()) {
            if (f.id.equals(wanted)) return f;
        }
        throw new ValidationException("Invalid format: " + wanted);
    }
}
