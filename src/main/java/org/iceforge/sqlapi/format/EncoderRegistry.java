package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.error.ValidationException;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Looks up the encoder for a format.
 */
public class EncoderRegistry {

    private final Map<OutputFormat, ResultEncoder> encoders = new EnumMap<>(OutputFormat.class);

    public EncoderRegistry(Collection<? extends ResultEncoder> encoders) {
        for (ResultEncoder e : encoders) {
            ResultEncoder previous = this.encoders.put(e.format(), e);
            if (previous != null) {
                throw new IllegalStateException("Two encoders for format " + e.format().id()
                        + ": " + previous.getClass().getName() + ", " + e.getClass().getName());
            }
        }
    }

    public ResultEncoder get(OutputFormat format) {
        ResultEncoder e = encoders.get(format);
        if (e == null) throw new ValidationException("Invalid format: " + format.id());
        return e;
    }
}
