package com.bmsedge.hvi.util;

import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Normalizes instrument readings that may be written with either '.' or ',' as decimal separator.
 */
public final class DecimalReadings {

    private static final Logger logger = LoggerFactory.getLogger(DecimalReadings.class);

    private DecimalReadings() {
    }

    /**
     * Parse a raw reading. Blank, null and malformed values are reported as absent.
     */
    public static OptionalDouble parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return OptionalDouble.empty();
        }

        String normalized = raw.trim().replace(',', '.');
        try {
            double value = Double.parseDouble(normalized);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                logger.debug("Ignoring non-finite reading '{}'", raw);
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(value);
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed reading '{}': {}", raw, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    public static OptionalDouble read(Sample sample, FiberParameter parameter) {
        return parse(sample.getReading(parameter));
    }

    public static boolean isPresent(Sample sample, FiberParameter parameter) {
        return read(sample, parameter).isPresent();
    }
}
