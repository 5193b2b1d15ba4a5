package com.personalrec.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Reads canonical fields out of a raw input row, resolving alternate column names through
 * {@link RecordFieldRegistry}.
 * <p>
 * Error handling:
 * <ul>
 *   <li>Missing or blank columns resolve to the empty string.</li>
 *   <li>Numeric columns that are missing, blank, NaN or unparseable resolve to the caller's default.</li>
 *   <li>Integer columns accept decimal text and truncate it ({@code "2.0"} reads as 2).</li>
 * </ul>
 * Nothing here throws for bad data; the row is simply read with defaults.
 */
public final class RowReader {
    private static final Logger logger = LoggerFactory.getLogger(RowReader.class);

    private final String stream;
    private final Map<String, String> row;

    public RowReader(String stream, Map<String, String> row) {
        this.stream = stream;
        this.row = row == null ? Map.of() : row;
    }

    /**
     * Trimmed value of the first alias present in the row, or "" when none is.
     * @param fieldName Canonical field name from the registry
     * @return Field text, never null
     */
    public String text(String fieldName) {
        RecordField field = RecordFieldRegistry.getField(stream, fieldName);
        if (field == null) {
            logger.debug("Field '{}' is not registered for stream '{}'", fieldName, stream);
            String direct = row.get(fieldName);
            return direct == null ? "" : direct.trim();
        }
        for (String alias : field.aliases) {
            String value = row.get(alias);
            if (value != null && !value.isBlank()) return value.trim();
        }
        return "";
    }

    public double doubleOr(String fieldName, double defaultValue) {
        String value = text(fieldName);
        if (value.isEmpty()) return defaultValue;
        try {
            double parsed = Double.parseDouble(value);
            return Double.isNaN(parsed) || Double.isInfinite(parsed) ? defaultValue : parsed;
        } catch (NumberFormatException e) {
            logger.debug("Unparseable {} '{}' for field '{}', using {}", stream, value, fieldName, defaultValue);
            return defaultValue;
        }
    }

    public int intOr(String fieldName, int defaultValue) {
        double parsed = doubleOr(fieldName, Double.NaN);
        return Double.isNaN(parsed) ? defaultValue : (int) parsed;
    }

    public long longOr(String fieldName, long defaultValue) {
        double parsed = doubleOr(fieldName, Double.NaN);
        return Double.isNaN(parsed) ? defaultValue : (long) parsed;
    }

    /**
     * Integer value, or null when the field is blank or unparseable.
     */
    public Integer intOrNull(String fieldName) {
        double parsed = doubleOr(fieldName, Double.NaN);
        return Double.isNaN(parsed) ? null : (int) parsed;
    }
}
