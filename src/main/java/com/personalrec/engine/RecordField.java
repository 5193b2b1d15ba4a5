package com.personalrec.engine;

import java.util.List;

/**
 * A canonical input field and the column names it may arrive under.
 * The first alias that is present and non-blank in a row wins.
 */
public class RecordField {
    public final String fieldName;
    public final List<String> aliases;

    public RecordField(String fieldName, List<String> aliases) {
        this.fieldName = fieldName;
        this.aliases = aliases;
    }
}
