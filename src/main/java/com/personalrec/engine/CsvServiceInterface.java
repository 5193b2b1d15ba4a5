package com.personalrec.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * CSV ingestion and export at the edge of the engine.
 */
public interface CsvServiceInterface {
    /**
     * Reads a CSV file with a header line into one map per row, keyed by the trimmed header names.
     * Rows whose column count does not match the header are skipped.
     * @param file CSV file to read
     * @return Rows in file order; empty when the file has no data rows
     * @throws IOException if the file cannot be read or parsed
     */
    List<Map<String, String>> readRows(Path file) throws IOException;

    /**
     * Writes a header line followed by the given rows, creating parent directories as needed.
     * @param file Output CSV file
     * @param header Column names
     * @param rows Row values, one array per line
     * @throws IOException if file writing fails
     */
    void writeTable(Path file, String[] header, List<String[]> rows) throws IOException;
}
