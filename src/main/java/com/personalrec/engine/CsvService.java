package com.personalrec.engine;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenCSV-backed reader for catalog, history and rating uploads, and writer for ranked results.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Header names are trimmed and stripped of stray quotes; values are trimmed.</li>
 *   <li>Rows with the wrong number of columns are skipped and counted in the log.</li>
 *   <li>Column names are kept as-is; canonical naming happens later in {@link RowReader}.</li>
 *   <li>Exports collapse line breaks inside values so every record stays on one line.</li>
 * </ul>
 *
 * @author Recommendation Engine Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    @Override
    public List<Map<String, String>> readRows(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("CSV path cannot be null");
        }
        List<String[]> lines;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            lines = csv.readAll();
        } catch (CsvException e) {
            throw new IOException("Malformed CSV in " + file + ": " + e.getMessage(), e);
        }
        List<Map<String, String>> rows = new ArrayList<>();
        if (lines.size() < 2) {
            logger.warn("CSV file {} has no data rows", file);
            return rows;
        }
        String[] header = lines.get(0);
        for (int i = 0; i < header.length; i++) {
            header[i] = stripBom(header[i]).replace("\"", "").trim();
        }
        int skipped = 0;
        for (int i = 1; i < lines.size(); i++) {
            String[] values = lines.get(i);
            if (values.length != header.length) {
                skipped++;
                continue;
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.length; c++) {
                row.put(header[c], values[c] == null ? "" : values[c].trim());
            }
            rows.add(row);
        }
        if (skipped > 0) {
            logger.warn("Skipped {} malformed rows in {}", skipped, file);
        }
        logger.info("Read {} rows from {}", rows.size(), file);
        return rows;
    }

    @Override
    public void writeTable(Path file, String[] header, List<String[]> rows) throws IOException {
        if (rows == null) {
            logger.warn("Attempted to write null row list to CSV: {}", file);
            throw new IllegalArgumentException("Row list cannot be null");
        }
        if (file == null || header == null) {
            throw new IllegalArgumentException("File and header cannot be null");
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(header);
            for (String[] row : rows) {
                String[] cleaned = new String[row.length];
                for (int i = 0; i < row.length; i++) cleaned[i] = safe(row[i]);
                writer.writeNext(cleaned);
            }
        }
        logger.info("Wrote {} rows to CSV file: {}", rows.size(), file);
    }

    /**
     * Collapses CR/LF runs into a single space and trims.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }

    private static String stripBom(String s) {
        if (s == null) return "";
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }
}
