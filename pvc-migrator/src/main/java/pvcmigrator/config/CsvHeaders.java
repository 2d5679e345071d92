package pvcmigrator.config;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared CSV reading for the mapping and credentials files.
 *
 * <p>Header cells are normalised: byte-order mark stripped, lower-cased,
 * spaces removed. Empty lines and lines starting with {@code #} are skipped.
 */
final class CsvHeaders {

    private static final char BOM = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT
            .builder()
            .setCommentMarker('#')
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .build();

    private final Map<String, Integer> columns;
    private final List<CSVRecord> rows;
    private final String rawHeader;

    private CsvHeaders(String rawHeader, Map<String, Integer> columns, List<CSVRecord> rows) {
        this.rawHeader = rawHeader;
        this.columns = columns;
        this.rows = rows;
    }

    static CsvHeaders read(Path file, String what) {
        if (!Files.isRegularFile(file)) {
            throw new MigrationConfigException(what + " not found: " + file);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.isEmpty()) {
                throw new MigrationConfigException(what + " is empty: " + file);
            }
            CSVRecord header = records.get(0);
            Map<String, Integer> columns = new HashMap<>();
            List<String> seen = new ArrayList<>();
            for (int i = 0; i < header.size(); i++) {
                String name = normalize(header.get(i));
                seen.add(name);
                columns.putIfAbsent(name, i);
            }
            return new CsvHeaders(String.join(",", seen), columns, records.subList(1, records.size()));
        } catch (IOException e) {
            throw new MigrationConfigException("Cannot read " + what + ": " + file, e);
        }
    }

    static String normalize(String cell) {
        String s = cell;
        if (!s.isEmpty() && s.charAt(0) == BOM) {
            s = s.substring(1);
        }
        return s.replace(" ", "").replace("\r", "").toLowerCase(Locale.ROOT);
    }

    /** Index of the first name that is present, or -1. */
    int indexOf(String... names) {
        for (String name : names) {
            Integer idx = columns.get(name);
            if (idx != null) {
                return idx;
            }
        }
        return -1;
    }

    List<CSVRecord> rows() {
        return rows;
    }

    String rawHeader() {
        return rawHeader;
    }

    static String field(CSVRecord row, int index) {
        if (index < 0 || index >= row.size()) {
            return "";
        }
        return row.get(index).trim();
    }

    static boolean isBlank(CSVRecord row) {
        for (String v : row) {
            if (!v.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
