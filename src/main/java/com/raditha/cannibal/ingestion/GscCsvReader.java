package com.raditha.cannibal.ingestion;

import com.raditha.cannibal.model.RankingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a Search Console export (usually produced through a Looker Studio
 * table) into raw ranking records.
 * <p>
 * The header must name the columns {@code Landing Page}, {@code Query} and
 * {@code Url Clicks}; other columns are ignored. Fields follow the usual CSV
 * quoting rules so queries containing commas survive.
 */
public class GscCsvReader {

    private static final Logger logger = LoggerFactory.getLogger(GscCsvReader.class);

    public static final String PAGE_COLUMN = "Landing Page";
    public static final String QUERY_COLUMN = "Query";
    public static final String CLICKS_COLUMN = "Url Clicks";

    private static final List<String> REQUIRED_COLUMNS = List.of(PAGE_COLUMN, QUERY_COLUMN, CLICKS_COLUMN);
    private static final char BOM = '\uFEFF';

    // bounds of long as doubles, 2^63 itself does not fit
    private static final double MIN_CLICKS = Long.MIN_VALUE;
    private static final double MAX_CLICKS_EXCLUSIVE = -(double) Long.MIN_VALUE;

    /**
     * Read all records from a CSV file.
     *
     * @param csvFile path to the export
     * @return records in file order, rows with missing values dropped
     * @throws IOException     if the file cannot be read
     * @throws SchemaException if required columns are missing, clicks are not integers
     *                         or a quoted field is never closed
     */
    public List<RankingRecord> read(Path csvFile) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            List<RankingRecord> records = read(reader);
            logger.info("Read {} rows from {}", records.size(), csvFile);
            return records;
        }
    }

    /**
     * Read all records from an open reader. The reader is not closed.
     */
    public List<RankingRecord> read(Reader source) throws IOException {
        LineNumberReader reader = new LineNumberReader(source);

        List<String> header = readRecord(reader);
        if (header == null) {
            throw SchemaException.missingColumns(REQUIRED_COLUMNS);
        }
        Map<String, Integer> columns = indexHeader(header);

        int pageIdx = columns.get(PAGE_COLUMN);
        int queryIdx = columns.get(QUERY_COLUMN);
        int clicksIdx = columns.get(CLICKS_COLUMN);

        List<RankingRecord> records = new ArrayList<>();
        int skipped = 0;
        while (true) {
            int line = reader.getLineNumber() + 1;
            List<String> fields = readRecord(reader);
            if (fields == null) {
                break;
            }
            if (fields.size() == 1 && fields.get(0).isEmpty()) {
                continue; // blank line
            }
            String page = field(fields, pageIdx);
            String query = field(fields, queryIdx);
            String clicks = field(fields, clicksIdx);

            if (page.isEmpty() || query.isEmpty() || clicks.isBlank()) {
                skipped++;
                continue;
            }
            records.add(new RankingRecord(page, query, parseClicks(clicks, line)));
        }

        if (skipped > 0) {
            logger.debug("Dropped {} rows with missing values", skipped);
        }
        return records;
    }

    private Map<String, Integer> indexHeader(List<String> header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).trim();
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            columns.putIfAbsent(name, i);
        }

        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(c -> !columns.containsKey(c))
                .toList();
        if (!missing.isEmpty()) {
            throw SchemaException.missingColumns(missing);
        }
        return columns;
    }

    private static String field(List<String> fields, int index) {
        return index < fields.size() ? fields.get(index) : "";
    }

    private static long parseClicks(String value, int line) {
        String trimmed = value.trim();
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            // exports sometimes render integers as "12.0"
            double d;
            try {
                d = Double.parseDouble(trimmed);
            } catch (NumberFormatException notNumeric) {
                throw new SchemaException(
                        String.format("Line %d: '%s' in column '%s' is not an integer", line, value, CLICKS_COLUMN),
                        notNumeric);
            }
            if (Double.isFinite(d) && d == Math.rint(d) && d >= MIN_CLICKS && d < MAX_CLICKS_EXCLUSIVE) {
                return (long) d;
            }
            String reason = Double.isFinite(d) && d == Math.rint(d) ? "is out of range" : "is not an integer";
            throw new SchemaException(
                    String.format("Line %d: '%s' in column '%s' %s", line, value, CLICKS_COLUMN, reason), e);
        }
    }

    /**
     * Read one CSV record, which may span several physical lines when a
     * quoted field contains line breaks.
     *
     * @return the fields, or null at end of input
     * @throws SchemaException if the input ends inside a quoted field
     */
    static List<String> readRecord(LineNumberReader reader) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        int startLine = reader.getLineNumber();

        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;

        while (true) {
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (quoted) {
                    if (c == '"') {
                        if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                            current.append('"');
                            i++;
                        } else {
                            quoted = false;
                        }
                    } else {
                        current.append(c);
                    }
                } else if (c == '"') {
                    quoted = true;
                } else if (c == ',') {
                    fields.add(current.toString());
                    current.setLength(0);
                } else {
                    current.append(c);
                }
            }

            if (!quoted) {
                break;
            }
            String next = reader.readLine();
            if (next == null) {
                throw new SchemaException(String.format(
                        "Line %d: quoted field is not closed before end of input", startLine));
            }
            current.append('\n');
            line = next;
        }

        fields.add(current.toString());
        return fields;
    }
}
