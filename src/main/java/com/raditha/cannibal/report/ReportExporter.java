package com.raditha.cannibal.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.cannibal.analyzer.CannibalizationReport;
import com.raditha.cannibal.config.CannibalizationConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Exports analysis results to CSV and JSON.
 * <p>
 * The CSV keeps one row per group with the columns similar pages, shared
 * terms, shared term count, page to keep and its clicks. The JSON document
 * adds the configuration, run summary and per-member evidence.
 */
public class ReportExporter {

    public static final String CSV_FILE_NAME = "cannibalization-results.csv";
    public static final String JSON_FILE_NAME = "cannibalization-results.json";

    static final String CSV_HEADER = "similar_pages,shared_terms,shared_term_count,keep_page,clicks";

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final ResultProjector projector;

    public ReportExporter() {
        this(new ResultProjector());
    }

    public ReportExporter(ResultProjector projector) {
        this.projector = projector;
    }

    /**
     * Top-level JSON document.
     */
    public record ExportDocument(
            LocalDateTime timestamp,
            String source,
            CannibalizationConfig config,
            Summary summary,
            List<GroupReport> groups) {
    }

    /**
     * Run figures included in the JSON export.
     */
    public record Summary(
            int inputRows,
            int analyzedRows,
            int totalPages,
            int eligibleSources,
            int candidateMatches,
            int groups,
            int redundantPages) {
    }

    public ExportDocument buildDocument(CannibalizationReport report, String source) {
        Summary summary = new Summary(
                report.normalization().inputRows(),
                report.normalization().outputRows(),
                report.getTotalPages(),
                report.eligibleSources(),
                report.candidateMatches(),
                report.getGroupCount(),
                report.getRedundantPageCount());
        return new ExportDocument(LocalDateTime.now(), source, report.config(), summary,
                projector.project(report));
    }

    /**
     * Render results as CSV text.
     */
    public String toCsv(CannibalizationReport report) {
        StringBuilder csv = new StringBuilder();
        csv.append(CSV_HEADER).append("\n");

        for (GroupReport group : projector.project(report)) {
            csv.append(quote(String.join(", ", group.similarPages()))).append(',');
            csv.append(quote(String.join(", ", group.sharedTerms()))).append(',');
            csv.append(group.sharedTermCount()).append(',');
            csv.append(quote(group.keepPage())).append(',');
            csv.append(group.clicks()).append("\n");
        }
        return csv.toString();
    }

    public void exportToCsv(CannibalizationReport report, Path outputPath) throws IOException {
        Files.writeString(outputPath, toCsv(report), StandardCharsets.UTF_8);
    }

    public String toJson(CannibalizationReport report, String source) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(buildDocument(report, source));
    }

    public void exportToJson(CannibalizationReport report, String source, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), buildDocument(report, source));
    }

    /**
     * Quote a field when it contains a separator, quote or line break.
     */
    static String quote(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
