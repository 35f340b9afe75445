package com.raditha.cannibal.cli;

import com.raditha.cannibal.analyzer.CannibalizationAnalyzer;
import com.raditha.cannibal.analyzer.CannibalizationReport;
import com.raditha.cannibal.config.CannibalizationConfig;
import com.raditha.cannibal.config.CannibalizationSettings;
import com.raditha.cannibal.ingestion.SchemaException;
import com.raditha.cannibal.report.GroupReport;
import com.raditha.cannibal.report.ReportExporter;
import com.raditha.cannibal.report.ResultProjector;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for keyword cannibalization detection.
 * <p>
 * Usage:
 * java -jar keyword-cannibalization.jar [options] &lt;csv-file&gt;
 * <p>
 * Configuration priority: CLI arguments > cannibalization.yml > defaults
 */
@Command(name = "cannibal", mixinStandardHelpOptions = true, version = "cannibal v1.0.0",
        description = "Finds landing pages that rank for the same queries and picks the page to keep")
public class CannibalCLI implements Callable<Integer> {

    @Parameters(index = "0", description = "Search Console CSV export with Landing Page, Query and Url Clicks columns", paramLabel = "<csv-file>")
    private File inputFile;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--output", description = "Directory for exported files (default: current directory)", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--threshold", description = "Share of a page's keywords another page must also rank for, 0.0-1.0 (default: 0.8)", paramLabel = "<ratio>")
    private Double threshold;

    @Option(names = "--min-keywords", description = "Minimum keywords for a page to be compared (default: 10)", paramLabel = "<n>")
    private Integer minKeywords;

    @Option(names = "--parallelism", description = "Worker threads for matching (default: available processors)", paramLabel = "<n>")
    private Integer parallelism;

    @Option(names = "--strict", description = "Strict preset (90%% threshold)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (60%% threshold)")
    private boolean lenient = false;

    @Option(names = "--json", description = "Print results as JSON instead of text")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export results: ${COMPLETION-CANDIDATES}", paramLabel = "<format>", converter = ExportFormatConverter.class)
    private ExportFormat exportFormat;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        CannibalizationConfig config = loadConfig();
        CannibalizationAnalyzer analyzer = new CannibalizationAnalyzer(config);
        CannibalizationReport report = analyzer.analyzeFile(inputFile.toPath());

        PrintWriter out = spec.commandLine().getOut();
        ReportExporter exporter = new ReportExporter();
        if (jsonOutput) {
            out.println(exporter.toJson(report, inputFile.getName()));
        } else {
            printTextReport(report, out);
        }

        if (exportFormat != null) {
            exportResults(exporter, report, out);
        }
        out.flush();
        return 0;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the command without exiting the JVM.
     *
     * @return process exit code
     */
    public static int execute(String... args) {
        return newCommandLine().execute(args);
    }

    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new CannibalCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof SchemaException) {
                commandLine.getErr().println("Schema error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine commandLine = ex.getCommandLine();
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            commandLine.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, commandLine.getErr());
            commandLine.getErr().print(commandLine.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threshold != null && (!Double.isFinite(threshold) || threshold < 0.0 || threshold > 1.0)) {
            throw new IllegalArgumentException("Threshold must be between 0.0 and 1.0, got: " + threshold);
        }

        if (minKeywords != null && minKeywords < 0) {
            throw new IllegalArgumentException("Min-keywords must not be negative, got: " + minKeywords);
        }

        if (parallelism != null && parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be positive, got: " + parallelism);
        }

        if (strict && lenient) {
            throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
        }

        if (!inputFile.isFile()) {
            throw new IllegalArgumentException("Input file not found: " + inputFile);
        }

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    private CannibalizationConfig loadConfig() throws IOException {
        String preset = null;
        if (strict) {
            preset = "strict";
        } else if (lenient) {
            preset = "lenient";
        }

        CannibalizationSettings settings = CannibalizationSettings.load(
                configFile != null ? Path.of(configFile) : null);
        return settings.toConfig(threshold, minKeywords, parallelism, preset);
    }

    private static void printTextReport(CannibalizationReport report, PrintWriter out) {
        CannibalizationConfig config = report.config();

        out.println("=".repeat(80));
        out.println("KEYWORD CANNIBALIZATION REPORT");
        out.println("=".repeat(80));
        out.println();
        out.printf("Rows analyzed: %d of %d%n", report.normalization().outputRows(),
                report.normalization().inputRows());
        out.printf("Pages: %d (%d with at least %d keywords)%n",
                report.getTotalPages(), report.eligibleSources(), config.minKeywords());
        out.printf("Similar page groups: %d%n", report.getGroupCount());
        out.printf("Configuration: threshold=%.0f%%, min-keywords=%d%n",
                config.threshold() * 100, config.minKeywords());
        out.println();

        if (!report.hasGroups()) {
            out.println("No pages with similar keyword sets found for the configured criteria.");
            out.println();
            return;
        }

        List<GroupReport> groups = new ResultProjector().project(report);
        for (int i = 0; i < groups.size(); i++) {
            GroupReport group = groups.get(i);
            out.println("-".repeat(80));
            out.printf("GROUP #%d%n", i + 1);
            out.printf("  Keep: %s (%d clicks)%n", group.keepPage(), group.clicks());
            out.println("  Similar pages:");
            for (GroupReport.MemberEvidence member : group.members()) {
                out.printf("    - %s (%d clicks, %d shared keywords, %.1f%%)%n",
                        member.page(), member.clicks(), member.sharedCount(), member.ratio() * 100);
            }
            out.printf("  Terms shared by all pages (%d): %s%n",
                    group.sharedTermCount(), String.join(", ", group.sharedTerms()));
            out.println();
        }

        out.println("=".repeat(80));
        out.println("SUMMARY");
        out.println("=".repeat(80));
        out.printf("Pages to consolidate: %d%n", report.getRedundantPageCount());
        out.println();
    }

    private void exportResults(ReportExporter exporter, CannibalizationReport report, PrintWriter out)
            throws IOException {
        Path outputDir = outputPath != null ? Path.of(outputPath) : Path.of(".");
        Files.createDirectories(outputDir);

        if (exportFormat.includesCsv()) {
            Path csvPath = outputDir.resolve(ReportExporter.CSV_FILE_NAME);
            exporter.exportToCsv(report, csvPath);
            out.println("Results exported to: " + csvPath.toAbsolutePath());
        }

        if (exportFormat.includesJson()) {
            Path jsonPath = outputDir.resolve(ReportExporter.JSON_FILE_NAME);
            exporter.exportToJson(report, inputFile.getName(), jsonPath);
            out.println("Results exported to: " + jsonPath.toAbsolutePath());
        }
    }

    /**
     * Custom converter for ExportFormat enum to handle CLI string values.
     */
    public static class ExportFormatConverter implements ITypeConverter<ExportFormat> {
        @Override
        public ExportFormat convert(String value) throws Exception {
            return ExportFormat.fromString(value);
        }
    }
}
