package com.raditha.cannibal.analyzer;

import com.raditha.cannibal.clustering.ClusterResolver;
import com.raditha.cannibal.config.CannibalizationConfig;
import com.raditha.cannibal.index.InvertedIndex;
import com.raditha.cannibal.ingestion.GscCsvReader;
import com.raditha.cannibal.model.CandidateMatch;
import com.raditha.cannibal.model.PageGroup;
import com.raditha.cannibal.model.PageProfile;
import com.raditha.cannibal.model.RankingRecord;
import com.raditha.cannibal.normalization.RecordNormalizer;
import com.raditha.cannibal.profile.PageProfileBuilder;
import com.raditha.cannibal.similarity.SimilarityMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedMap;

/**
 * Main orchestrator for cannibalization detection.
 * Runs normalization, profiling, indexing, matching and group resolution in
 * that order. Each stage finishes before the next starts; only matching runs
 * on several threads.
 */
public class CannibalizationAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(CannibalizationAnalyzer.class);

    private final CannibalizationConfig config;
    private final RecordNormalizer normalizer;
    private final PageProfileBuilder profileBuilder;
    private final SimilarityMatcher matcher;
    private final ClusterResolver resolver;

    /**
     * Create analyzer with default configuration.
     */
    public CannibalizationAnalyzer() {
        this(CannibalizationConfig.moderate());
    }

    /**
     * Create analyzer with custom configuration.
     */
    public CannibalizationAnalyzer(CannibalizationConfig config) {
        this(config,
                new RecordNormalizer(config.excludeFragmentUrls()),
                new PageProfileBuilder(),
                new SimilarityMatcher(config.threshold(), config.minKeywords(), config.parallelism()),
                new ClusterResolver());
    }

    /**
     * Create analyzer with explicit collaborators.
     */
    public CannibalizationAnalyzer(CannibalizationConfig config,
            RecordNormalizer normalizer,
            PageProfileBuilder profileBuilder,
            SimilarityMatcher matcher,
            ClusterResolver resolver) {
        this.config = config;
        this.normalizer = normalizer;
        this.profileBuilder = profileBuilder;
        this.matcher = matcher;
        this.resolver = resolver;
    }

    /**
     * Read a Search Console export and analyze it.
     *
     * @throws IOException if the file cannot be read
     */
    public CannibalizationReport analyzeFile(Path csvFile) throws IOException {
        List<RankingRecord> rows = new GscCsvReader().read(csvFile);
        return analyze(rows);
    }

    /**
     * Analyze raw ranking rows.
     *
     * @param rows rows as read from the export, not yet cleaned
     * @return report, with no groups when nothing is left after cleaning
     */
    public CannibalizationReport analyze(List<RankingRecord> rows) {
        // Step 1: Clean rows
        RecordNormalizer.Result normalized = normalizer.normalize(rows);
        if (normalized.records().isEmpty()) {
            logger.warn("No rows left after normalization, nothing to analyze");
            return CannibalizationReport.empty(normalized.summary(), config);
        }

        // Step 2: One profile per page
        SortedMap<String, PageProfile> profiles = profileBuilder.build(normalized.records());

        // Step 3: Keyword index
        InvertedIndex index = InvertedIndex.build(profiles.values());
        logger.info("Indexed {} pages under {} keywords ({} postings)",
                profiles.size(), index.keywordCount(), index.postingCount());

        // Step 4: Candidate search, fully materialized before resolution
        SortedMap<String, List<CandidateMatch>> matches = matcher.matchAll(profiles, index);
        int qualifying = matches.values().stream().mapToInt(List::size).sum();

        // Step 5: Greedy group resolution
        List<PageGroup> groups = resolver.resolve(profiles, matches);

        CannibalizationReport report = new CannibalizationReport(
                groups,
                profiles,
                matches.size(),
                qualifying,
                index.keywordCount(),
                normalized.summary(),
                config);
        logger.info(report.getSummary());
        return report;
    }

    public CannibalizationConfig getConfig() {
        return config;
    }
}
