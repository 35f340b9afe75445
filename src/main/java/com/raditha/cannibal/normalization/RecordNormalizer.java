package com.raditha.cannibal.normalization;

import com.raditha.cannibal.model.RankingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cleans raw ranking records before profiling.
 * <p>
 * Steps run in a fixed order: drop fragment URLs, drop exact duplicates,
 * strip trailing slashes from pages, lower-case keywords, drop negative
 * clicks, drop rows left with an empty page or keyword.
 */
public class RecordNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(RecordNormalizer.class);

    private final boolean excludeFragmentUrls;

    /**
     * Create normalizer that drops fragment URLs.
     */
    public RecordNormalizer() {
        this(true);
    }

    /**
     * @param excludeFragmentUrls drop rows whose page contains '#'
     */
    public RecordNormalizer(boolean excludeFragmentUrls) {
        this.excludeFragmentUrls = excludeFragmentUrls;
    }

    /**
     * Result of a normalization pass.
     */
    public record Result(List<RankingRecord> records, NormalizationSummary summary) {
        public Result {
            records = List.copyOf(records);
        }
    }

    public Result normalize(List<RankingRecord> rows) {
        int fragments = 0;
        int duplicates = 0;
        int negatives = 0;
        int empties = 0;

        Set<RankingRecord> seen = new HashSet<>();
        List<RankingRecord> cleaned = new ArrayList<>(rows.size());

        for (RankingRecord row : rows) {
            if (excludeFragmentUrls && row.page().contains("#")) {
                fragments++;
                continue;
            }
            if (!seen.add(row)) {
                duplicates++;
                continue;
            }

            String page = stripTrailingSlashes(row.page().trim());
            String keyword = row.keyword().trim().toLowerCase(Locale.ROOT);

            if (row.clicks() < 0) {
                negatives++;
                continue;
            }
            if (page.isEmpty() || keyword.isEmpty()) {
                empties++;
                continue;
            }
            cleaned.add(new RankingRecord(page, keyword, row.clicks()));
        }

        NormalizationSummary summary = new NormalizationSummary(
                rows.size(), fragments, duplicates, negatives, empties, cleaned.size());
        logger.info("Normalized records: {}", summary);
        return new Result(cleaned, summary);
    }

    /**
     * Remove every trailing '/' so "https://a.com/x/" and "https://a.com/x"
     * identify the same page.
     */
    public static String stripTrailingSlashes(String page) {
        int end = page.length();
        while (end > 0 && page.charAt(end - 1) == '/') {
            end--;
        }
        return page.substring(0, end);
    }
}
