package com.raditha.cannibal.similarity;

import com.raditha.cannibal.index.InvertedIndex;
import com.raditha.cannibal.model.CandidateMatch;
import com.raditha.cannibal.model.PageProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Finds, for a source page, the pages whose keyword overlap meets the
 * similarity threshold.
 * <p>
 * The overlap ratio is {@code |K_A ∩ K_B| / |K_A|} where {@code A} is the
 * source. It is deliberately not symmetric: a small page can be fully
 * contained in a large one without the large one qualifying the small one.
 * Pages with fewer than {@code minKeywords} keywords are never used as a
 * source but can still be returned as candidates of other pages.
 */
public class SimilarityMatcher {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityMatcher.class);

    private static final Comparator<CandidateMatch> BY_TARGET = Comparator.comparing(CandidateMatch::to);

    private final double threshold;
    private final int minKeywords;
    private final int parallelism;

    /**
     * Create a sequential matcher.
     *
     * @param threshold   Minimum overlap ratio (0.0-1.0)
     * @param minKeywords Minimum keyword count for a page to act as a source
     */
    public SimilarityMatcher(double threshold, int minKeywords) {
        this(threshold, minKeywords, 1);
    }

    /**
     * @param threshold   Minimum overlap ratio (0.0-1.0)
     * @param minKeywords Minimum keyword count for a page to act as a source
     * @param parallelism Worker threads used by {@link #matchAll}; 1 runs on the caller thread
     */
    public SimilarityMatcher(double threshold, int minKeywords, int parallelism) {
        if (!Double.isFinite(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, got: " + threshold);
        }
        if (minKeywords < 0) {
            throw new IllegalArgumentException("minKeywords must be >= 0, got: " + minKeywords);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        this.threshold = threshold;
        this.minKeywords = minKeywords;
        this.parallelism = parallelism;
    }

    /**
     * Compute the qualifying candidates of one source page.
     *
     * @param source   page being evaluated
     * @param profiles full profile table
     * @param index    index built from the same table
     * @return qualifying matches ordered by target page; empty if the source
     *         has too few keywords
     */
    public List<CandidateMatch> match(PageProfile source, Map<String, PageProfile> profiles, InvertedIndex index) {
        if (!source.isEligibleSource(minKeywords)) {
            return List.of();
        }

        int denominator = source.keywordCount();
        List<CandidateMatch> matches = new ArrayList<>();

        for (String candidateId : index.candidates(source)) {
            PageProfile candidate = profiles.get(candidateId);
            if (candidate == null) {
                throw new IllegalStateException("Index refers to unknown page: " + candidateId);
            }

            TreeSet<String> shared = intersect(source, candidate);
            double ratio = (double) shared.size() / denominator;
            if (ratio >= threshold) {
                matches.add(new CandidateMatch(source.id(), candidateId, shared, ratio));
            }
        }

        matches.sort(BY_TARGET);
        return matches;
    }

    /**
     * Compute qualifying candidates for every eligible source page.
     * Each page is matched independently against the immutable profile table
     * and index; results are only merged once all workers are done.
     *
     * @return matches per source page, ascending by page id; sources without
     *         qualifying candidates map to an empty list
     */
    public SortedMap<String, List<CandidateMatch>> matchAll(SortedMap<String, PageProfile> profiles,
            InvertedIndex index) {
        List<PageProfile> sources = profiles.values().stream()
                .filter(p -> p.isEligibleSource(minKeywords))
                .toList();

        logger.debug("Matching {} eligible sources of {} pages (threshold={}, minKeywords={})",
                sources.size(), profiles.size(), threshold, minKeywords);

        SortedMap<String, List<CandidateMatch>> results;
        if (parallelism == 1 || sources.size() < 2) {
            results = new TreeMap<>();
            for (PageProfile source : sources) {
                results.put(source.id(), match(source, profiles, index));
            }
        } else {
            results = matchInParallel(sources, profiles, index);
        }
        return Collections.unmodifiableSortedMap(results);
    }

    private SortedMap<String, List<CandidateMatch>> matchInParallel(List<PageProfile> sources,
            Map<String, PageProfile> profiles, InvertedIndex index) {
        int workers = Math.min(parallelism, sources.size());
        int batchSize = (sources.size() + workers - 1) / workers;

        List<Callable<Map<String, List<CandidateMatch>>>> batches = new ArrayList<>();
        for (int start = 0; start < sources.size(); start += batchSize) {
            List<PageProfile> batch = sources.subList(start, Math.min(start + batchSize, sources.size()));
            batches.add(() -> {
                Map<String, List<CandidateMatch>> partial = new TreeMap<>();
                for (PageProfile source : batch) {
                    partial.put(source.id(), match(source, profiles, index));
                }
                return partial;
            });
        }

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            SortedMap<String, List<CandidateMatch>> results = new TreeMap<>();
            for (Future<Map<String, List<CandidateMatch>>> future : executor.invokeAll(batches)) {
                results.putAll(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Similarity matching was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Similarity matching failed: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private static TreeSet<String> intersect(PageProfile source, PageProfile candidate) {
        // iterate over the smaller set
        PageProfile smaller = source.keywordCount() <= candidate.keywordCount() ? source : candidate;
        PageProfile larger = smaller == source ? candidate : source;

        TreeSet<String> shared = new TreeSet<>();
        for (String keyword : smaller.keywords()) {
            if (larger.keywords().contains(keyword)) {
                shared.add(keyword);
            }
        }
        return shared;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getMinKeywords() {
        return minKeywords;
    }

    public int getParallelism() {
        return parallelism;
    }
}
