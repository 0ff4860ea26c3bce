package com.conveyal.hills.analysis;

import com.conveyal.hills.binning.BinScatterAccumulator;
import com.conveyal.hills.binning.CategoryAccumulation;
import com.conveyal.hills.binning.ConservationChecker;
import com.conveyal.hills.binning.FineGridMatrix;
import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.HillsException;
import com.conveyal.hills.model.Measure;
import com.conveyal.hills.model.StopRecord;
import com.conveyal.hills.rollup.RollupAggregator;
import com.conveyal.hills.rollup.RollupTable;
import com.conveyal.hills.summary.LengthOfStaySummarizer;
import com.conveyal.hills.summary.StatisticsMode;
import com.conveyal.hills.summary.SummaryEngine;
import com.conveyal.hills.summary.SummaryStatistics;
import com.conveyal.hills.summary.SummaryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs the whole pipeline over a batch of stop records: clean and partition the records by category, accumulate each
 * category on the fine grid, check conservation, add up the total, roll up to report bins and summarize.
 *
 * Categories are independent until the total is formed, so they may be accumulated on several threads. Each task
 * owns its arrays and the total is a separate reduction over the finished matrices in sorted category order. A run can
 * be canceled from another thread; the flag is checked before each category is started and before the reduction.
 */
public class HillsAnalysis {

    private static final Logger LOG = LoggerFactory.getLogger(HillsAnalysis.class);

    private final AnalysisParameters parameters;

    private final ProgressListener progressListener;

    private volatile boolean canceled = false;

    public HillsAnalysis (AnalysisParameters parameters) {
        this(parameters, new NoopProgressListener());
    }

    public HillsAnalysis (AnalysisParameters parameters, ProgressListener progressListener) {
        this.parameters = checkNotNull(parameters);
        this.progressListener = checkNotNull(progressListener);
    }

    /** Ask a running analysis to stop. Work already underway on a category finishes first. */
    public void cancel () {
        canceled = true;
    }

    public boolean isCanceled () {
        return canceled;
    }

    public HillsResult run (Collection<StopRecord> records) {
        parameters.validate();
        LOG.info("Running analysis: {}", parameters);
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();
        List<StopRecord> cleaned = preprocess(records, diagnostics);
        boolean categorized = cleaned.stream().anyMatch(StopRecord::hasCategory);
        Map<CategoryKey, List<StopRecord>> partitions = partition(cleaned, categorized, diagnostics);
        if (partitions.isEmpty()) {
            throw new HillsException("No categories remain to analyze after exclusions.");
        }
        List<StopRecord> analyzed = new ArrayList<>();
        partitions.values().forEach(analyzed::addAll);
        diagnostics.recordsAnalyzed = analyzed.size();

        int fineBinMinutes = parameters.effectiveFineBinMinutes();
        ConservationChecker checker = new ConservationChecker(parameters.window, fineBinMinutes);
        diagnostics.addLoggedWarnings(checker.checkDateRanges(analyzed));

        BinScatterAccumulator accumulator =
                new BinScatterAccumulator(parameters.window, fineBinMinutes, parameters.edgeBinMode);
        LOG.info("Accumulating {} records in {} categories on {} bins of {} minutes",
                analyzed.size(), partitions.size(), accumulator.nBins(), fineBinMinutes);
        Map<CategoryKey, CategoryAccumulation> accumulations = accumulateAll(accumulator, partitions);

        // Reduction and checks happen on this thread in category order.
        Map<CategoryKey, FineGridMatrix> matrices = new TreeMap<>();
        for (Map.Entry<CategoryKey, CategoryAccumulation> entry : accumulations.entrySet()) {
            CategoryKey category = entry.getKey();
            CategoryAccumulation accumulation = entry.getValue();
            diagnostics.putRelationshipCounts(category, accumulation.relationshipCounts);
            diagnostics.putConservation(category, checker.check(accumulation.matrix, partitions.get(category)));
            matrices.put(category, accumulation.matrix);
        }
        checkCanceled();
        if (categorized && parameters.totals) {
            FineGridMatrix total = BinScatterAccumulator.sumCategories(new ArrayList<>(matrices.values()));
            diagnostics.putConservation(CategoryKey.TOTAL, checker.check(total, analyzed));
            matrices.put(CategoryKey.TOTAL, total);
        }

        Map<CategoryKey, RollupTable> byDatetime = new TreeMap<>();
        Map<CategoryKey, RollupTable> highResolution = new TreeMap<>();
        RollupAggregator reportRollup = new RollupAggregator(parameters.reportBinMinutes);
        RollupAggregator fineRollup = new RollupAggregator(fineBinMinutes);
        for (FineGridMatrix matrix : matrices.values()) {
            byDatetime.put(matrix.category, reportRollup.rollup(matrix));
            if (parameters.keepHighResolution) {
                highResolution.put(matrix.category, fineRollup.rollup(matrix));
            }
        }

        SummaryEngine summaryEngine = new SummaryEngine(parameters.percentiles);
        Map<StatisticsMode, Map<CategoryKey, Map<Measure, SummaryTable>>> summaries = summaryEngine.summarizeAll(
                byDatetime.values(), parameters.nonstationary, parameters.stationary);

        LengthOfStaySummarizer losSummarizer =
                new LengthOfStaySummarizer(parameters.window, parameters.losUnit, parameters.percentiles);
        Map<CategoryKey, SummaryStatistics> lengthOfStay =
                losSummarizer.summarizeAll(partitions, categorized && parameters.totals);

        LOG.info("Analysis {} complete with {} warnings", parameters.scenarioName, diagnostics.getWarnings().size());
        return new HillsResult(parameters, byDatetime, highResolution, summaries, lengthOfStay, diagnostics);
    }

    /**
     * Drop records without an entry time, and without an exit time unless censored departures are to be adjusted. An
     * adjusted stay departs at the end of the last fine bin, so it occupies the grid through the end of the window and
     * its departure is never counted.
     */
    private List<StopRecord> preprocess (Collection<StopRecord> records, AnalysisDiagnostics diagnostics) {
        List<StopRecord> cleaned = new ArrayList<>(records.size());
        LocalDateTime censoredExit = parameters.window.gridEnd(parameters.effectiveFineBinMinutes());
        for (StopRecord record : records) {
            diagnostics.recordsRead += 1;
            if (record.entry == null) {
                diagnostics.missingEntryDropped += 1;
            } else if (record.exit == null) {
                if (parameters.adjustCensoredDepartures) {
                    cleaned.add(record.withExit(censoredExit));
                    diagnostics.censoredDeparturesAdjusted += 1;
                } else {
                    diagnostics.missingExitDropped += 1;
                }
            } else {
                cleaned.add(record);
            }
        }
        if (diagnostics.missingEntryDropped > 0) {
            diagnostics.warn(String.format("%d records with missing entry timestamps - records ignored",
                    diagnostics.missingEntryDropped));
        }
        if (diagnostics.missingExitDropped > 0) {
            diagnostics.warn(String.format("%d records with missing exit timestamps - records ignored",
                    diagnostics.missingExitDropped));
        }
        if (diagnostics.censoredDeparturesAdjusted > 0) {
            LOG.info("{} records with missing exit timestamps given exit at end of analysis {}",
                    diagnostics.censoredDeparturesAdjusted, censoredExit);
        }
        return cleaned;
    }

    /**
     * Split records by category. Without any categories in the data there is a single partition keyed as the total.
     * Otherwise uncategorized records and excluded categories are dropped.
     */
    private Map<CategoryKey, List<StopRecord>> partition (List<StopRecord> records, boolean categorized,
                                                          AnalysisDiagnostics diagnostics) {
        Map<CategoryKey, List<StopRecord>> partitions = new TreeMap<>();
        if (!categorized) {
            partitions.put(CategoryKey.TOTAL, records);
            return partitions;
        }
        for (StopRecord record : records) {
            if (!record.hasCategory()) {
                diagnostics.uncategorizedDropped += 1;
            } else if (parameters.categoriesToExclude.contains(record.category)) {
                diagnostics.excludedDropped += 1;
            } else {
                partitions.computeIfAbsent(CategoryKey.of(record.category), k -> new ArrayList<>()).add(record);
            }
        }
        if (diagnostics.uncategorizedDropped > 0) {
            diagnostics.warn(String.format("%d records with missing category - records ignored",
                    diagnostics.uncategorizedDropped));
        }
        if (diagnostics.excludedDropped > 0) {
            LOG.info("{} records in excluded categories {} ignored",
                    diagnostics.excludedDropped, parameters.categoriesToExclude);
        }
        return partitions;
    }

    private Map<CategoryKey, CategoryAccumulation> accumulateAll (BinScatterAccumulator accumulator,
                                                                 Map<CategoryKey, List<StopRecord>> partitions) {
        progressListener.beginTask("Accumulating categories", partitions.size());
        List<CategoryKey> categories = new ArrayList<>(partitions.keySet());
        List<Callable<CategoryAccumulation>> tasks = new ArrayList<>();
        for (CategoryKey category : categories) {
            List<StopRecord> categoryRecords = partitions.get(category);
            tasks.add(() -> {
                checkCanceled();
                CategoryAccumulation accumulation = accumulator.accumulate(category, categoryRecords);
                progressListener.increment();
                return accumulation;
            });
        }
        Map<CategoryKey, CategoryAccumulation> results = new TreeMap<>();
        int threads = Math.min(parameters.threads, tasks.size());
        if (threads <= 1) {
            for (int i = 0; i < tasks.size(); i++) {
                results.put(categories.get(i), callInline(tasks.get(i)));
            }
            return results;
        }
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<CategoryAccumulation>> futures = new ArrayList<>();
            for (Callable<CategoryAccumulation> task : tasks) {
                futures.add(executor.submit(task));
            }
            for (int i = 0; i < futures.size(); i++) {
                results.put(categories.get(i), futures.get(i).get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisCanceledException("Interrupted while accumulating categories.", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new HillsException("Failed to accumulate category.", cause);
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private static <T> T callInline (Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new HillsException("Failed to accumulate category.", e);
        }
    }

    private void checkCanceled () {
        if (canceled) {
            throw new AnalysisCanceledException("Analysis " + parameters.scenarioName + " was canceled.");
        }
    }

}
