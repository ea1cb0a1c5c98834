package org.carball.sentinel.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sentinel.analyzer.detector.IssueDetector;
import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.exception.ProfileLookupException;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.finding.Finding;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs a fixed set of detectors over executions and orders their findings.
 *
 * <p>Findings are sorted by severity (highest first), then estimated improvement (highest first,
 * absent last); ties keep detector registration order.
 */
@Slf4j
public class DetectionOrchestrator {

    static final Comparator<Finding> FINDING_ORDER = Comparator
            .comparing(Finding::getSeverity, Comparator.reverseOrder())
            .thenComparing(Finding::getEstimatedImprovementPct, Comparator.nullsLast(Comparator.reverseOrder()));

    private final List<IssueDetector> detectors;
    private final AuxiliaryMetadataProvider auxiliaryProvider;
    private final int parallelism;
    private final Duration batchTimeout;

    public DetectionOrchestrator(List<IssueDetector> detectors, ThresholdConfig thresholds) {
        this(detectors, AuxiliaryMetadataProvider.NONE, thresholds);
    }

    public DetectionOrchestrator(List<IssueDetector> detectors,
                                 AuxiliaryMetadataProvider auxiliaryProvider,
                                 ThresholdConfig thresholds) {
        if (detectors == null || detectors.isEmpty()) {
            throw new IllegalArgumentException("At least one detector must be registered");
        }
        this.detectors = List.copyOf(detectors);
        this.auxiliaryProvider = auxiliaryProvider != null ? auxiliaryProvider : AuxiliaryMetadataProvider.NONE;
        this.parallelism = thresholds.getBatchParallelism();
        this.batchTimeout = Duration.ofSeconds(thresholds.getBatchTimeoutSeconds());
        log.debug("Initialized DetectionOrchestrator with {} detectors, parallelism {}", this.detectors.size(), parallelism);
    }

    public List<IssueDetector> getDetectors() {
        return detectors;
    }

    public List<Finding> detect(ExecutionRecord record, ExecutionProfile profile) {
        AuxiliaryMetadata auxiliary = lookupAuxiliary(record, profile);

        List<Finding> findings = new ArrayList<>();
        for (IssueDetector detector : detectors) {
            try {
                List<Finding> result = detector.evaluate(record, profile, auxiliary);
                if (result != null) {
                    findings.addAll(result);
                }
            } catch (RuntimeException e) {
                log.warn("Detector '{}' failed on execution {}, skipping it: {}",
                        detector.getName(), record.executionId(), e.toString());
                log.debug("Detector failure details", e);
            }
        }

        findings.sort(FINDING_ORDER);
        log.debug("Execution {}: {} findings", record.executionId(), findings.size());
        return findings;
    }

    public BatchDetectionResult detectBatch(List<ExecutionRecord> records, ProfileLookup profileLookup) {
        return detectBatch(records, profileLookup, batchTimeout);
    }

    /**
     * Analyzes executions on a bounded worker pool. When the timeout elapses or the calling thread
     * is interrupted, outstanding work is cancelled and the findings gathered so far are returned.
     */
    public BatchDetectionResult detectBatch(List<ExecutionRecord> batch, ProfileLookup profileLookup, Duration timeout) {
        List<ExecutionRecord> records = distinctById(batch);
        log.info("Starting batch detection over {} executions with {} workers", records.size(), parallelism);

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(parallelism, records.size())));
        CompletionService<RecordOutcome> completionService = new ExecutorCompletionService<>(executor);
        List<Future<RecordOutcome>> futures = new ArrayList<>();
        Map<String, List<Finding>> gathered = new HashMap<>();
        List<String> failedLookups = new ArrayList<>();
        int received = 0;
        boolean completed = true;

        try {
            for (ExecutionRecord record : records) {
                futures.add(completionService.submit(() -> analyze(record, profileLookup)));
            }

            long deadline = System.nanoTime() + timeout.toNanos();
            while (received < futures.size()) {
                long remaining = deadline - System.nanoTime();
                Future<RecordOutcome> done = remaining > 0
                        ? completionService.poll(remaining, TimeUnit.NANOSECONDS)
                        : null;
                if (done == null) {
                    log.warn("Batch detection timed out after {} with {} of {} executions analyzed",
                            timeout, received, futures.size());
                    completed = false;
                    break;
                }
                received++;
                collect(done, gathered, failedLookups);
            }
        } catch (InterruptedException e) {
            log.warn("Batch detection interrupted with {} of {} executions analyzed", received, futures.size());
            Thread.currentThread().interrupt();
            completed = false;
        } finally {
            futures.forEach(future -> future.cancel(true));
            executor.shutdownNow();
        }

        Map<String, List<Finding>> ordered = new LinkedHashMap<>();
        for (ExecutionRecord record : records) {
            List<Finding> findings = gathered.get(record.executionId());
            if (findings != null) {
                ordered.put(record.executionId(), findings);
            }
        }
        int skipped = records.size() - ordered.size() - failedLookups.size();

        BatchDetectionResult result = new BatchDetectionResult(ordered, List.copyOf(failedLookups), skipped, completed);
        log.info("Batch detection finished: {} analyzed, {} findings, {} failed lookups, {} skipped",
                result.analyzedCount(), result.totalFindings(), result.failedLookupCount(), skipped);
        return result;
    }

    /**
     * Keeps the first record of each execution id; results are keyed by id, so repeats would be lost.
     */
    private static List<ExecutionRecord> distinctById(List<ExecutionRecord> records) {
        Map<String, ExecutionRecord> byId = new LinkedHashMap<>();
        for (ExecutionRecord record : records) {
            if (byId.putIfAbsent(record.executionId(), record) != null) {
                log.warn("Duplicate execution id {} in batch, analyzing its first occurrence only", record.executionId());
            }
        }
        return byId.size() == records.size() ? records : new ArrayList<>(byId.values());
    }

    private RecordOutcome analyze(ExecutionRecord record, ProfileLookup profileLookup) {
        ExecutionProfile profile;
        try {
            profile = profileLookup.findProfile(record).orElse(null);
        } catch (ProfileLookupException | RuntimeException e) {
            log.warn("Profile lookup failed for execution {}: {}", record.executionId(), e.getMessage());
            return RecordOutcome.lookupFailed(record.executionId());
        }
        return RecordOutcome.analyzed(record.executionId(), detect(record, profile));
    }

    private static void collect(Future<RecordOutcome> done, Map<String, List<Finding>> gathered, List<String> failedLookups)
            throws InterruptedException {
        try {
            RecordOutcome outcome = done.get();
            if (outcome.lookupFailed()) {
                failedLookups.add(outcome.executionId());
            } else {
                gathered.put(outcome.executionId(), outcome.findings());
            }
        } catch (ExecutionException e) {
            // detect() isolates detector failures, so this is a bug in the orchestration itself
            throw new IllegalStateException("Batch task failed unexpectedly", e.getCause());
        }
    }

    private AuxiliaryMetadata lookupAuxiliary(ExecutionRecord record, ExecutionProfile profile) {
        try {
            AuxiliaryMetadata auxiliary = auxiliaryProvider.metadataFor(record, profile);
            return auxiliary != null ? auxiliary : AuxiliaryMetadata.empty();
        } catch (RuntimeException e) {
            log.warn("Auxiliary metadata unavailable for execution {}: {}", record.executionId(), e.getMessage());
            return AuxiliaryMetadata.empty();
        }
    }

    private record RecordOutcome(String executionId, List<Finding> findings, boolean lookupFailed) {

        static RecordOutcome analyzed(String executionId, List<Finding> findings) {
            return new RecordOutcome(executionId, findings, false);
        }

        static RecordOutcome lookupFailed(String executionId) {
            return new RecordOutcome(executionId, List.of(), true);
        }
    }
}
