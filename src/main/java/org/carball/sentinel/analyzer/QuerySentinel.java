package org.carball.sentinel.analyzer;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.carball.sentinel.analyzer.detector.AccelerationOpportunityDetector;
import org.carball.sentinel.analyzer.detector.IssueDetector;
import org.carball.sentinel.analyzer.detector.JoinFanOutDetector;
import org.carball.sentinel.analyzer.detector.PartitionScanDetector;
import org.carball.sentinel.analyzer.detector.RegressionDetector;
import org.carball.sentinel.analyzer.detector.SmallFileDetector;
import org.carball.sentinel.analyzer.detector.UnboundedProjectionDetector;
import org.carball.sentinel.baseline.BaselineCalculator;
import org.carball.sentinel.baseline.BaselineStore;
import org.carball.sentinel.baseline.HistoricalSampleProvider;
import org.carball.sentinel.baseline.InMemoryBaselineStore;
import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.exception.NotFoundException;
import org.carball.sentinel.measurement.ExecutionMetricsLookup;
import org.carball.sentinel.measurement.InMemoryMeasurementStore;
import org.carball.sentinel.measurement.MeasurementEngine;
import org.carball.sentinel.measurement.MeasurementStore;
import org.carball.sentinel.model.baseline.Baseline;
import org.carball.sentinel.model.execution.DatasetStorageMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.measurement.Measurement;
import org.carball.sentinel.model.measurement.MeasurementSummary;
import org.carball.sentinel.signature.Signature;
import org.carball.sentinel.signature.SignatureGenerator;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point wiring signature generation, baselines, detection and fix validation together.
 * Every collaborator is injected; missing stores default to in-memory ones.
 */
@Slf4j
public class QuerySentinel {

    private final ThresholdConfig thresholds;
    private final SignatureGenerator signatureGenerator;
    private final BaselineStore baselineStore;
    private final BaselineCalculator baselineCalculator;
    private final HistoricalSampleProvider sampleProvider;
    private final SmallFileDetector smallFileDetector;
    private final DetectionOrchestrator orchestrator;
    private final MeasurementEngine measurementEngine;

    @Builder
    private QuerySentinel(ThresholdConfig thresholds,
                          BaselineStore baselineStore,
                          HistoricalSampleProvider sampleProvider,
                          AuxiliaryMetadataProvider auxiliaryProvider,
                          ExecutionMetricsLookup metricsLookup,
                          MeasurementStore measurementStore,
                          Clock clock) {
        this.thresholds = thresholds != null ? thresholds : ThresholdConfig.createDefaults();
        this.thresholds.validate();
        Clock effectiveClock = clock != null ? clock : Clock.systemUTC();

        this.signatureGenerator = new SignatureGenerator(this.thresholds.getSignatureLength());
        this.baselineStore = baselineStore != null ? baselineStore : new InMemoryBaselineStore();
        this.baselineCalculator = new BaselineCalculator(this.baselineStore, this.thresholds, effectiveClock);
        this.sampleProvider = sampleProvider != null ? sampleProvider : signature -> List.of();
        this.smallFileDetector = new SmallFileDetector(this.thresholds);

        List<IssueDetector> detectors = List.of(
                new PartitionScanDetector(this.thresholds),
                new AccelerationOpportunityDetector(this.thresholds),
                new JoinFanOutDetector(this.thresholds),
                new UnboundedProjectionDetector(this.thresholds),
                smallFileDetector,
                new RegressionDetector(signatureGenerator, this.baselineStore, this.thresholds));
        this.orchestrator = new DetectionOrchestrator(detectors, auxiliaryProvider, this.thresholds);

        ExecutionMetricsLookup effectiveLookup = metricsLookup != null ? metricsLookup : executionId -> Optional.empty();
        this.measurementEngine = new MeasurementEngine(effectiveLookup,
                measurementStore != null ? measurementStore : new InMemoryMeasurementStore(),
                this.thresholds, effectiveClock);

        log.info("Initialized QuerySentinel with {} detectors", detectors.size());
        log.info("Using thresholds: {}", this.thresholds.getDescription());
    }

    public List<Finding> detect(ExecutionRecord record, ExecutionProfile profile) {
        return orchestrator.detect(record, profile);
    }

    public BatchDetectionResult detectBatch(List<ExecutionRecord> records, ProfileLookup profileLookup) {
        return orchestrator.detectBatch(records, profileLookup);
    }

    /**
     * Runs the small-file check over datasets directly, without any execution attached.
     */
    public List<Finding> auditDatasets(List<DatasetStorageMetadata> datasets) {
        return datasets.stream()
                .map(smallFileDetector::evaluateDataset)
                .flatMap(Optional::stream)
                .sorted(DetectionOrchestrator.FINDING_ORDER)
                .collect(Collectors.toList());
    }

    public Signature computeSignature(String sql) {
        return signatureGenerator.computeSignature(sql);
    }

    /**
     * Returns a fresh baseline for the signature, refreshing it from the sample provider if needed.
     *
     * @throws NotFoundException if no baseline exists and no samples are available to build one
     */
    public Baseline getOrRefreshBaseline(Signature signature) {
        return baselineCalculator.getOrRefresh(signature, sampleProvider)
                .orElseThrow(() -> new NotFoundException("Baseline", signature.value()));
    }

    public Measurement recordBefore(String recommendationId, String executionId) {
        return measurementEngine.recordBefore(recommendationId, executionId);
    }

    public Measurement recordAfter(String recommendationId, String executionId, double estimatedImprovementPct) {
        return measurementEngine.recordAfter(recommendationId, executionId, estimatedImprovementPct);
    }

    public MeasurementSummary summarize(int periodDays) {
        return measurementEngine.summarize(periodDays);
    }

    public Optional<Measurement> findMeasurement(String recommendationId) {
        return measurementEngine.find(recommendationId);
    }

    public ThresholdConfig getThresholds() {
        return thresholds;
    }

    public DetectionOrchestrator getOrchestrator() {
        return orchestrator;
    }
}
