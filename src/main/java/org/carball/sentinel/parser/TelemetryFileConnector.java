package org.carball.sentinel.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.sentinel.analyzer.AuxiliaryMetadataProvider;
import org.carball.sentinel.analyzer.ProfileLookup;
import org.carball.sentinel.baseline.HistoricalSampleProvider;
import org.carball.sentinel.exception.ProfileLookupException;
import org.carball.sentinel.measurement.ExecutionMetricsLookup;
import org.carball.sentinel.model.baseline.HistoricalSample;
import org.carball.sentinel.model.execution.AccelerationMetadata;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.DatasetStorageMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.execution.ExecutionStatus;
import org.carball.sentinel.model.execution.OperatorNode;
import org.carball.sentinel.model.execution.OperatorType;
import org.carball.sentinel.model.measurement.ExecutionMetrics;
import org.carball.sentinel.signature.Signature;
import org.carball.sentinel.signature.SignatureGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads execution telemetry from an exported JSON file instead of querying the engine directly.
 *
 * <p>The connector doubles as the profile, auxiliary metadata, execution metrics and historical
 * sample source for everything in the export.
 */
@Slf4j
public class TelemetryFileConnector implements ProfileLookup, AuxiliaryMetadataProvider, ExecutionMetricsLookup {

    private final JsonNode exportData;
    private final Map<String, ExecutionRecord> records = new LinkedHashMap<>();
    private final Map<String, JsonNode> profileNodes = new HashMap<>();
    private final List<DatasetStorageMetadata> datasets = new ArrayList<>();
    private final List<AccelerationMetadata> accelerations = new ArrayList<>();

    public TelemetryFileConnector(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Telemetry export file not found: " + path);
        }

        ObjectMapper objectMapper = new ObjectMapper();
        exportData = objectMapper.readTree(Files.readString(path));

        validateExportFormat();
        loadExecutions();
        loadDatasets();
        loadAccelerations();

        log.info("Loaded {} executions, {} datasets and {} acceleration structures from {}",
                records.size(), datasets.size(), accelerations.size(), path);
    }

    public List<ExecutionRecord> getExecutions() {
        return new ArrayList<>(records.values());
    }

    public Optional<ExecutionRecord> getExecution(String executionId) {
        return Optional.ofNullable(records.get(executionId));
    }

    public List<DatasetStorageMetadata> getDatasets() {
        return List.copyOf(datasets);
    }

    public List<AccelerationMetadata> getAccelerations() {
        return List.copyOf(accelerations);
    }

    public ExportMetadata getExportMetadata() {
        JsonNode metadata = exportData.get("export_metadata");
        return new ExportMetadata(
                metadata.path("engine").asText("unknown"),
                metadata.get("export_timestamp").asText(),
                metadata.path("total_executions").asInt(records.size()));
    }

    /**
     * The moment the export was taken, when its timestamp is parseable.
     */
    public Optional<Instant> getExportInstant() {
        return Optional.ofNullable(parseInstant(exportData.get("export_metadata").get("export_timestamp")));
    }

    @Override
    public Optional<ExecutionProfile> findProfile(ExecutionRecord record) throws ProfileLookupException {
        JsonNode node = profileNodes.get(record.executionId());
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isObject()) {
            throw new ProfileLookupException("Profile for execution " + record.executionId() + " is not an object");
        }
        try {
            return Optional.of(parseProfile(record.executionId(), node));
        } catch (IllegalArgumentException e) {
            throw new ProfileLookupException("Malformed profile for execution " + record.executionId(), e);
        }
    }

    @Override
    public AuxiliaryMetadata metadataFor(ExecutionRecord record, ExecutionProfile profile) {
        if (profile == null || profile.getDatasetPaths() == null || profile.getDatasetPaths().isEmpty()) {
            return AuxiliaryMetadata.empty();
        }
        Set<String> paths = new LinkedHashSet<>(profile.getDatasetPaths());
        return new AuxiliaryMetadata(
                datasets.stream().filter(d -> paths.contains(d.datasetPath())).collect(Collectors.toList()),
                accelerations.stream().filter(a -> paths.contains(a.datasetPath())).collect(Collectors.toList()));
    }

    @Override
    public Optional<ExecutionMetrics> findMetrics(String executionId) {
        ExecutionRecord record = records.get(executionId);
        if (record == null) {
            return Optional.empty();
        }
        ExecutionProfile profile;
        try {
            profile = findProfile(record).orElse(null);
        } catch (ProfileLookupException e) {
            log.warn("Using duration only for execution {}: {}", executionId, e.getMessage());
            profile = null;
        }
        return Optional.of(ExecutionMetrics.from(record, profile));
    }

    /**
     * Historical samples from completed executions in the export, grouped by signature. Executions that
     * started more than {@code lookbackDays} before the clock's instant are left out; executions
     * without a start time cannot be placed in the window and are kept.
     */
    public HistoricalSampleProvider historicalSamples(SignatureGenerator signatureGenerator, int lookbackDays, Clock clock) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(lookbackDays));
        Map<Signature, List<HistoricalSample>> bySignature = new HashMap<>();
        int outsideWindow = 0;
        for (ExecutionRecord record : records.values()) {
            if (!record.isCompleted() || record.sqlText() == null || record.sqlText().isBlank()) {
                continue;
            }
            if (record.startTime() != null && record.startTime().isBefore(cutoff)) {
                outsideWindow++;
                continue;
            }
            Optional<ExecutionMetrics> metrics = findMetrics(record.executionId());
            HistoricalSample sample = metrics
                    .map(m -> new HistoricalSample(record.durationMs(), m.memoryMb(), m.dataScannedMb()))
                    .orElse(HistoricalSample.ofDuration(record.durationMs()));
            bySignature.computeIfAbsent(signatureGenerator.computeSignature(record.sqlText()), key -> new ArrayList<>())
                    .add(sample);
        }
        if (outsideWindow > 0) {
            log.info("Excluded {} executions that started before {} from baselines", outsideWindow, cutoff);
        }
        return signature -> bySignature.getOrDefault(signature, List.of());
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in export file");
        }

        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null) {
            throw new IllegalStateException("Missing export_metadata section in export file");
        }
        if (!metadata.has("export_timestamp")) {
            throw new IllegalStateException("Missing required metadata field: export_timestamp");
        }

        JsonNode executions = exportData.get("executions");
        if (executions == null || !executions.isArray()) {
            throw new IllegalStateException("Missing or invalid executions section in export file");
        }
    }

    private void loadExecutions() {
        for (JsonNode node : exportData.get("executions")) {
            String executionId = requiredText(node, "execution_id");
            ExecutionRecord record = new ExecutionRecord(
                    executionId,
                    requiredText(node, "sql_text"),
                    node.path("submitter").asText(null),
                    node.path("queue_name").asText(null),
                    parseInstant(node.get("start_time")),
                    parseInstant(node.get("end_time")),
                    node.path("duration_ms").asLong(0),
                    ExecutionStatus.fromEngineState(node.path("status").asText(null)));
            if (records.put(executionId, record) != null) {
                log.warn("Duplicate execution id {} in export, keeping the last occurrence", executionId);
            }
            if (node.has("profile")) {
                profileNodes.put(executionId, node.get("profile"));
            }
        }
    }

    private void loadDatasets() {
        JsonNode nodes = exportData.get("datasets");
        if (nodes == null || !nodes.isArray()) {
            return;
        }
        for (JsonNode node : nodes) {
            datasets.add(new DatasetStorageMetadata(
                    requiredText(node, "dataset_path"),
                    node.path("file_format").asText(null),
                    node.path("file_count").asLong(0),
                    node.path("total_size_bytes").asLong(0),
                    node.path("partition_count").asInt(0)));
        }
    }

    private void loadAccelerations() {
        JsonNode nodes = exportData.get("accelerations");
        if (nodes == null || !nodes.isArray()) {
            return;
        }
        for (JsonNode node : nodes) {
            accelerations.add(new AccelerationMetadata(
                    requiredText(node, "acceleration_id"),
                    node.path("name").asText(null),
                    node.path("type").asText(null),
                    node.path("dataset_path").asText(null),
                    node.path("hit_count").asLong(0),
                    node.path("miss_count").asLong(0),
                    parseInstant(node.get("last_used"))));
        }
    }

    private static ExecutionProfile parseProfile(String executionId, JsonNode node) {
        List<OperatorNode> operators = new ArrayList<>();
        JsonNode operatorNodes = node.get("operators");
        if (operatorNodes != null && operatorNodes.isArray()) {
            for (JsonNode op : operatorNodes) {
                operators.add(new OperatorNode(
                        op.path("operator_id").asText(null),
                        OperatorType.fromOperatorName(op.path("operator_type").asText(null)),
                        optionalLong(op, "input_rows"),
                        optionalLong(op, "output_rows")));
            }
        }

        return ExecutionProfile.builder()
                .executionId(executionId)
                .rowsScanned(optionalLong(node, "rows_scanned"))
                .rowsReturned(optionalLong(node, "rows_returned"))
                .bytesScanned(optionalLong(node, "bytes_scanned"))
                .partitionsScanned(optionalInt(node, "partitions_scanned"))
                .partitionsTotal(optionalInt(node, "partitions_total"))
                .memoryAllocatedBytes(optionalLong(node, "memory_allocated_bytes"))
                .peakMemoryBytes(optionalLong(node, "peak_memory_bytes"))
                .cpuTimeMs(optionalLong(node, "cpu_time_ms"))
                .accelerationUsed(node.path("acceleration_used").asBoolean(false))
                .accelerationIds(textList(node.get("acceleration_ids")))
                .datasetPaths(textList(node.get("dataset_paths")))
                .operators(operators)
                .build();
    }

    private static Long optionalLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException("Field " + field + " must be numeric, got " + value);
        }
        return value.asLong();
    }

    private static Integer optionalInt(JsonNode node, String field) {
        Long value = optionalLong(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Field " + field + " is out of range, got " + value, e);
        }
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(item -> values.add(item.asText()));
        }
        return values;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalStateException("Missing required field: " + field);
        }
        return value.asText();
    }

    private static Instant parseInstant(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp {}", value.asText());
            return null;
        }
    }

    /**
     * Metadata about the telemetry export.
     */
    public record ExportMetadata(String engine, String exportTimestamp, int totalExecutions) {}
}
