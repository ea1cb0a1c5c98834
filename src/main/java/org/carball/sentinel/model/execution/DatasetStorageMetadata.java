package org.carball.sentinel.model.execution;

/**
 * Storage-layer facts about one dataset (file layout, size, partitioning).
 */
public record DatasetStorageMetadata(
        String datasetPath,
        String fileFormat,
        long fileCount,
        long totalSizeBytes,
        int partitionCount
) {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    public double averageFileSizeMb() {
        if (fileCount <= 0) {
            return 0.0;
        }
        return (totalSizeBytes / BYTES_PER_MB) / fileCount;
    }
}
