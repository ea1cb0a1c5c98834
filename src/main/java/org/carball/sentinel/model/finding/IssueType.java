package org.carball.sentinel.model.finding;

import lombok.Getter;

@Getter
public enum IssueType {
    PARTITION_SCAN("partition_pruning", "Partition pruning not effective"),
    ACCELERATION_MISSING("acceleration_missing", "No acceleration structure for slow query"),
    ACCELERATION_UNDERUTILIZED("acceleration_underutilized", "Acceleration structure rarely used"),
    JOIN_FAN_OUT("join_fan_out", "Join multiplies row counts"),
    UNBOUNDED_PROJECTION("select_star", "Query selects all columns"),
    SMALL_FILES("small_files", "Dataset fragmented into small files"),
    PERFORMANCE_REGRESSION("performance_regression", "Query slower than its baseline");

    private final String code;
    private final String defaultTitle;

    IssueType(String code, String defaultTitle) {
        this.code = code;
        this.defaultTitle = defaultTitle;
    }
}
