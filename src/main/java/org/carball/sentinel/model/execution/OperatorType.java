package org.carball.sentinel.model.execution;

public enum OperatorType {
    SCAN,
    JOIN,
    AGGREGATE,
    FILTER,
    PROJECT,
    SORT,
    EXCHANGE,
    OTHER;

    /**
     * Maps an engine operator name (e.g. "HASH_JOIN", "PARQUET_ROW_GROUP_SCAN") onto a type tag.
     */
    public static OperatorType fromOperatorName(String name) {
        if (name == null) {
            return OTHER;
        }
        String upper = name.toUpperCase();
        if (upper.contains("JOIN")) return JOIN;
        if (upper.contains("SCAN")) return SCAN;
        if (upper.contains("AGG")) return AGGREGATE;
        if (upper.contains("FILTER") || upper.contains("SELECTION_VECTOR")) return FILTER;
        if (upper.contains("PROJECT")) return PROJECT;
        if (upper.contains("SORT") || upper.contains("TOP_N")) return SORT;
        if (upper.contains("EXCHANGE") || upper.contains("SENDER") || upper.contains("RECEIVER")) return EXCHANGE;
        return OTHER;
    }
}
