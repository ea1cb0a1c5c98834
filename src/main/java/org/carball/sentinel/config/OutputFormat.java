package org.carball.sentinel.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
