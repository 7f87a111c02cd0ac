package org.carball.overbook.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
