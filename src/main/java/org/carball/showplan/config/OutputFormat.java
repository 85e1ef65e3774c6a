package org.carball.showplan.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
