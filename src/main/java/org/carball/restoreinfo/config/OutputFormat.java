package org.carball.restoreinfo.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
