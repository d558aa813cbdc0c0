package org.carball.restoreinfo.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class RestoreInfoConfig {
    private Path updatesFile;
    private String projectFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private boolean verbose;
}
