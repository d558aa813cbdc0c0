package org.carball.restoreinfo.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.restoreinfo.analyzer.RestoreInfoAggregator;
import org.carball.restoreinfo.model.restore.ProjectRestoreInfo;
import org.carball.restoreinfo.model.restore.ReferenceItem;
import org.carball.restoreinfo.model.restore.ReferenceItems;
import org.carball.restoreinfo.model.restore.TargetFrameworkInfo;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class RestoreInfoReport {

    private final String projectFile;
    private final ProjectRestoreInfo restoreInfo;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    /**
     * @param restoreInfo the nomination, or null when no restore is nominated
     */
    public RestoreInfoReport(String projectFile, ProjectRestoreInfo restoreInfo) {
        this(projectFile, restoreInfo, LocalDateTime.now());
    }

    RestoreInfoReport(String projectFile, ProjectRestoreInfo restoreInfo, LocalDateTime timestamp) {
        this.projectFile = projectFile;
        this.restoreInfo = restoreInfo;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public boolean isNominated() {
        return restoreInfo != null;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(new ReportData(timestamp, projectFile, isNominated(), restoreInfo));
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Restore Nomination Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Project:** `").append(projectFile).append("`  \n\n");

        if (restoreInfo == null) {
            md.append("**No restore nomination.** Either nothing relevant changed or no target framework could be resolved.\n");
            return md.toString();
        }

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Base Intermediate Path | `").append(nullToEmpty(restoreInfo.baseIntermediatePath())).append("` |\n");
        md.append("| Original Target Frameworks | `").append(nullToEmpty(restoreInfo.originalTargetFrameworks())).append("` |\n");
        md.append("| Target Frameworks | ").append(restoreInfo.targetFrameworks().size()).append(" |\n");
        md.append("| Tool References | ").append(restoreInfo.toolReferences().size()).append(" |\n\n");

        for (TargetFrameworkInfo framework : restoreInfo.targetFrameworks()) {
            md.append("## ").append(framework.targetFrameworkMoniker()).append("\n\n");

            md.append("### Package References\n\n");
            appendReferences(md, framework.packageReferences());

            md.append("### Project References\n\n");
            if (framework.projectReferences().size() == 0) {
                md.append("_None_\n\n");
            }
            for (ReferenceItem reference : framework.projectReferences()) {
                md.append("- `").append(reference.name()).append("` → `")
                        .append(reference.properties().find(RestoreInfoAggregator.PROJECT_FILE_FULL_PATH_PROPERTY).orElse(""))
                        .append("`\n");
            }
            if (framework.projectReferences().size() > 0) {
                md.append("\n");
            }

            md.append("### Properties\n\n");
            if (framework.properties().size() == 0) {
                md.append("_None_\n\n");
            } else {
                md.append("| Property | Value |\n");
                md.append("|----------|-------|\n");
                framework.properties().values().forEach((name, value) ->
                        md.append("| ").append(name).append(" | ").append(value).append(" |\n"));
                md.append("\n");
            }
        }

        md.append("## Tool References\n\n");
        appendReferences(md, restoreInfo.toolReferences());

        return md.toString();
    }

    private void appendReferences(StringBuilder md, ReferenceItems references) {
        if (references.size() == 0) {
            md.append("_None_\n\n");
            return;
        }
        for (ReferenceItem reference : references) {
            md.append("- `").append(reference.name()).append("`");
            String metadata = formatMetadata(reference.properties().values());
            if (!metadata.isEmpty()) {
                md.append(" (").append(metadata).append(")");
            }
            md.append("\n");
        }
        md.append("\n");
    }

    private String formatMetadata(Map<String, String> values) {
        return values.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public record ReportData(LocalDateTime generated, String projectFile, boolean nominated, ProjectRestoreInfo restoreInfo) {
    }
}
