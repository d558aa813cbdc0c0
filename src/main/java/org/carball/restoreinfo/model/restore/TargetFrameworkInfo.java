package org.carball.restoreinfo.model.restore;

import java.util.Objects;

public record TargetFrameworkInfo(
        String targetFrameworkMoniker,
        ReferenceItems projectReferences,
        ReferenceItems packageReferences,
        ProjectProperties properties
) {

    public TargetFrameworkInfo {
        Objects.requireNonNull(targetFrameworkMoniker, "targetFrameworkMoniker");
        projectReferences = projectReferences == null ? ReferenceItems.empty() : projectReferences;
        packageReferences = packageReferences == null ? ReferenceItems.empty() : packageReferences;
        properties = properties == null ? ProjectProperties.of(null) : properties;
    }
}
