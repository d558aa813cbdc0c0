package org.carball.restoreinfo.model.project;

import lombok.Builder;
import lombok.Singular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A project configuration identified by its dimension values, e.g.
 * {@code Configuration=Debug, Platform=AnyCPU, TargetFramework=net6.0}.
 */
@Builder
public record ProjectConfiguration(
        String name,
        @Singular Map<String, String> dimensions
) {

    public ProjectConfiguration {
        dimensions = dimensions == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        if (name == null) {
            name = String.join("|", dimensions.values());
        }
    }

    public Optional<String> findDimension(String dimensionName) {
        return Optional.ofNullable(dimensions.get(dimensionName));
    }
}
