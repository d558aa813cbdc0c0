package org.carball.restoreinfo.model.project;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A value published by a project data source, tagged with the versions of the sources that
 * produced it.
 */
public record ProjectVersionedValue<T>(T value, Map<String, Long> dataSourceVersions) {

    public ProjectVersionedValue {
        Objects.requireNonNull(value, "value");
        dataSourceVersions = dataSourceVersions == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dataSourceVersions));
    }

    public static <T> ProjectVersionedValue<T> of(T value) {
        return new ProjectVersionedValue<>(value, null);
    }
}
