package org.carball.restoreinfo.model.restore;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Restore-relevant MSBuild properties of one target framework.
 */
public record ProjectProperties(@JsonValue Map<String, String> values) {

    public ProjectProperties {
        values = values == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ProjectProperties of(Map<String, String> values) {
        return new ProjectProperties(values);
    }

    public Optional<String> find(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public int size() {
        return values.size();
    }
}
