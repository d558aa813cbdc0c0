package org.carball.restoreinfo.model.restore;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Metadata of a reference item, in the order the build reported it.
 */
public record ReferenceProperties(@JsonValue Map<String, String> values) {

    public ReferenceProperties {
        values = values == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ReferenceProperties of(Map<String, String> values) {
        return new ReferenceProperties(values);
    }

    public Optional<String> find(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Returns a copy with the property set. An existing property keeps its position.
     */
    public ReferenceProperties with(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new ReferenceProperties(copy);
    }

    public int size() {
        return values.size();
    }
}
