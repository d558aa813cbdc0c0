package org.carball.restoreinfo.model.project;

import lombok.Builder;
import lombok.Singular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluated state of one rule (property page schema) for one project configuration: its
 * properties and its items, each item carrying its own metadata.
 */
@Builder(toBuilder = true)
public record ProjectRuleSnapshot(
        String ruleName,
        @Singular("property") Map<String, String> properties,
        @Singular("item") Map<String, Map<String, String>> items
) {

    public ProjectRuleSnapshot {
        properties = properties == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));

        Map<String, Map<String, String>> copiedItems = new LinkedHashMap<>();
        if (items != null) {
            items.forEach((name, metadata) -> copiedItems.put(name, metadata == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(metadata))));
        }
        items = Collections.unmodifiableMap(copiedItems);
    }

    public static ProjectRuleSnapshot empty(String ruleName) {
        return new ProjectRuleSnapshot(ruleName, null, null);
    }

    public Optional<String> findProperty(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    /**
     * Returns the property value, or null when the rule does not define it.
     */
    public String getProperty(String name) {
        return properties.get(name);
    }
}
