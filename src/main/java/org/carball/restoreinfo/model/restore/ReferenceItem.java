package org.carball.restoreinfo.model.restore;

import java.util.Map;
import java.util.Objects;

/**
 * A project, package or tool reference: its include name (path or package id) and metadata.
 */
public record ReferenceItem(String name, ReferenceProperties properties) {

    public ReferenceItem {
        Objects.requireNonNull(name, "name");
        if (properties == null) {
            properties = ReferenceProperties.of(null);
        }
    }

    public static ReferenceItem of(String name, Map<String, String> metadata) {
        return new ReferenceItem(name, ReferenceProperties.of(metadata));
    }
}
