package org.carball.restoreinfo.model.restore;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered reference items, unique by name. When built from a sequence holding the same name
 * twice, the first occurrence is kept.
 */
public record ReferenceItems(@JsonValue List<ReferenceItem> items) implements Iterable<ReferenceItem> {

    public ReferenceItems {
        Map<String, ReferenceItem> byName = new LinkedHashMap<>();
        if (items != null) {
            for (ReferenceItem item : items) {
                byName.putIfAbsent(item.name(), item);
            }
        }
        items = Collections.unmodifiableList(new ArrayList<>(byName.values()));
    }

    public static ReferenceItems empty() {
        return new ReferenceItems(null);
    }

    public static ReferenceItems of(List<ReferenceItem> items) {
        return new ReferenceItems(items);
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public Optional<ReferenceItem> find(String name) {
        return items.stream()
                .filter(item -> item.name().equals(name))
                .findFirst();
    }

    public int size() {
        return items.size();
    }

    public List<String> names() {
        return items.stream().map(ReferenceItem::name).toList();
    }

    @Override
    public Iterator<ReferenceItem> iterator() {
        return items.iterator();
    }
}
