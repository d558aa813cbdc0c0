package org.carball.restoreinfo.model.project;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Differences between the before and after snapshot of a rule.
 */
public record ProjectChangeDiff(
        boolean anyChanges,
        Set<String> addedItems,
        Set<String> removedItems,
        Set<String> changedItems,
        Set<String> changedProperties
) {

    private static final ProjectChangeDiff NONE = new ProjectChangeDiff(false, null, null, null, null);

    public ProjectChangeDiff {
        addedItems = copyOf(addedItems);
        removedItems = copyOf(removedItems);
        changedItems = copyOf(changedItems);
        changedProperties = copyOf(changedProperties);
    }

    public static ProjectChangeDiff none() {
        return NONE;
    }

    public static ProjectChangeDiff between(ProjectRuleSnapshot before, ProjectRuleSnapshot after) {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");

        Set<String> added = new LinkedHashSet<>();
        Set<String> removed = new LinkedHashSet<>();
        Set<String> changed = new LinkedHashSet<>();
        Set<String> changedProperties = new LinkedHashSet<>();

        for (Map.Entry<String, Map<String, String>> item : after.items().entrySet()) {
            Map<String, String> previous = before.items().get(item.getKey());
            if (previous == null) {
                added.add(item.getKey());
            } else if (!previous.equals(item.getValue())) {
                changed.add(item.getKey());
            }
        }
        for (String name : before.items().keySet()) {
            if (!after.items().containsKey(name)) {
                removed.add(name);
            }
        }

        for (Map.Entry<String, String> property : after.properties().entrySet()) {
            if (!Objects.equals(before.properties().get(property.getKey()), property.getValue())) {
                changedProperties.add(property.getKey());
            }
        }
        for (String name : before.properties().keySet()) {
            if (!after.properties().containsKey(name)) {
                changedProperties.add(name);
            }
        }

        boolean any = !added.isEmpty() || !removed.isEmpty() || !changed.isEmpty() || !changedProperties.isEmpty();
        return new ProjectChangeDiff(any, added, removed, changed, changedProperties);
    }

    /**
     * Copy of this diff with the change flag forced to the given value. Forcing it off also clears
     * the details, so a diff never reports changes it claims not to have.
     */
    public ProjectChangeDiff withAnyChanges(boolean value) {
        if (!value) {
            return NONE;
        }
        return new ProjectChangeDiff(true, addedItems, removedItems, changedItems, changedProperties);
    }

    private static Set<String> copyOf(Set<String> values) {
        return values == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
