package org.carball.restoreinfo.model.project;

import lombok.Builder;
import lombok.Singular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One evaluation update for a single project configuration, holding the change description
 * of every subscribed rule keyed by rule name.
 */
@Builder
public record ProjectSubscriptionUpdate(
        @Singular Map<String, ProjectChangeDescription> projectChanges,
        ProjectConfiguration projectConfiguration
) {

    public ProjectSubscriptionUpdate {
        projectChanges = projectChanges == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(projectChanges));
        Objects.requireNonNull(projectConfiguration, "projectConfiguration");
    }

    /**
     * Returns the change description for a subscribed rule.
     *
     * @throws IllegalStateException if the update does not carry the rule
     */
    public ProjectChangeDescription getChange(String ruleName) {
        ProjectChangeDescription change = projectChanges.get(ruleName);
        if (change == null) {
            throw new IllegalStateException("Project update for configuration '"
                    + projectConfiguration.name() + "' is missing rule: " + ruleName);
        }
        return change;
    }

    public boolean hasAnyChanges() {
        return projectChanges.values().stream()
                .anyMatch(change -> change.difference().anyChanges());
    }
}
