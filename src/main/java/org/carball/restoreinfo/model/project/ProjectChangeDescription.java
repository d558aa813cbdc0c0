package org.carball.restoreinfo.model.project;

import java.util.Objects;

public record ProjectChangeDescription(
        ProjectRuleSnapshot before,
        ProjectRuleSnapshot after,
        ProjectChangeDiff difference
) {

    public ProjectChangeDescription {
        Objects.requireNonNull(after, "after");
        if (before == null) {
            before = ProjectRuleSnapshot.empty(after.ruleName());
        }
        if (difference == null) {
            difference = ProjectChangeDiff.between(before, after);
        }
    }

    public static ProjectChangeDescription between(ProjectRuleSnapshot before, ProjectRuleSnapshot after) {
        return new ProjectChangeDescription(before, after, null);
    }

    /**
     * A description whose after state equals its before state.
     */
    public static ProjectChangeDescription unchanged(ProjectRuleSnapshot snapshot) {
        return new ProjectChangeDescription(snapshot, snapshot, ProjectChangeDiff.none());
    }
}
