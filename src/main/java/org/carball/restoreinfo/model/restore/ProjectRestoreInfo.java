package org.carball.restoreinfo.model.restore;

/**
 * Consolidated restore nomination for one project.
 *
 * @param baseIntermediatePath     the project's {@code MSBuildProjectExtensionsPath}; restore writes its
 *                                 generated props/targets and assets file there
 * @param originalTargetFrameworks the unsplit {@code TargetFrameworks} property value
 * @param targetFrameworks         per target framework references and properties
 * @param toolReferences           project-wide CLI tool references
 */
public record ProjectRestoreInfo(
        String baseIntermediatePath,
        String originalTargetFrameworks,
        TargetFrameworks targetFrameworks,
        ReferenceItems toolReferences
) {

    public ProjectRestoreInfo {
        targetFrameworks = targetFrameworks == null ? TargetFrameworks.of(null) : targetFrameworks;
        toolReferences = toolReferences == null ? ReferenceItems.empty() : toolReferences;
    }
}
