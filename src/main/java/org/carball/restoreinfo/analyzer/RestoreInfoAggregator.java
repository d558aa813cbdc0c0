package org.carball.restoreinfo.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.restoreinfo.model.project.ProjectChangeDescription;
import org.carball.restoreinfo.model.project.ProjectRuleSnapshot;
import org.carball.restoreinfo.model.project.ProjectSubscriptionUpdate;
import org.carball.restoreinfo.model.project.ProjectVersionedValue;
import org.carball.restoreinfo.model.project.RestoreRules;
import org.carball.restoreinfo.model.restore.ProjectProperties;
import org.carball.restoreinfo.model.restore.ProjectRestoreInfo;
import org.carball.restoreinfo.model.restore.ReferenceItem;
import org.carball.restoreinfo.model.restore.ReferenceItems;
import org.carball.restoreinfo.model.restore.ReferenceProperties;
import org.carball.restoreinfo.model.restore.TargetFrameworkInfo;
import org.carball.restoreinfo.model.restore.TargetFrameworks;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Merges the evaluation updates of every configuration of a project into a single restore
 * nomination. Holds no state between calls, so one instance can serve concurrent callers.
 */
@Slf4j
public class RestoreInfoAggregator {

    public static final String DEFINING_PROJECT_DIRECTORY_PROPERTY = "DefiningProjectDirectory";
    public static final String PROJECT_FILE_FULL_PATH_PROPERTY = "ProjectFileFullPath";

    /**
     * Builds the restore info for a project from one update per configuration.
     *
     * @return the restore info, or empty when no restore should be nominated: either no rule of
     * any update changed, or no update resolved a target framework
     * @throws IllegalStateException if an update lacks one of the {@link RestoreRules#ALL} rules
     */
    public Optional<ProjectRestoreInfo> aggregate(List<? extends ProjectVersionedValue<ProjectSubscriptionUpdate>> updates,
                                                  ProjectContext project) {
        Objects.requireNonNull(updates, "updates");
        Objects.requireNonNull(project, "project");

        // Nothing changed in any subscribed rule
        if (updates.stream().noneMatch(update -> update.value().hasAnyChanges())) {
            log.debug("No changes in {} update(s) for {}, skipping restore nomination",
                    updates.size(), project.getFullPath());
            return Optional.empty();
        }

        String msbuildProjectExtensionsPath = null;
        String originalTargetFrameworks = null;
        Map<String, TargetFrameworkInfo> targetFrameworks = new LinkedHashMap<>();
        Map<String, ReferenceItem> toolReferences = new LinkedHashMap<>();

        for (ProjectVersionedValue<ProjectSubscriptionUpdate> versionedUpdate : updates) {
            ProjectSubscriptionUpdate update = versionedUpdate.value();
            ProjectRuleSnapshot nugetRestore = update.getChange(RestoreRules.NUGET_RESTORE).after();

            if (msbuildProjectExtensionsPath == null) {
                msbuildProjectExtensionsPath = nugetRestore.getProperty(RestoreRules.MSBUILD_PROJECT_EXTENSIONS_PATH);
            }
            if (originalTargetFrameworks == null) {
                originalTargetFrameworks = nugetRestore.getProperty(RestoreRules.TARGET_FRAMEWORKS);
            }

            Optional<String> targetFramework = findTargetFramework(update, nugetRestore);
            if (targetFramework.isEmpty()) {
                log.warn("Unable to find TargetFramework property for configuration '{}'",
                        update.projectConfiguration().name());
            } else if (!targetFrameworks.containsKey(targetFramework.get())) {
                String moniker = targetFramework.get();
                ProjectRuleSnapshot projectReferences = update.getChange(RestoreRules.PROJECT_REFERENCE).after();
                ProjectRuleSnapshot packageReferences = update.getChange(RestoreRules.PACKAGE_REFERENCE).after();

                targetFrameworks.put(moniker, new TargetFrameworkInfo(
                        moniker,
                        getProjectReferences(projectReferences.items(), project),
                        getReferences(packageReferences.items()),
                        getProperties(nugetRestore.properties())
                ));
                log.debug("Added target framework {} from configuration '{}'",
                        moniker, update.projectConfiguration().name());
            } else {
                log.debug("Target framework {} already recorded, ignoring configuration '{}'",
                        targetFramework.get(), update.projectConfiguration().name());
            }

            ProjectChangeDescription toolReferenceChanges = update.getChange(RestoreRules.DOTNET_CLI_TOOL_REFERENCE);
            toolReferenceChanges.after().items().forEach((name, metadata) ->
                    toolReferences.computeIfAbsent(name, key -> getReferenceItem(key, metadata)));
        }

        if (targetFrameworks.isEmpty()) {
            log.info("No target frameworks resolved for {}, skipping restore nomination", project.getFullPath());
            return Optional.empty();
        }

        ProjectRestoreInfo restoreInfo = new ProjectRestoreInfo(
                msbuildProjectExtensionsPath,
                originalTargetFrameworks,
                TargetFrameworks.of(new ArrayList<>(targetFrameworks.values())),
                ReferenceItems.of(new ArrayList<>(toolReferences.values()))
        );

        log.info("Nominating restore for {} with target frameworks {} and {} tool reference(s)",
                project.getFullPath(), restoreInfo.targetFrameworks().monikers(), restoreInfo.toolReferences().size());

        return Optional.of(restoreInfo);
    }

    /**
     * The configuration dimension wins over the NuGetRestore property. A dimension that is present
     * but empty is not replaced by the property.
     */
    private Optional<String> findTargetFramework(ProjectSubscriptionUpdate update, ProjectRuleSnapshot nugetRestore) {
        Optional<String> targetFramework = update.projectConfiguration().findDimension(RestoreRules.TARGET_FRAMEWORK);
        if (targetFramework.isEmpty()) {
            targetFramework = nugetRestore.findProperty(RestoreRules.TARGET_FRAMEWORK);
        }
        return targetFramework.filter(value -> !value.isEmpty());
    }

    private ProjectProperties getProperties(Map<String, String> properties) {
        return ProjectProperties.of(properties);
    }

    private ReferenceItem getReferenceItem(String name, Map<String, String> metadata) {
        return new ReferenceItem(name, ReferenceProperties.of(metadata));
    }

    private ReferenceItems getReferences(Map<String, Map<String, String>> items) {
        List<ReferenceItem> references = new ArrayList<>();
        items.forEach((name, metadata) -> references.add(getReferenceItem(name, metadata)));
        return ReferenceItems.of(references);
    }

    private ReferenceItems getProjectReferences(Map<String, Map<String, String>> items, ProjectContext project) {
        List<ReferenceItem> references = new ArrayList<>();

        // Each reference gets the full path of the referenced project file
        items.forEach((name, metadata) -> {
            ReferenceProperties properties = ReferenceProperties.of(metadata);
            String projectFileFullPath = properties.find(DEFINING_PROJECT_DIRECTORY_PROPERTY)
                    .map(definingProjectDirectory -> makeRooted(definingProjectDirectory, name))
                    .orElseGet(() -> project.makeRooted(name));

            references.add(new ReferenceItem(name,
                    properties.with(PROJECT_FILE_FULL_PATH_PROPERTY, projectFileFullPath)));
        });

        return ReferenceItems.of(references);
    }

    private String makeRooted(String basePath, String path) {
        return ProjectPaths.makeRooted(ProjectPaths.trimTrailingSeparators(basePath), path);
    }
}
