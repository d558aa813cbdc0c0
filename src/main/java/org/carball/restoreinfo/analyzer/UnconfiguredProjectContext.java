package org.carball.restoreinfo.analyzer;

import java.util.Objects;

/**
 * {@link ProjectContext} backed by the full path of a project file.
 */
public class UnconfiguredProjectContext implements ProjectContext {

    private final String fullPath;
    private final String projectDirectory;

    public UnconfiguredProjectContext(String fullPath) {
        this.fullPath = Objects.requireNonNull(fullPath, "fullPath");
        if (!ProjectPaths.isRooted(fullPath)) {
            throw new IllegalArgumentException("Project file path must be absolute: " + fullPath);
        }
        this.projectDirectory = ProjectPaths.directoryOf(fullPath);
    }

    @Override
    public String getFullPath() {
        return fullPath;
    }

    @Override
    public String getProjectDirectory() {
        return projectDirectory;
    }

    @Override
    public String makeRooted(String path) {
        return ProjectPaths.makeRooted(projectDirectory, path);
    }

    @Override
    public String toString() {
        return "UnconfiguredProjectContext{" + fullPath + "}";
    }
}
