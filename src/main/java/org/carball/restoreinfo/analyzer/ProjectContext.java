package org.carball.restoreinfo.analyzer;

/**
 * The project whose configurations are being aggregated. Implementations are read-only and may be
 * shared between concurrent aggregations.
 */
public interface ProjectContext {

    /**
     * Full path of the project file.
     */
    String getFullPath();

    String getProjectDirectory();

    /**
     * Makes a path relative to the project directory absolute. Rooted paths are returned as is.
     */
    String makeRooted(String path);
}
