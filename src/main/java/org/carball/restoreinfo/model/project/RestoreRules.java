package org.carball.restoreinfo.model.project;

import java.util.List;

/**
 * Names of the rules a restore subscription listens to, and the restore properties read from them.
 */
public final class RestoreRules {

    public static final String NUGET_RESTORE = "NuGetRestore";
    public static final String PROJECT_REFERENCE = "ProjectReference";
    public static final String PACKAGE_REFERENCE = "PackageReference";
    public static final String DOTNET_CLI_TOOL_REFERENCE = "DotNetCliToolReference";

    public static final List<String> ALL = List.of(
            NUGET_RESTORE, PROJECT_REFERENCE, PACKAGE_REFERENCE, DOTNET_CLI_TOOL_REFERENCE);

    // NuGetRestore properties
    public static final String MSBUILD_PROJECT_EXTENSIONS_PATH = "MSBuildProjectExtensionsPath";
    public static final String TARGET_FRAMEWORKS = "TargetFrameworks";
    // Also the name of the configuration dimension
    public static final String TARGET_FRAMEWORK = "TargetFramework";

    private RestoreRules() {
    }
}
