package org.carball.restoreinfo.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.restoreinfo.analyzer.ProjectContext;
import org.carball.restoreinfo.analyzer.RestoreInfoAggregator;
import org.carball.restoreinfo.analyzer.UnconfiguredProjectContext;
import org.carball.restoreinfo.config.ConfigurationLoader;
import org.carball.restoreinfo.config.OutputFormat;
import org.carball.restoreinfo.config.RestoreInfoConfig;
import org.carball.restoreinfo.model.project.ProjectSubscriptionUpdate;
import org.carball.restoreinfo.model.project.ProjectVersionedValue;
import org.carball.restoreinfo.model.restore.ProjectRestoreInfo;
import org.carball.restoreinfo.model.restore.TargetFrameworkInfo;
import org.carball.restoreinfo.output.RestoreInfoReport;
import org.carball.restoreinfo.parser.SubscriptionUpdateFileReader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class RestoreInfoCLI {

    private static final String VERSION = "1.0.0";

    private final ConfigurationLoader configurationLoader;
    private final PrintStream out;
    private final PrintStream err;

    public RestoreInfoCLI(ConfigurationLoader configurationLoader, PrintStream out, PrintStream err) {
        this.configurationLoader = configurationLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        RestoreInfoCLI cli = new RestoreInfoCLI(new ConfigurationLoader(), System.out, System.err);
        System.exit(cli.run(args));
    }

    /**
     * Runs the tool and returns the process exit code.
     */
    public int run(String[] args) {
        out.printf("Restore Info Aggregator v%s%n", VERSION);

        if (args.length == 0 || isHelpRequested(args)) {
            printUsage();
            return args.length == 0 ? 1 : 0;
        }

        try {
            RestoreInfoConfig config = configurationLoader.loadConfiguration(args);

            SubscriptionUpdateFileReader reader = new SubscriptionUpdateFileReader(config.getUpdatesFile());
            String projectFile = resolveProjectFile(config, reader);
            ProjectContext project = new UnconfiguredProjectContext(projectFile);

            out.println();
            out.println("Updates file: " + config.getUpdatesFile());
            out.println("Project: " + projectFile);

            List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = reader.getUpdates();
            if (config.isVerbose()) {
                out.println("  - Loaded " + updates.size() + " configuration update(s)");
                for (ProjectVersionedValue<ProjectSubscriptionUpdate> update : updates) {
                    out.println("    " + update.value().projectConfiguration().name()
                            + formatVersions(update.dataSourceVersions()));
                }
            }

            Optional<ProjectRestoreInfo> restoreInfo = new RestoreInfoAggregator().aggregate(updates, project);

            RestoreInfoReport report = new RestoreInfoReport(projectFile, restoreInfo.orElse(null));
            List<String> written = outputResults(report, config);

            printSummary(restoreInfo);
            out.println();
            written.forEach(file -> out.println("Output file: " + file));
            return 0;

        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (IllegalStateException e) {
            err.println("Invalid update export: " + e.getMessage());
            log.debug("Invalid update export details", e);
            return 1;
        }
    }

    private String resolveProjectFile(RestoreInfoConfig config, SubscriptionUpdateFileReader reader) {
        if (config.getProjectFile() != null) {
            return config.getProjectFile();
        }
        return reader.getProjectFile().orElseThrow(() -> new IllegalArgumentException(
                "Project file not specified. Use --project or record project_file in the update export"));
    }

    private List<String> outputResults(RestoreInfoReport report, RestoreInfoConfig config) throws IOException {
        String baseFileName = config.getOutputFile().replaceAll("\\.(json|md)$", "");
        Path outputDir = Paths.get(config.getOutputFile()).toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }

        OutputFormat format = config.getOutputFormat();
        if (format == OutputFormat.JSON) {
            Files.writeString(Paths.get(config.getOutputFile()), report.toJson());
            return List.of(config.getOutputFile());
        }
        if (format == OutputFormat.MARKDOWN) {
            Files.writeString(Paths.get(config.getOutputFile()), report.toMarkdown());
            return List.of(config.getOutputFile());
        }

        Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        return List.of(baseFileName + ".json", baseFileName + ".md");
    }

    private void printSummary(Optional<ProjectRestoreInfo> restoreInfo) {
        out.println();
        out.println("=".repeat(60));
        out.println("RESTORE NOMINATION");
        out.println("=".repeat(60));

        if (restoreInfo.isEmpty()) {
            out.println("No restore nominated: nothing changed or no target framework was resolved.");
            return;
        }

        ProjectRestoreInfo info = restoreInfo.get();
        out.println("Base intermediate path: " + info.baseIntermediatePath());
        out.println("Target frameworks: " + info.originalTargetFrameworks());
        for (TargetFrameworkInfo framework : info.targetFrameworks()) {
            out.printf("  %-20s %d package(s), %d project(s)%n",
                    framework.targetFrameworkMoniker(),
                    framework.packageReferences().size(),
                    framework.projectReferences().size());
        }
        out.println("Tool references: " + info.toolReferences().size());
    }

    private static String formatVersions(Map<String, Long> versions) {
        return versions.isEmpty() ? "" : " " + versions;
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println();
        out.println("Usage: java -jar restore-info.jar <updates-file> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  updates-file        JSON export of project subscription updates, one per configuration");
        out.println();
        out.println("Options:");
        out.println("  --project, -p       Full path of the project file (default: project_file in the export)");
        out.println("  --output, -o        Output file (default: restore-info.json)");
        out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        out.println("  --config            YAML settings file");
        out.println("  --verbose, -v       Enable verbose output");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
    }
}
