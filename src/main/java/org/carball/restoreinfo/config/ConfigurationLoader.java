package org.carball.restoreinfo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String DEFAULT_OUTPUT_FILE = "restore-info.json";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > settings file > defaults.
     * The first argument is the update export file.
     */
    public RestoreInfoConfig loadConfiguration(String[] args) {
        if (args.length == 0 || args[0].startsWith("-")) {
            throw new IllegalArgumentException("Update export file not specified");
        }
        log.debug("Loading configuration");

        // Start with defaults
        RestoreInfoConfig config = new RestoreInfoConfig();
        config.setUpdatesFile(Paths.get(args[0]));
        config.setOutputFile(DEFAULT_OUTPUT_FILE);
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        // 1. Apply settings file
        String settingsPath = extractSettingsPath(args);
        if (settingsPath != null) {
            applySettings(config, loadSettings(settingsPath));
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(config);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(config, args);

        config.setOutputFile(withExtension(config.getOutputFile(), config.getOutputFormat()));

        log.debug("Configuration loaded: {}", config);
        return config;
    }

    /**
     * Reads a YAML settings file.
     *
     * @throws IllegalArgumentException if the file does not exist or cannot be parsed
     */
    public RestoreInfoSettings loadSettings(String settingsPath) {
        File settingsFile = new File(settingsPath);
        if (!settingsFile.exists()) {
            throw new IllegalArgumentException("Settings file not found: " + settingsPath);
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            RestoreInfoSettings settings = mapper.readValue(settingsFile, RestoreInfoSettings.class);
            log.info("Loaded settings from: {}", settingsPath);
            return settings != null ? settings : new RestoreInfoSettings();
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read settings file " + settingsPath + ": " + e.getMessage(), e);
        }
    }

    private void applySettings(RestoreInfoConfig config, RestoreInfoSettings settings) {
        if (settings.getOutputFile() != null) {
            config.setOutputFile(settings.getOutputFile());
        }
        if (settings.getOutputFormat() != null) {
            config.setOutputFormat(parseOutputFormat(settings.getOutputFormat()));
        }
        if (settings.getVerbose() != null) {
            config.setVerbose(settings.getVerbose());
        }
    }

    private void applyEnvironmentVariables(RestoreInfoConfig config) {
        if (environment.containsKey("RESTORE_INFO_OUTPUT_FILE")) {
            config.setOutputFile(environment.get("RESTORE_INFO_OUTPUT_FILE"));
        }
        if (environment.containsKey("RESTORE_INFO_OUTPUT_FORMAT")) {
            config.setOutputFormat(parseOutputFormat(environment.get("RESTORE_INFO_OUTPUT_FORMAT")));
        }
        if (environment.containsKey("RESTORE_INFO_VERBOSE")) {
            config.setVerbose(Boolean.parseBoolean(environment.get("RESTORE_INFO_VERBOSE")));
        }
    }

    private void applyCLIArguments(RestoreInfoConfig config, String[] args) {
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--project":
                case "-p":
                    config.setProjectFile(requireValue(args, ++i, "Project file"));
                    break;

                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, ++i, "Output file"));
                    break;

                case "--format":
                case "-f":
                    config.setOutputFormat(parseOutputFormat(requireValue(args, ++i, "Output format")));
                    break;

                case "--config":
                    // Handled before the environment is applied
                    requireValue(args, ++i, "Settings file");
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
    }

    private String extractSettingsPath(String[] args) {
        for (int i = 1; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static String requireValue(String[] args, int index, String what) {
        if (index >= args.length) {
            throw new IllegalArgumentException(what + " not specified");
        }
        return args[index];
    }

    private static OutputFormat parseOutputFormat(String value) {
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid output format '" + value + "'. Use: json, markdown, or both");
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (lastDotIndex > 0 && lastDotIndex > lastSeparatorIndex + 1 && lastDotIndex < filename.length() - 1) {
            return filename.substring(0, lastDotIndex);
        }
        return filename;
    }

    private static String withExtension(String outputFile, OutputFormat format) {
        String baseFileName = removeFileExtension(outputFile);
        return format == OutputFormat.MARKDOWN ? baseFileName + ".md" : baseFileName + ".json";
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Settings file (--config <file.yml>):
              output_file: restore-info.json
              output_format: json|markdown|both
              verbose: false

            Environment Variables:
              RESTORE_INFO_OUTPUT_FILE      Same as --output
              RESTORE_INFO_OUTPUT_FORMAT    Same as --format
              RESTORE_INFO_VERBOSE          Same as --verbose (true|false)

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Built-in defaults
            """;
    }
}
