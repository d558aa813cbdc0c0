package org.carball.restoreinfo.analyzer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.restoreinfo.model.project.ProjectSubscriptionUpdate;
import org.carball.restoreinfo.model.project.ProjectVersionedValue;
import org.carball.restoreinfo.model.project.RestoreRules;
import org.carball.restoreinfo.model.restore.ProjectRestoreInfo;
import org.carball.restoreinfo.model.restore.ReferenceItem;
import org.carball.restoreinfo.model.restore.TargetFrameworkInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RestoreInfoAggregatorTest {

    private static final ProjectContext PROJECT = new UnconfiguredProjectContext("C:\\Src\\Web\\Web.csproj");

    private RestoreInfoAggregator aggregator;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        aggregator = new RestoreInfoAggregator();

        logger = (Logger) LoggerFactory.getLogger(RestoreInfoAggregator.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldNotNominateWhenThereAreNoUpdates() {
        assertThat(aggregator.aggregate(List.of(), PROJECT)).isEmpty();
    }

    @Test
    void shouldNotNominateWhenNothingChanged() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .packageReference("Newtonsoft.Json", "13.0.3")
                        .unchanged()
                        .build(),
                SubscriptionUpdates.targetFramework("net7.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .unchanged()
                        .build());

        // When
        Optional<ProjectRestoreInfo> result = aggregator.aggregate(updates, PROJECT);

        // Then
        assertThat(result).isEmpty();
    }

    @Test
    void shouldNominateTwoTargetFrameworksInOrder() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.MSBUILD_PROJECT_EXTENSIONS_PATH, "C:\\Src\\Web\\obj\\")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .packageReference("Serilog", "3.1.1")
                        .build(),
                SubscriptionUpdates.targetFramework("net7.0")
                        .restoreProperty(RestoreRules.MSBUILD_PROJECT_EXTENSIONS_PATH, "C:\\Src\\Web\\obj\\")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .packageReference("Dapper", "2.1.24")
                        .build());

        // When
        Optional<ProjectRestoreInfo> result = aggregator.aggregate(updates, PROJECT);

        // Then
        assertThat(result).isPresent();
        ProjectRestoreInfo info = result.get();
        assertThat(info.baseIntermediatePath()).isEqualTo("C:\\Src\\Web\\obj\\");
        assertThat(info.originalTargetFrameworks()).isEqualTo("net6.0;net7.0");
        assertThat(info.targetFrameworks().monikers()).containsExactly("net6.0", "net7.0");
        assertThat(info.targetFrameworks().find("net6.0").orElseThrow().packageReferences().names())
                .containsExactly("Serilog");
        assertThat(info.targetFrameworks().find("net7.0").orElseThrow().packageReferences().names())
                .containsExactly("Dapper");
        assertThat(info.toolReferences().size()).isZero();
    }

    @Test
    void shouldNominateWhenOnlyOneUpdateChanged() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .unchanged()
                        .build(),
                SubscriptionUpdates.targetFramework("net7.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .packageReference("Dapper", "2.1.24")
                        .build());

        // When
        Optional<ProjectRestoreInfo> result = aggregator.aggregate(updates, PROJECT);

        // Then: unchanged configurations still contribute their target framework
        assertThat(result).isPresent();
        assertThat(result.get().targetFrameworks().monikers()).containsExactly("net6.0", "net7.0");
    }

    @Test
    void shouldNotNominateWhenNoTargetFrameworkResolves() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.configuration("Debug|AnyCPU")
                        .dimension("Configuration", "Debug")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "")
                        .packageReference("Serilog", "3.1.1")
                        .build(),
                SubscriptionUpdates.configuration("Release|AnyCPU")
                        .dimension("Configuration", "Release")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORK, "")
                        .build());

        // When
        Optional<ProjectRestoreInfo> result = aggregator.aggregate(updates, PROJECT);

        // Then
        assertThat(result).isEmpty();
        List<ILoggingEvent> warnings = logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .toList();
        assertThat(warnings).hasSize(2);
        assertThat(warnings.get(0).getFormattedMessage())
                .contains("Unable to find TargetFramework property")
                .contains("Debug|AnyCPU");
        assertThat(warnings.get(1).getFormattedMessage()).contains("Release|AnyCPU");
    }

    @Test
    void shouldFallBackToTargetFrameworkProperty() {
        // Given: a single-targeting project has no TargetFramework dimension
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.configuration("Debug|AnyCPU")
                        .dimension("Configuration", "Debug")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORK, "net8.0")
                        .packageReference("Polly", "8.2.0")
                        .build());

        // When
        Optional<ProjectRestoreInfo> result = aggregator.aggregate(updates, PROJECT);

        // Then
        assertThat(result).isPresent();
        assertThat(result.get().targetFrameworks().monikers()).containsExactly("net8.0");
    }

    @Test
    void shouldPreferDimensionOverProperty() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net7.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORK, "net6.0")
                        .build());

        // When
        Optional<ProjectRestoreInfo> result = aggregator.aggregate(updates, PROJECT);

        // Then
        assertThat(result.orElseThrow().targetFrameworks().monikers()).containsExactly("net7.0");
    }

    @Test
    void shouldNotFallBackToPropertyWhenDimensionIsEmpty() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.configuration("Debug|AnyCPU|")
                        .dimension(RestoreRules.TARGET_FRAMEWORK, "")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORK, "net6.0")
                        .build());

        // When / Then
        assertThat(aggregator.aggregate(updates, PROJECT)).isEmpty();
    }

    @Test
    void shouldKeepFirstUpdateForDuplicateTargetFramework() {
        // Given: two configurations disagree about net6.0
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty("RuntimeIdentifiers", "win-x64")
                        .packageReference("Serilog", "3.1.1")
                        .build(),
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty("RuntimeIdentifiers", "linux-x64")
                        .packageReference("Dapper", "2.1.24")
                        .projectReference("..\\Lib\\Lib.csproj", Map.of())
                        .build());

        // When
        ProjectRestoreInfo info = aggregator.aggregate(updates, PROJECT).orElseThrow();

        // Then: the second update is dropped without reconciliation
        assertThat(info.targetFrameworks().size()).isEqualTo(1);
        TargetFrameworkInfo framework = info.targetFrameworks().find("net6.0").orElseThrow();
        assertThat(framework.packageReferences().names()).containsExactly("Serilog");
        assertThat(framework.projectReferences().size()).isZero();
        assertThat(framework.properties().find("RuntimeIdentifiers")).contains("win-x64");
    }

    @Test
    void shouldDeduplicateToolReferencesAcrossTargetFrameworks() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .toolReference("dotnet-ef", "6.0.0")
                        .build(),
                SubscriptionUpdates.targetFramework("net7.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .toolReference("dotnet-ef", "7.0.0")
                        .toolReference("dotnet-format", "5.1.0")
                        .build());

        // When
        ProjectRestoreInfo info = aggregator.aggregate(updates, PROJECT).orElseThrow();

        // Then
        assertThat(info.toolReferences().names()).containsExactly("dotnet-ef", "dotnet-format");
        assertThat(info.toolReferences().find("dotnet-ef").orElseThrow().properties().find("Version"))
                .contains("6.0.0");
    }

    @Test
    void shouldCollectToolReferencesFromUpdateWithoutTargetFramework() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.configuration("Debug|AnyCPU")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0")
                        .toolReference("dotnet-ef", "6.0.0")
                        .build(),
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0")
                        .build());

        // When
        ProjectRestoreInfo info = aggregator.aggregate(updates, PROJECT).orElseThrow();

        // Then
        assertThat(info.targetFrameworks().monikers()).containsExactly("net6.0");
        assertThat(info.toolReferences().names()).containsExactly("dotnet-ef");
    }

    @Test
    void shouldTakeProjectWidePropertiesFromFirstUpdateDefiningThem() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .build(),
                SubscriptionUpdates.targetFramework("net7.0")
                        .restoreProperty(RestoreRules.MSBUILD_PROJECT_EXTENSIONS_PATH, "obj\\first\\")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net7.0")
                        .build(),
                SubscriptionUpdates.targetFramework("net8.0")
                        .restoreProperty(RestoreRules.MSBUILD_PROJECT_EXTENSIONS_PATH, "obj\\second\\")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net8.0")
                        .build());

        // When
        ProjectRestoreInfo info = aggregator.aggregate(updates, PROJECT).orElseThrow();

        // Then
        assertThat(info.baseIntermediatePath()).isEqualTo("obj\\first\\");
        assertThat(info.originalTargetFrameworks()).isEqualTo("net6.0;net7.0");
    }

    @Test
    void shouldRootProjectReferenceAgainstDefiningProjectDirectory() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0")
                        .projectReference("../Lib/Lib.csproj",
                                Map.of(RestoreInfoAggregator.DEFINING_PROJECT_DIRECTORY_PROPERTY, "C:\\Src\\App\\"))
                        .build());

        // When
        ProjectRestoreInfo info = aggregator.aggregate(updates, PROJECT).orElseThrow();

        // Then
        ReferenceItem reference = info.targetFrameworks().find("net6.0").orElseThrow()
                .projectReferences().find("../Lib/Lib.csproj").orElseThrow();
        assertThat(reference.properties().find(RestoreInfoAggregator.PROJECT_FILE_FULL_PATH_PROPERTY))
                .contains("C:\\Src\\Lib\\Lib.csproj");
        assertThat(reference.properties().find(RestoreInfoAggregator.DEFINING_PROJECT_DIRECTORY_PROPERTY))
                .contains("C:\\Src\\App\\");
    }

    @Test
    void shouldRootProjectReferenceAgainstProjectDirectory() {
        // Given: no DefiningProjectDirectory metadata
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0")
                        .projectReference("..\\Shared\\Shared.csproj", Map.of("PrivateAssets", "all"))
                        .build());

        // When
        ProjectRestoreInfo info = aggregator.aggregate(updates, PROJECT).orElseThrow();

        // Then
        ReferenceItem reference = info.targetFrameworks().find("net6.0").orElseThrow()
                .projectReferences().find("..\\Shared\\Shared.csproj").orElseThrow();
        assertThat(reference.properties().values()).containsExactly(
                Map.entry("PrivateAssets", "all"),
                Map.entry(RestoreInfoAggregator.PROJECT_FILE_FULL_PATH_PROPERTY, "C:\\Src\\Shared\\Shared.csproj"));
    }

    @Test
    void shouldRootProjectReferencesOnPosixPaths() {
        // Given
        ProjectContext project = new UnconfiguredProjectContext("/home/dev/src/Web/Web.csproj");
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net8.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net8.0")
                        .projectReference("../Lib/Lib.csproj", Map.of())
                        .projectReference("Core.csproj",
                                Map.of(RestoreInfoAggregator.DEFINING_PROJECT_DIRECTORY_PROPERTY, "/home/dev/src/Core//"))
                        .build());

        // When
        ProjectRestoreInfo info = aggregator.aggregate(updates, project).orElseThrow();

        // Then
        TargetFrameworkInfo framework = info.targetFrameworks().find("net8.0").orElseThrow();
        assertThat(framework.projectReferences().find("../Lib/Lib.csproj").orElseThrow()
                .properties().find(RestoreInfoAggregator.PROJECT_FILE_FULL_PATH_PROPERTY))
                .contains("/home/dev/src/Lib/Lib.csproj");
        assertThat(framework.projectReferences().find("Core.csproj").orElseThrow()
                .properties().find(RestoreInfoAggregator.PROJECT_FILE_FULL_PATH_PROPERTY))
                .contains("/home/dev/src/Core/Core.csproj");
    }

    @Test
    void shouldNotAddFullPathToPackageOrToolReferences() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0")
                        .packageReference("Serilog", "3.1.1")
                        .toolReference("dotnet-ef", "6.0.0")
                        .build());

        // When
        ProjectRestoreInfo info = aggregator.aggregate(updates, PROJECT).orElseThrow();

        // Then
        assertThat(info.targetFrameworks().find("net6.0").orElseThrow()
                .packageReferences().find("Serilog").orElseThrow().properties().values())
                .containsOnlyKeys("Version");
        assertThat(info.toolReferences().find("dotnet-ef").orElseThrow().properties().values())
                .containsOnlyKeys("Version");
    }

    @Test
    void shouldCarryRestorePropertiesPerTargetFramework() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0")
                        .restoreProperty("RestoreSources", "https://api.nuget.org/v3/index.json")
                        .restoreProperty("PackageTargetFallback", "")
                        .build());

        // When
        ProjectRestoreInfo info = aggregator.aggregate(updates, PROJECT).orElseThrow();

        // Then
        assertThat(info.targetFrameworks().find("net6.0").orElseThrow().properties().values())
                .containsExactly(
                        Map.entry(RestoreRules.TARGET_FRAMEWORKS, "net6.0"),
                        Map.entry("RestoreSources", "https://api.nuget.org/v3/index.json"),
                        Map.entry("PackageTargetFallback", ""));
    }

    @Test
    void shouldProduceEqualResultsForRepeatedCalls() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .packageReference("Serilog", "3.1.1")
                        .projectReference("..\\Lib\\Lib.csproj", Map.of())
                        .toolReference("dotnet-ef", "6.0.0")
                        .build(),
                SubscriptionUpdates.targetFramework("net7.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .packageReference("Dapper", "2.1.24")
                        .build());

        // When
        Optional<ProjectRestoreInfo> first = aggregator.aggregate(updates, PROJECT);
        Optional<ProjectRestoreInfo> second = new RestoreInfoAggregator().aggregate(updates, PROJECT);

        // Then
        assertThat(first).isPresent();
        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldProduceEqualResultsForConcurrentCallsOnSharedInstance() throws Exception {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .packageReference("Serilog", "3.1.1")
                        .projectReference("..\\Lib\\Lib.csproj", Map.of())
                        .toolReference("dotnet-ef", "6.0.0")
                        .build(),
                SubscriptionUpdates.targetFramework("net7.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0;net7.0")
                        .packageReference("Dapper", "2.1.24")
                        .toolReference("dotnet-ef", "7.0.0")
                        .build());
        Optional<ProjectRestoreInfo> expected = aggregator.aggregate(updates, PROJECT);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            // When
            List<Callable<Optional<ProjectRestoreInfo>>> calls = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                calls.add(() -> aggregator.aggregate(updates, PROJECT));
            }
            List<Future<Optional<ProjectRestoreInfo>>> results = executor.invokeAll(calls);

            // Then
            assertThat(expected).isPresent();
            for (Future<Optional<ProjectRestoreInfo>> result : results) {
                assertThat(result.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldFailFastWhenUpdateIsMissingRule() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0")
                        .withoutRule(RestoreRules.PACKAGE_REFERENCE)
                        .build());

        // When / Then
        assertThatThrownBy(() -> aggregator.aggregate(updates, PROJECT))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(RestoreRules.PACKAGE_REFERENCE);
    }

    @Test
    void shouldLogNominationSummary() {
        // Given
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = List.of(
                SubscriptionUpdates.targetFramework("net6.0")
                        .restoreProperty(RestoreRules.TARGET_FRAMEWORKS, "net6.0")
                        .build());

        // When
        aggregator.aggregate(updates, PROJECT);

        // Then
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.INFO)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message)
                        .contains("Nominating restore")
                        .contains("[net6.0]"));
    }
}
