package org.carball.restoreinfo.model.restore;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReferenceItemsTest {

    @Test
    void shouldKeepFirstItemForDuplicateName() {
        // Given
        ReferenceItems items = ReferenceItems.of(List.of(
                ReferenceItem.of("Serilog", Map.of("Version", "3.1.1")),
                ReferenceItem.of("Dapper", Map.of("Version", "2.1.24")),
                ReferenceItem.of("Serilog", Map.of("Version", "2.0.0"))));

        // Then
        assertThat(items.names()).containsExactly("Serilog", "Dapper");
        assertThat(items.find("Serilog").orElseThrow().properties().find("Version")).contains("3.1.1");
        assertThat(items.contains("Polly")).isFalse();
    }

    @Test
    void shouldBeImmutable() {
        ReferenceItems items = ReferenceItems.of(List.of(ReferenceItem.of("Serilog", Map.of())));

        assertThatThrownBy(() -> items.items().add(ReferenceItem.of("Dapper", Map.of())))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldAddPropertyWithoutChangingOriginal() {
        // Given
        ReferenceProperties properties = ReferenceProperties.of(Map.of("PrivateAssets", "all"));

        // When
        ReferenceProperties updated = properties.with("ProjectFileFullPath", "/src/Lib/Lib.csproj");

        // Then
        assertThat(properties.size()).isEqualTo(1);
        assertThat(updated.values()).containsExactly(
                Map.entry("PrivateAssets", "all"),
                Map.entry("ProjectFileFullPath", "/src/Lib/Lib.csproj"));
    }

    @Test
    void shouldKeepFirstTargetFrameworkForDuplicateMoniker() {
        // Given
        TargetFrameworks frameworks = TargetFrameworks.of(List.of(
                new TargetFrameworkInfo("net6.0", null, ReferenceItems.of(List.of(ReferenceItem.of("Serilog", Map.of()))), null),
                new TargetFrameworkInfo("net7.0", null, null, null),
                new TargetFrameworkInfo("net6.0", null, null, null)));

        // Then
        assertThat(frameworks.monikers()).containsExactly("net6.0", "net7.0");
        assertThat(frameworks.find("net6.0").orElseThrow().packageReferences().names()).containsExactly("Serilog");
    }
}
