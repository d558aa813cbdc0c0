package org.carball.restoreinfo.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.restoreinfo.model.project.ProjectChangeDescription;
import org.carball.restoreinfo.model.project.ProjectChangeDiff;
import org.carball.restoreinfo.model.project.ProjectConfiguration;
import org.carball.restoreinfo.model.project.ProjectRuleSnapshot;
import org.carball.restoreinfo.model.project.ProjectSubscriptionUpdate;
import org.carball.restoreinfo.model.project.ProjectVersionedValue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads recorded project subscription updates from a JSON export file, one update per project
 * configuration.
 */
@Slf4j
public class SubscriptionUpdateFileReader {

    private final JsonNode exportData;

    public SubscriptionUpdateFileReader(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Update export file not found: " + path);
        }
        this.exportData = new ObjectMapper().readTree(Files.readString(path));
        validateExportFormat();
    }

    private SubscriptionUpdateFileReader(JsonNode exportData) {
        this.exportData = exportData;
        validateExportFormat();
    }

    public static SubscriptionUpdateFileReader fromJson(String json) throws IOException {
        return new SubscriptionUpdateFileReader(new ObjectMapper().readTree(json));
    }

    /**
     * Project file recorded with the updates, if any.
     */
    public Optional<String> getProjectFile() {
        JsonNode projectFile = exportData.get("project_file");
        if (projectFile == null || projectFile.isNull() || projectFile.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(projectFile.asText());
    }

    public List<ProjectVersionedValue<ProjectSubscriptionUpdate>> getUpdates() {
        List<ProjectVersionedValue<ProjectSubscriptionUpdate>> updates = new ArrayList<>();
        int index = 0;
        for (JsonNode updateNode : exportData.get("updates")) {
            updates.add(parseUpdate(updateNode, index++));
        }
        log.debug("Read {} project update(s)", updates.size());
        return updates;
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in update export");
        }
        JsonNode updates = exportData.get("updates");
        if (updates == null || !updates.isArray()) {
            throw new IllegalStateException("Missing or invalid updates section in update export");
        }
    }

    private ProjectVersionedValue<ProjectSubscriptionUpdate> parseUpdate(JsonNode updateNode, int index) {
        JsonNode configurationNode = updateNode.get("configuration");
        if (configurationNode == null || !configurationNode.isObject()) {
            throw new IllegalStateException("Update #" + index + " has no configuration");
        }
        JsonNode changesNode = updateNode.get("project_changes");
        if (changesNode == null || !changesNode.isObject()) {
            throw new IllegalStateException("Update #" + index + " has no project_changes");
        }

        ProjectSubscriptionUpdate.ProjectSubscriptionUpdateBuilder builder = ProjectSubscriptionUpdate.builder()
                .projectConfiguration(parseConfiguration(configurationNode, index));

        Iterator<Map.Entry<String, JsonNode>> changes = changesNode.fields();
        while (changes.hasNext()) {
            Map.Entry<String, JsonNode> change = changes.next();
            String location = "Update #" + index + " rule " + change.getKey();
            if (!change.getValue().isObject()) {
                throw new IllegalStateException(location + " is not an object");
            }
            builder.projectChange(change.getKey(), parseChange(change.getKey(), change.getValue(), location));
        }

        Map<String, Long> versions = new LinkedHashMap<>();
        JsonNode versionsNode = updateNode.get("data_source_versions");
        if (versionsNode != null && versionsNode.isObject()) {
            versionsNode.fields().forEachRemaining(entry -> versions.put(entry.getKey(), entry.getValue().asLong()));
        }

        return new ProjectVersionedValue<>(builder.build(), versions);
    }

    private ProjectConfiguration parseConfiguration(JsonNode node, int index) {
        JsonNode name = node.get("name");
        return new ProjectConfiguration(
                name == null || name.isNull() ? null : name.asText(),
                readStringMap(node.get("dimensions"), "Update #" + index + " configuration dimensions"));
    }

    private ProjectChangeDescription parseChange(String ruleName, JsonNode node, String location) {
        ProjectRuleSnapshot before = parseSnapshot(ruleName, node.get("before"), location + " before");
        ProjectRuleSnapshot after = parseSnapshot(ruleName, node.get("after"), location + " after");

        // A recorded flag wins over the computed diff
        JsonNode anyChanges = node.get("any_changes");
        if (anyChanges != null && !anyChanges.isNull()) {
            if (!anyChanges.isBoolean()) {
                throw new IllegalStateException(location + " any_changes is not a boolean");
            }
            return new ProjectChangeDescription(before, after,
                    ProjectChangeDiff.between(before, after).withAnyChanges(anyChanges.booleanValue()));
        }
        return ProjectChangeDescription.between(before, after);
    }

    private ProjectRuleSnapshot parseSnapshot(String ruleName, JsonNode node, String location) {
        if (node == null || node.isNull()) {
            return ProjectRuleSnapshot.empty(ruleName);
        }
        if (!node.isObject()) {
            throw new IllegalStateException(location + " is not an object");
        }

        Map<String, Map<String, String>> items = new LinkedHashMap<>();
        JsonNode itemsNode = node.get("items");
        if (itemsNode != null && !itemsNode.isNull()) {
            if (!itemsNode.isObject()) {
                throw new IllegalStateException(location + " items is not an object");
            }
            itemsNode.fields().forEachRemaining(item -> items.put(item.getKey(),
                    readStringMap(item.getValue(), location + " item " + item.getKey())));
        }

        return new ProjectRuleSnapshot(ruleName, readStringMap(node.get("properties"), location + " properties"), items);
    }

    /**
     * Reads an object of scalar values. Null-valued entries are left out so they read as undefined.
     */
    private Map<String, String> readStringMap(JsonNode node, String location) {
        Map<String, String> values = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (!node.isObject()) {
            throw new IllegalStateException(location + " is not an object");
        }
        node.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isNull()) {
                return;
            }
            if (!value.isValueNode()) {
                throw new IllegalStateException(location + " value " + entry.getKey() + " is not a scalar");
            }
            values.put(entry.getKey(), value.asText());
        });
        return values;
    }
}
