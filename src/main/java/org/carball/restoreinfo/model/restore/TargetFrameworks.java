package org.carball.restoreinfo.model.restore;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Target framework entries in first-seen order, unique by moniker.
 */
public record TargetFrameworks(@JsonValue List<TargetFrameworkInfo> frameworks) implements Iterable<TargetFrameworkInfo> {

    public TargetFrameworks {
        Map<String, TargetFrameworkInfo> byMoniker = new LinkedHashMap<>();
        if (frameworks != null) {
            for (TargetFrameworkInfo framework : frameworks) {
                byMoniker.putIfAbsent(framework.targetFrameworkMoniker(), framework);
            }
        }
        frameworks = Collections.unmodifiableList(new ArrayList<>(byMoniker.values()));
    }

    public static TargetFrameworks of(List<TargetFrameworkInfo> frameworks) {
        return new TargetFrameworks(frameworks);
    }

    public boolean contains(String moniker) {
        return find(moniker).isPresent();
    }

    public Optional<TargetFrameworkInfo> find(String moniker) {
        return frameworks.stream()
                .filter(framework -> framework.targetFrameworkMoniker().equals(moniker))
                .findFirst();
    }

    public List<String> monikers() {
        return frameworks.stream().map(TargetFrameworkInfo::targetFrameworkMoniker).toList();
    }

    public int size() {
        return frameworks.size();
    }

    @Override
    public Iterator<TargetFrameworkInfo> iterator() {
        return frameworks.iterator();
    }
}
