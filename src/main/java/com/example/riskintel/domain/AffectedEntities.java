package com.example.riskintel.domain;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Ids of the services, assets, risks and controls an event touches.
 */
public record AffectedEntities(List<String> services, List<String> assets,
                               List<String> risks, List<String> controls) {

    public AffectedEntities {
        services = services == null ? List.of() : List.copyOf(services);
        assets = assets == null ? List.of() : List.copyOf(assets);
        risks = risks == null ? List.of() : List.copyOf(risks);
        controls = controls == null ? List.of() : List.copyOf(controls);
    }

    public static AffectedEntities none() {
        return new AffectedEntities(List.of(), List.of(), List.of(), List.of());
    }

    /** Trimmed, de-duplicated, sorted copy of every list. */
    public AffectedEntities normalized() {
        return new AffectedEntities(normalize(services), normalize(assets), normalize(risks), normalize(controls));
    }

    /** Services first, then assets: the entities that can appear in the dependency graph. */
    public List<String> graphEntityIds() {
        return Stream.concat(services.stream(), assets.stream()).distinct().toList();
    }

    private static List<String> normalize(List<String> ids) {
        return ids.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .distinct()
                .sorted()
                .toList();
    }
}
