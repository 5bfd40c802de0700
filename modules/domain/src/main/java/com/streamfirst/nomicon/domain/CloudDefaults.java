package com.streamfirst.nomicon.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * The five default tables a cloud profile supplies to the naming engine.
 *
 * <p>Instances hold mutable collections so callers can layer their own entries on top. Profiles
 * never hand out the instance they cache; they hand out {@link #copy()} instead.
 */
@Getter
@ToString
public final class CloudDefaults {

    /** Human region name to short code (e.g., "us-east-1" to "use1") */
    private final Map<String, String> regionMap;

    /** Lowercased resource type to acronym */
    private final Map<String, String> resourceAcronyms;

    /** Lowercased resource type to the style wire names it allows */
    private final Map<String, List<String>> resourceStyleOverrides;

    /** Lowercased resource type to its structural constraint */
    private final Map<String, ResourceConstraint> resourceConstraints;

    /** Lowercased resource types whose identity is not region-scoped */
    private final Set<String> regionalResources;

    @Builder
    private CloudDefaults(
            Map<String, String> regionMap,
            Map<String, String> resourceAcronyms,
            Map<String, List<String>> resourceStyleOverrides,
            Map<String, ResourceConstraint> resourceConstraints,
            Set<String> regionalResources) {
        this.regionMap = regionMap == null ? new HashMap<>() : regionMap;
        this.resourceAcronyms = resourceAcronyms == null ? new HashMap<>() : resourceAcronyms;
        this.resourceStyleOverrides = resourceStyleOverrides == null ? new HashMap<>() : resourceStyleOverrides;
        this.resourceConstraints = resourceConstraints == null ? new HashMap<>() : resourceConstraints;
        this.regionalResources = regionalResources == null ? new HashSet<>() : regionalResources;
    }

    /**
     * Returns an independent deep copy. Mutating the copy, including the style lists inside it,
     * never affects this instance. Constraints are immutable and are shared.
     */
    public CloudDefaults copy() {
        Map<String, List<String>> styles = new HashMap<>();
        resourceStyleOverrides.forEach((key, value) -> styles.put(key, new ArrayList<>(value)));
        return new CloudDefaults(
                new HashMap<>(regionMap),
                new HashMap<>(resourceAcronyms),
                styles,
                new HashMap<>(resourceConstraints),
                new HashSet<>(regionalResources));
    }

    /**
     * Returns a read-only view, for profiles that keep a canonical instance around.
     */
    public CloudDefaults unmodifiable() {
        Map<String, List<String>> styles = new HashMap<>();
        resourceStyleOverrides.forEach((key, value) -> styles.put(key, List.copyOf(value)));
        return new CloudDefaults(
                Collections.unmodifiableMap(regionMap),
                Collections.unmodifiableMap(resourceAcronyms),
                Collections.unmodifiableMap(styles),
                Collections.unmodifiableMap(resourceConstraints),
                Collections.unmodifiableSet(regionalResources));
    }
}
