package com.streamfirst.nomicon.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Standing naming settings shared by every name built for one deployment.
 *
 * <p>Any of the five tables (region map, acronyms, style overrides, constraints, regional
 * resources) left empty is filled from the selected cloud's defaults. The fallback replaces the
 * whole table; it never merges individual keys.
 */
@Value
public class NamingConfig {

    /** Cloud identifier; blank selects the default cloud */
    String cloud;

    String orgPrefix;
    String project;
    String env;

    /** Human region name, looked up in the region map */
    String region;

    /** Explicit region code; wins over the region map when set */
    String regionShortCode;

    Map<String, String> regionMap;

    /** Ordered component keys; empty means the default recipe */
    List<String> recipe;

    /** Ordered style wire names; empty means the default priority */
    List<String> stylePriority;

    Map<String, String> resourceAcronyms;
    Map<String, List<String>> resourceStyleOverrides;
    Map<String, ResourceConstraint> resourceConstraints;

    /** Blank the region component for resources listed in {@link #regionalResources} */
    boolean ignoreRegionForRegionalResources;

    Set<String> regionalResources;

    @Builder(toBuilder = true)
    private NamingConfig(
            String cloud,
            String orgPrefix,
            String project,
            String env,
            String region,
            String regionShortCode,
            Map<String, String> regionMap,
            List<String> recipe,
            List<String> stylePriority,
            Map<String, String> resourceAcronyms,
            Map<String, List<String>> resourceStyleOverrides,
            Map<String, ResourceConstraint> resourceConstraints,
            boolean ignoreRegionForRegionalResources,
            Set<String> regionalResources) {
        this.cloud = nullToEmpty(cloud);
        this.orgPrefix = nullToEmpty(orgPrefix);
        this.project = nullToEmpty(project);
        this.env = nullToEmpty(env);
        this.region = nullToEmpty(region);
        this.regionShortCode = nullToEmpty(regionShortCode);
        this.regionMap = readOnly(regionMap);
        this.recipe = readOnly(recipe);
        this.stylePriority = readOnly(stylePriority);
        this.resourceAcronyms = readOnly(resourceAcronyms);
        this.resourceStyleOverrides = readOnlyStyles(resourceStyleOverrides);
        this.resourceConstraints = readOnly(resourceConstraints);
        this.ignoreRegionForRegionalResources = ignoreRegionForRegionalResources;
        this.regionalResources = regionalResources == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(regionalResources));
    }

    static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    static <K, V> Map<K, V> readOnly(Map<K, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    /** Copies the map and every style list in it. */
    static Map<String, List<String>> readOnlyStyles(Map<String, List<String>> styles) {
        if (styles == null) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        styles.forEach((key, value) -> copy.put(key, readOnly(value)));
        return Collections.unmodifiableMap(copy);
    }

    static <T> List<T> readOnly(List<T> list) {
        return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }
}
