package com.streamfirst.nomicon.domain;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Layered deployment settings as a host configures them. Unlike {@link NamingConfig}, the maps
 * here are partial: they are merged on top of the cloud's defaults rather than replacing them.
 */
@Value
public class NamingSettings {
    String cloud;
    String orgPrefix;
    String project;
    String env;
    String region;
    String regionShortCode;

    /** Replaces the default region map when non-empty */
    Map<String, String> regionMap;

    /** Merged key-by-key on top of the region map */
    Map<String, String> regionOverrides;

    List<String> recipe;
    List<String> stylePriority;

    /** Merged on top of the default acronyms, keys lowercased */
    Map<String, String> resourceAcronyms;

    /** Merged on top of the default style overrides, keys lowercased */
    Map<String, List<String>> resourceStyleOverrides;

    boolean ignoreRegionForRegionalResources;

    @Builder
    private NamingSettings(
            String cloud,
            String orgPrefix,
            String project,
            String env,
            String region,
            String regionShortCode,
            Map<String, String> regionMap,
            Map<String, String> regionOverrides,
            List<String> recipe,
            List<String> stylePriority,
            Map<String, String> resourceAcronyms,
            Map<String, List<String>> resourceStyleOverrides,
            boolean ignoreRegionForRegionalResources) {
        this.cloud = NamingConfig.nullToEmpty(cloud);
        this.orgPrefix = NamingConfig.nullToEmpty(orgPrefix);
        this.project = NamingConfig.nullToEmpty(project);
        this.env = NamingConfig.nullToEmpty(env);
        this.region = NamingConfig.nullToEmpty(region);
        this.regionShortCode = NamingConfig.nullToEmpty(regionShortCode);
        this.regionMap = NamingConfig.readOnly(regionMap);
        this.regionOverrides = NamingConfig.readOnly(regionOverrides);
        this.recipe = NamingConfig.readOnly(recipe);
        this.stylePriority = NamingConfig.readOnly(stylePriority);
        this.resourceAcronyms = NamingConfig.readOnly(resourceAcronyms);
        this.resourceStyleOverrides = NamingConfig.readOnlyStyles(resourceStyleOverrides);
        this.ignoreRegionForRegionalResources = ignoreRegionForRegionalResources;
    }
}
