package com.streamfirst.nomicon.application;

import com.streamfirst.nomicon.domain.CloudDefaults;
import com.streamfirst.nomicon.domain.ComponentKey;
import com.streamfirst.nomicon.domain.NamingConfig;
import com.streamfirst.nomicon.domain.NamingSettings;
import com.streamfirst.nomicon.domain.NamingStyle;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Layers host-level settings on top of a cloud's defaults to produce a {@link NamingConfig}.
 * Region overrides, acronyms and style overrides are merged key by key; a region map, recipe or
 * style priority replaces the default outright. Constraints and the regional set are left empty
 * so the engine takes them from the cloud profile.
 */
@Slf4j
@RequiredArgsConstructor
public class NamingSettingsResolver {

    private final CloudProfileRegistry registry;

    /**
     * @throws com.streamfirst.nomicon.domain.UnsupportedCloudException if the settings name an
     *     unregistered cloud
     */
    public NamingConfig resolve(@NonNull NamingSettings settings) {
        CloudDefaults defaults = registry.defaults(settings.getCloud());

        Map<String, String> regionMap = settings.getRegionMap().isEmpty()
            ? defaults.getRegionMap()
            : new HashMap<>(settings.getRegionMap());
        regionMap.putAll(settings.getRegionOverrides());

        Map<String, String> acronyms = defaults.getResourceAcronyms();
        settings.getResourceAcronyms().forEach((key, value) -> acronyms.put(key.toLowerCase(Locale.ROOT), value));

        Map<String, List<String>> styleOverrides = defaults.getResourceStyleOverrides();
        settings.getResourceStyleOverrides()
            .forEach((key, value) -> styleOverrides.put(key.toLowerCase(Locale.ROOT), new ArrayList<>(value)));

        log.debug("Resolved settings for cloud {}: {} regions, {} acronyms, {} style overrides",
            CloudProfileRegistry.normalizeCloud(settings.getCloud()), regionMap.size(), acronyms.size(),
            styleOverrides.size());

        return NamingConfig.builder()
            .cloud(settings.getCloud())
            .orgPrefix(settings.getOrgPrefix())
            .project(settings.getProject())
            .env(settings.getEnv())
            .region(settings.getRegion())
            .regionShortCode(settings.getRegionShortCode())
            .regionMap(regionMap)
            .recipe(settings.getRecipe().isEmpty() ? ComponentKey.defaultRecipe() : settings.getRecipe())
            .stylePriority(settings.getStylePriority().isEmpty()
                ? NamingStyle.defaultPriority()
                : settings.getStylePriority())
            .resourceAcronyms(acronyms)
            .resourceStyleOverrides(styleOverrides)
            .ignoreRegionForRegionalResources(settings.isIgnoreRegionForRegionalResources())
            .build();
    }
}
