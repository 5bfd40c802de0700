package com.streamfirst.nomicon.boot;

import com.streamfirst.nomicon.domain.NamingSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deployment naming settings bound from {@code nomicon.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "nomicon")
public class NomiconProperties {

    private String cloud = "";
    private String orgPrefix = "";
    private String project = "";
    private String env = "";
    private String region = "";
    private String regionShortCode = "";
    private Map<String, String> regionMap = new LinkedHashMap<>();
    private Map<String, String> regionOverrides = new LinkedHashMap<>();
    private List<String> recipe = new ArrayList<>();
    private List<String> stylePriority = new ArrayList<>();
    private Map<String, String> resourceAcronyms = new LinkedHashMap<>();
    private Map<String, List<String>> resourceStyleOverrides = new LinkedHashMap<>();
    private boolean ignoreRegionForRegionalResources;

    public NamingSettings toSettings() {
        return NamingSettings.builder()
            .cloud(cloud)
            .orgPrefix(orgPrefix)
            .project(project)
            .env(env)
            .region(region)
            .regionShortCode(regionShortCode)
            .regionMap(regionMap)
            .regionOverrides(regionOverrides)
            .recipe(recipe)
            .stylePriority(stylePriority)
            .resourceAcronyms(resourceAcronyms)
            .resourceStyleOverrides(resourceStyleOverrides)
            .ignoreRegionForRegionalResources(ignoreRegionForRegionalResources)
            .build();
    }
}
