package com.streamfirst.nomicon.application;

import com.streamfirst.nomicon.domain.CloudDefaults;
import com.streamfirst.nomicon.domain.UnsupportedCloudException;
import com.streamfirst.nomicon.ports.CloudProfilePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps normalized cloud identifiers to the profiles that supply their default tables.
 * Immutable after construction and safe to share between threads.
 */
@Slf4j
public class CloudProfileRegistry {

    public static final String DEFAULT_CLOUD = "aws";

    private final Map<String, CloudProfilePort> profiles;

    /**
     * Creates a registry over the given profiles.
     *
     * @param profiles the profiles to serve
     * @throws IllegalArgumentException if two profiles serve the same cloud
     */
    public CloudProfileRegistry(List<? extends CloudProfilePort> profiles) {
        Map<String, CloudProfilePort> byCloud = new LinkedHashMap<>();
        for (CloudProfilePort profile : profiles) {
            String cloud = normalizeCloud(profile.cloud());
            CloudProfilePort existing = byCloud.putIfAbsent(cloud, profile);
            if (existing != null) {
                throw new IllegalArgumentException(
                    "Cloud profile conflict for " + cloud + ": existing=" + existing + ", new=" + profile);
            }
        }
        this.profiles = Collections.unmodifiableMap(byCloud);
        log.info("Created cloud profile registry with clouds {}", this.profiles.keySet());
    }

    /**
     * Lowercases and trims a cloud identifier; blank input maps to {@link #DEFAULT_CLOUD}.
     */
    public static String normalizeCloud(String cloud) {
        String normalized = cloud == null ? "" : cloud.trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? DEFAULT_CLOUD : normalized;
    }

    /**
     * Checks whether a profile is registered for the cloud after normalization.
     */
    public boolean isSupportedCloud(String cloud) {
        return profiles.containsKey(normalizeCloud(cloud));
    }

    public Set<String> supportedClouds() {
        return profiles.keySet();
    }

    public Optional<CloudProfilePort> getProfile(String cloud) {
        return Optional.ofNullable(profiles.get(normalizeCloud(cloud)));
    }

    /**
     * Returns a fresh copy of the cloud's default tables.
     *
     * @param cloud the cloud identifier, normalized before lookup
     * @return default tables the caller may mutate freely
     * @throws UnsupportedCloudException if no profile serves the cloud
     * @throws com.streamfirst.nomicon.domain.ProfileDecodeException if the profile's dataset
     *     cannot be decoded
     */
    public CloudDefaults defaults(String cloud) {
        CloudProfilePort profile = getProfile(cloud)
            .orElseThrow(() -> new UnsupportedCloudException(cloud));
        return profile.defaults();
    }
}
