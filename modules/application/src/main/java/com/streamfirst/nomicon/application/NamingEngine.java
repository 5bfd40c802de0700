package com.streamfirst.nomicon.application;

import com.streamfirst.nomicon.domain.BuildInput;
import com.streamfirst.nomicon.domain.BuildResult;
import com.streamfirst.nomicon.domain.CloudDefaults;
import com.streamfirst.nomicon.domain.ComponentKey;
import com.streamfirst.nomicon.domain.NamingConfig;
import com.streamfirst.nomicon.domain.NamingException;
import com.streamfirst.nomicon.domain.NamingStyle;
import com.streamfirst.nomicon.domain.ResourceConstraint;
import com.streamfirst.nomicon.domain.Result;
import com.streamfirst.nomicon.domain.UnsupportedStyleException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds standardized resource names from a deployment configuration and a per-call input.
 *
 * <p>Resolution order: cloud defaults fill empty tables, the region code and resource acronym are
 * resolved, canonical components are seeded, the region is suppressed for regional resources if
 * configured, overrides are applied, the recipe selects the parts, a style is chosen, and the
 * formatted name is validated. Stateless apart from the read-only registry; safe to call
 * concurrently.
 */
@Slf4j
@RequiredArgsConstructor
public class NamingEngine {

    private final CloudProfileRegistry registry;

    /**
     * Builds and validates a name.
     *
     * @param config the deployment configuration
     * @param input the per-call input
     * @return the name together with everything that was resolved to produce it
     * @throws com.streamfirst.nomicon.domain.UnsupportedCloudException if defaults are needed
     *     for an unregistered cloud
     * @throws com.streamfirst.nomicon.domain.ProfileDecodeException if the cloud's derived
     *     dataset cannot be decoded
     * @throws UnsupportedStyleException if no style allowed for the resource can be chosen
     * @throws com.streamfirst.nomicon.domain.ConstraintViolationException if the finished name
     *     breaks a constraint
     */
    public BuildResult buildName(@NonNull NamingConfig config, @NonNull BuildInput input) {
        Tables tables = resolveTables(config);

        String regionCode = resolveRegionCode(config, tables.regionMap());
        String resourceKey = input.getResource().trim().toLowerCase(Locale.ROOT);
        String resourceAcronym = resolveAcronym(input.getResource(), resourceKey, tables.acronyms());
        log.debug("Resolved region code '{}' and acronym '{}' for resource '{}'", regionCode, resourceAcronym, resourceKey);

        Map<String, String> components = new LinkedHashMap<>();
        components.put(ComponentKey.ORG.key(), config.getOrgPrefix().trim());
        components.put(ComponentKey.PROJ.key(), config.getProject().trim());
        components.put(ComponentKey.ENV.key(), config.getEnv().trim());
        components.put(ComponentKey.REGION.key(), regionCode);
        components.put(ComponentKey.RESOURCE.key(), resourceAcronym);
        components.put(ComponentKey.QUALIFIER.key(), input.getQualifier().trim());

        if (config.isIgnoreRegionForRegionalResources()
                && !resourceKey.isEmpty()
                && tables.regionalResources().contains(resourceKey)) {
            log.debug("Suppressing region for regional resource '{}'", resourceKey);
            components.put(ComponentKey.REGION.key(), "");
        }

        applyOverrides(components, input.getOverrides());

        List<String> parts = assembleParts(components, effective(input.getRecipe(), config.getRecipe(),
            ComponentKey.defaultRecipe()));

        NamingStyle style = chooseStyle(resourceKey,
            effective(input.getStylePriority(), config.getStylePriority(), NamingStyle.defaultPriority()),
            tables.styleOverrides());

        String name = NameFormatter.format(style, parts);
        ConstraintValidator.validate(resourceKey, name, tables.constraints());
        log.debug("Built name '{}' in style {} from parts {}", name, style, parts);

        return BuildResult.builder()
            .name(name)
            .style(style)
            .components(Collections.unmodifiableMap(components))
            .parts(List.copyOf(parts))
            .regionCode(components.get(ComponentKey.REGION.key()))
            .resourceAcronym(components.get(ComponentKey.RESOURCE.key()))
            .build();
    }

    /**
     * Builds a name, reporting any engine failure as a {@link Result} whose message is the
     * exception's message unchanged.
     */
    public Result<BuildResult> tryBuildName(@NonNull NamingConfig config, @NonNull BuildInput input) {
        try {
            return Result.success(buildName(config, input));
        } catch (NamingException e) {
            log.debug("Name build failed with {}: {}", e.errorCode(), e.getMessage());
            return Result.failure(e);
        }
    }

    /** Takes each table from the configuration, or from the cloud's defaults when it is empty. */
    private Tables resolveTables(NamingConfig config) {
        boolean needsDefaults = config.getRegionMap().isEmpty()
            || config.getResourceAcronyms().isEmpty()
            || config.getResourceStyleOverrides().isEmpty()
            || config.getResourceConstraints().isEmpty()
            || config.getRegionalResources().isEmpty();
        if (!needsDefaults) {
            return new Tables(config.getRegionMap(), config.getResourceAcronyms(), config.getResourceStyleOverrides(),
                config.getResourceConstraints(), config.getRegionalResources());
        }

        CloudDefaults defaults = registry.defaults(config.getCloud());
        return new Tables(
            orDefault(config.getRegionMap(), defaults.getRegionMap()),
            orDefault(config.getResourceAcronyms(), defaults.getResourceAcronyms()),
            orDefault(config.getResourceStyleOverrides(), defaults.getResourceStyleOverrides()),
            orDefault(config.getResourceConstraints(), defaults.getResourceConstraints()),
            config.getRegionalResources().isEmpty() ? defaults.getRegionalResources() : config.getRegionalResources());
    }

    private static <K, V> Map<K, V> orDefault(Map<K, V> configured, Map<K, V> fallback) {
        return configured.isEmpty() ? fallback : configured;
    }

    private static String resolveRegionCode(NamingConfig config, Map<String, String> regionMap) {
        String regionCode = config.getRegionShortCode().trim();
        String region = config.getRegion().trim();
        if (regionCode.isEmpty() && !region.isEmpty()) {
            String mapped = regionMap.get(region);
            regionCode = mapped == null ? "" : mapped.trim();
            if (regionCode.isEmpty()) {
                regionCode = region;
            }
        }
        return regionCode;
    }

    private static String resolveAcronym(String resource, String resourceKey, Map<String, String> acronyms) {
        String literal = resource.trim();
        if (resourceKey.isEmpty()) {
            return literal;
        }
        String acronym = acronyms.get(resourceKey);
        return acronym == null || acronym.isEmpty() ? literal : acronym.trim();
    }

    /**
     * Overrides on a canonical key (or alias) replace that component; any other key becomes a
     * free-form component under its trimmed spelling.
     */
    private static void applyOverrides(Map<String, String> components, Map<String, String> overrides) {
        for (Map.Entry<String, String> override : overrides.entrySet()) {
            String key = override.getKey() == null ? "" : override.getKey().trim();
            if (key.isEmpty()) {
                continue;
            }
            String value = override.getValue() == null ? "" : override.getValue().trim();
            String canonical = ComponentKey.canonicalize(key);
            if (components.containsKey(canonical)) {
                components.put(canonical, value);
            } else {
                components.put(key, value);
            }
        }
    }

    private static List<String> assembleParts(Map<String, String> components, List<String> recipe) {
        List<String> parts = new ArrayList<>(recipe.size());
        for (String entry : recipe) {
            String item = entry == null ? "" : entry.trim();
            if (item.isEmpty()) {
                continue;
            }
            String canonical = ComponentKey.canonicalize(item);
            String value = components.containsKey(canonical) ? components.get(canonical) : components.get(item);
            if (value == null || value.trim().isEmpty()) {
                continue;
            }
            parts.add(value);
        }
        return parts;
    }

    /**
     * Picks the first known style in priority order that the resource allows. Falls back to
     * dashed, which must itself be allowed.
     */
    private static NamingStyle chooseStyle(
            String resourceKey, List<String> priority, Map<String, List<String>> styleOverrides) {
        List<String> allowed = resourceKey.isEmpty()
            ? List.of()
            : normalizeStyles(styleOverrides.get(resourceKey));

        for (String candidate : priority) {
            Optional<NamingStyle> style = NamingStyle.fromWireName(candidate);
            if (style.isEmpty()) {
                log.warn("Skipping unknown style '{}' in style priority", candidate);
                continue;
            }
            if (!allowed.isEmpty() && !allowed.contains(style.get().wireName())) {
                continue;
            }
            return style.get();
        }

        if (!allowed.isEmpty() && !allowed.contains(NamingStyle.DASHED.wireName())) {
            throw new UnsupportedStyleException(String.format(
                "no style in priority %s is allowed for resource \"%s\" (allowed: %s)", priority, resourceKey, allowed));
        }
        return NamingStyle.DASHED;
    }

    private static List<String> normalizeStyles(List<String> styles) {
        if (styles == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>(styles.size());
        for (String style : styles) {
            String normalized = NamingStyle.normalize(style);
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return out;
    }

    private static List<String> effective(List<String> callLevel, List<String> configured, List<String> fallback) {
        if (!callLevel.isEmpty()) {
            return callLevel;
        }
        return configured.isEmpty() ? fallback : configured;
    }

    /** The five tables after the defaults fallback */
    private record Tables(
        Map<String, String> regionMap,
        Map<String, String> acronyms,
        Map<String, List<String>> styleOverrides,
        Map<String, ResourceConstraint> constraints,
        Set<String> regionalResources) {
    }
}
