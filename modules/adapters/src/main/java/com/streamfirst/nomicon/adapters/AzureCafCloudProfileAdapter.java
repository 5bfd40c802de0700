package com.streamfirst.nomicon.adapters;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.nomicon.domain.CloudDefaults;
import com.streamfirst.nomicon.domain.NamingStyle;
import com.streamfirst.nomicon.domain.ProfileDecodeException;
import com.streamfirst.nomicon.domain.ResourceConstraint;
import com.streamfirst.nomicon.ports.CloudProfilePort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Azure profile derived from the Cloud Adoption Framework resource definitions shipped on the
 * classpath. The dataset is decoded on first use only; the outcome, success or failure, is kept
 * for the lifetime of the adapter and every caller receives its own copy of the tables.
 */
@Slf4j
public class AzureCafCloudProfileAdapter implements CloudProfilePort {

    public static final String CLOUD = "azure";
    public static final String DEFAULT_DATASET = "azure_caf_resource_definition.json";

    private static final int ACRONYM_LENGTH = 4;
    private static final char ACRONYM_FILLER = 'x';
    private static final Set<String> REGIONAL_SCOPES =
        Set.of("resourcegroup", "resource-group", "region", "location", "parent");

    private final String datasetResource;
    private final ObjectMapper objectMapper;
    private final Object lock = new Object();

    private volatile Outcome outcome;

    public AzureCafCloudProfileAdapter() {
        this(DEFAULT_DATASET);
    }

    /**
     * @param datasetResource classpath location of the JSON dataset
     */
    public AzureCafCloudProfileAdapter(String datasetResource) {
        this.datasetResource = datasetResource;
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String cloud() {
        return CLOUD;
    }

    @Override
    public CloudDefaults defaults() {
        Outcome current = outcome;
        if (current == null) {
            synchronized (lock) {
                current = outcome;
                if (current == null) {
                    current = derive();
                    outcome = current;
                }
            }
        }
        if (current.failure() != null) {
            throw new ProfileDecodeException(current.failure().getMessage(), current.failure().getCause());
        }
        return current.defaults().copy();
    }

    private Outcome derive() {
        try {
            return new Outcome(tables(readDefinitions()), null);
        } catch (IOException | RuntimeException e) {
            ProfileDecodeException failure =
                new ProfileDecodeException("decode Azure CAF resource definitions: " + e.getMessage(), e);
            log.error("Failed to decode Azure CAF dataset {}", datasetResource, e);
            return new Outcome(null, failure);
        }
    }

    private static CloudDefaults tables(List<AzureCafResourceDefinition> definitions) {
        Map<String, String> acronyms = new HashMap<>();
        Map<String, List<String>> styleOverrides = new HashMap<>();
        Map<String, ResourceConstraint> constraints = new HashMap<>();
        Set<String> regionalResources = new HashSet<>();

        for (AzureCafResourceDefinition definition : definitions) {
            // JSON null elements carry no name
            if (definition == null) {
                continue;
            }
            String name = definition.name() == null ? "" : definition.name().trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            acronyms.put(name, acronym(definition.slug(), definition.name()));
            styleOverrides.put(name, allowedStyles(definition.lowercase(), definition.dashes()));
            if (isRegionalScope(definition.scope())) {
                regionalResources.add(name);
            }
            constraints.put(name, constraint(definition));
        }

        log.info("Derived Azure CAF profile from {} resource definitions", acronyms.size());
        return CloudDefaults.builder()
            .regionMap(new HashMap<>())
            .resourceAcronyms(acronyms)
            .resourceStyleOverrides(styleOverrides)
            .resourceConstraints(constraints)
            .regionalResources(regionalResources)
            .build()
            .unmodifiable();
    }

    private List<AzureCafResourceDefinition> readDefinitions() throws IOException {
        ClassLoader loader = AzureCafCloudProfileAdapter.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(datasetResource)) {
            if (in == null) {
                throw new IOException("resource not found: " + datasetResource);
            }
            List<AzureCafResourceDefinition> definitions =
                objectMapper.readValue(in, new TypeReference<List<AzureCafResourceDefinition>>() {});
            return definitions == null ? List.of() : definitions;
        }
    }

    /**
     * Derives a four-character acronym: the alphanumeric slug, padded from the resource name and
     * then with {@code x}.
     */
    static String acronym(String slug, String name) {
        StringBuilder base = new StringBuilder(toLowerAlnum(slug));
        String fallback = toLowerAlnum(name);
        int next = 0;
        while (base.length() < ACRONYM_LENGTH && next < fallback.length()) {
            base.append(fallback.charAt(next++));
        }
        while (base.length() < ACRONYM_LENGTH) {
            base.append(ACRONYM_FILLER);
        }
        return base.substring(0, ACRONYM_LENGTH);
    }

    static List<String> allowedStyles(boolean lowercase, boolean dashes) {
        List<String> styles = new ArrayList<>();
        if (lowercase) {
            if (dashes) {
                styles.add(NamingStyle.DASHED.wireName());
            }
            styles.add(NamingStyle.STRAIGHT.wireName());
            return styles;
        }
        if (dashes) {
            styles.add(NamingStyle.DASHED.wireName());
            styles.add(NamingStyle.PASCAL_DASHED.wireName());
        }
        styles.add(NamingStyle.PASCAL.wireName());
        styles.add(NamingStyle.CAMEL.wireName());
        styles.add(NamingStyle.STRAIGHT.wireName());
        return styles;
    }

    static boolean isRegionalScope(String scope) {
        return scope != null && REGIONAL_SCOPES.contains(scope.trim().toLowerCase(Locale.ROOT));
    }

    static ResourceConstraint constraint(AzureCafResourceDefinition definition) {
        ResourceConstraint.ResourceConstraintBuilder constraint = ResourceConstraint.builder()
            .minLength(definition.minLength())
            .maxLength(definition.maxLength());

        String regex = stripQuotes(definition.validationRegex() == null ? "" : definition.validationRegex().trim());
        if (regex.isEmpty()) {
            return constraint.build();
        }

        constraint.patternDescription(String.format("must match Azure CAF regex \"%s\"", regex));
        try {
            constraint.pattern(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            // Length bounds still apply without the pattern.
            log.warn("Ignoring uncompilable regex for {}: {}", definition.name(), e.getDescription());
        }
        return constraint.build();
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }

    private static String toLowerAlnum(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                out.append(Character.toLowerCase(c));
            }
        }
        return out.toString();
    }

    /** Either the derived tables or the decode failure, never both */
    private record Outcome(CloudDefaults defaults, ProfileDecodeException failure) {
    }
}
