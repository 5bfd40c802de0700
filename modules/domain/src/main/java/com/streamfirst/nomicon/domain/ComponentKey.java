package com.streamfirst.nomicon.domain;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The canonical slots every component set carries, with the aliases callers may use for them.
 * Keys that match no alias pass through as free-form component names.
 */
public enum ComponentKey {
    ORG("org", "org_prefix"),
    PROJ("proj", "project"),
    ENV("env", "environment"),
    REGION("region", "region_code", "region_short_code"),
    RESOURCE("resource", "resource_type", "what"),
    QUALIFIER("qualifier", "qual");

    private static final Map<String, ComponentKey> ALIASES;

    static {
        HashMap<String, ComponentKey> aliases = new HashMap<>();
        for (ComponentKey key : values()) {
            for (String alias : key.aliases) {
                aliases.put(alias, key);
            }
        }
        ALIASES = Map.copyOf(aliases);
    }

    private final String key;
    private final List<String> aliases;

    ComponentKey(String key, String... extraAliases) {
        this.key = key;
        ArrayList<String> all = new ArrayList<>();
        all.add(key);
        all.addAll(List.of(extraAliases));
        this.aliases = List.copyOf(all);
    }

    /**
     * Returns the key under which this slot is stored in a component set.
     */
    public String key() {
        return key;
    }

    /**
     * Resolves an alias (case-insensitive, trimmed) to its canonical slot.
     */
    public static Optional<ComponentKey> fromAlias(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(alias.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Maps an alias to its canonical key; unrecognized keys come back lowercased and trimmed.
     */
    public static String canonicalize(String alias) {
        return fromAlias(alias)
            .map(ComponentKey::key)
            .orElseGet(() -> alias == null ? "" : alias.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * The recipe used when neither the configuration nor the call supplies one.
     */
    public static List<String> defaultRecipe() {
        return List.of(ORG.key, PROJ.key, ENV.key, REGION.key, RESOURCE.key, QUALIFIER.key);
    }

    @Override
    public String toString() {
        return key;
    }
}
