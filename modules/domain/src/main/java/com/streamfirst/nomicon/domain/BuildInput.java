package com.streamfirst.nomicon.domain;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Per-call parameters for building one name.
 *
 * <p>Overrides are applied in iteration order after all default resolution, so they win over
 * every other source for the component they name. A non-empty recipe or style priority replaces
 * the configuration's list outright.
 */
@Value
public class BuildInput {

    /** Resource type identifier (e.g., "s3_bucket", "azurerm_storage_account") */
    String resource;

    String qualifier;

    /** Component key (or alias) to literal value */
    Map<String, String> overrides;

    List<String> recipe;

    List<String> stylePriority;

    @Builder(toBuilder = true)
    private BuildInput(
            String resource,
            String qualifier,
            Map<String, String> overrides,
            List<String> recipe,
            List<String> stylePriority) {
        this.resource = NamingConfig.nullToEmpty(resource);
        this.qualifier = NamingConfig.nullToEmpty(qualifier);
        this.overrides = NamingConfig.readOnly(overrides);
        this.recipe = NamingConfig.readOnly(recipe);
        this.stylePriority = NamingConfig.readOnly(stylePriority);
    }

    /**
     * Shorthand for an input with only a resource type and qualifier.
     */
    public static BuildInput of(String resource, String qualifier) {
        return builder().resource(resource).qualifier(qualifier).build();
    }
}
