package com.streamfirst.nomicon.adapters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the Azure Cloud Adoption Framework resource definition dataset.
 *
 * @param name resource type (e.g., "azurerm_storage_account")
 * @param minLength minimum name length, 0 if unbounded
 * @param maxLength maximum name length, 0 if unbounded
 * @param validationRegex validation regex, possibly wrapped in literal double quotes
 * @param scope where the name must be unique (e.g., "global", "resourceGroup", "parent")
 * @param slug short abbreviation recommended by CAF (e.g., "st", "kv")
 * @param dashes whether dashes are allowed in the name
 * @param lowercase whether the name must be lowercase
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record AzureCafResourceDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("min_length") int minLength,
    @JsonProperty("max_length") int maxLength,
    @JsonProperty("validation_regex") String validationRegex,
    @JsonProperty("scope") String scope,
    @JsonProperty("slug") String slug,
    @JsonProperty("dashes") boolean dashes,
    @JsonProperty("lowercase") boolean lowercase) {
}
