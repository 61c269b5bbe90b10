package com.vettriage.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vettriage.rules.RuleDefinition;

import java.util.List;

/**
 * Root of a catalog JSON document.
 */
public record CatalogDocument(
    @JsonProperty("conditions") List<ConditionDefinition> conditions,
    @JsonProperty("rules") List<RuleDefinition> rules
) {

    public List<ConditionDefinition> conditions() {
        return conditions != null ? conditions : List.of();
    }
}
