package com.vidnyan.codesense.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Module-level variable assignment.
 */
@JsonPropertyOrder({"name", "line", "value_repr"})
public record GlobalVariable(
    String name,
    int line,
    @JsonProperty("value_repr") String valueRepr
) {}
