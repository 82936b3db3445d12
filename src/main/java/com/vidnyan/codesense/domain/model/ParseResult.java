package com.vidnyan.codesense.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Structural model of one source snippet.
 * A non-empty error list means extraction was degraded, not necessarily failed.
 */
@JsonPropertyOrder({"language", "functions", "classes", "imports", "global_variables", "errors", "complexity_score"})
public record ParseResult(
    String language,
    List<FunctionEntity> functions,
    List<ClassEntity> classes,
    List<String> imports,
    @JsonProperty("global_variables") List<GlobalVariable> globalVariables,
    List<String> errors,
    @JsonProperty("complexity_score") double complexityScore
) {

    public static final double MAX_COMPLEXITY = 100.0;

    public ParseResult {
        if (complexityScore < 0 || complexityScore > MAX_COMPLEXITY) {
            throw new IllegalArgumentException("complexity score out of range: " + complexityScore);
        }
        functions = List.copyOf(functions);
        classes = List.copyOf(classes);
        imports = List.copyOf(imports);
        globalVariables = List.copyOf(globalVariables);
        errors = List.copyOf(errors);
    }

    /**
     * Result carrying diagnostics only: no structure, complexity as given.
     */
    public static ParseResult degraded(String language, List<String> errors, double complexityScore) {
        return new ParseResult(language, List.of(), List.of(), List.of(), List.of(), errors, complexityScore);
    }

    @JsonIgnore
    public boolean isDegraded() {
        return !errors.isEmpty();
    }
}
