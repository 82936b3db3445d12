package com.vidnyan.codesense.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A class (or other type declaration) extracted from source.
 * Immutable value object.
 */
@JsonPropertyOrder({"name", "start_line", "end_line", "bases", "methods", "attributes", "docstring", "decorators"})
public record ClassEntity(
    String name,
    @JsonProperty("start_line") int startLine,
    @JsonProperty("end_line") int endLine,
    List<String> bases,
    List<FunctionEntity> methods,
    List<Attribute> attributes,
    String docstring,
    List<String> decorators
) {

    public ClassEntity {
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    "end line " + endLine + " precedes start line " + startLine + " of class " + name);
        }
        for (FunctionEntity method : methods) {
            if (!name.equals(method.className())) {
                throw new IllegalArgumentException(
                        "method " + method.name() + " belongs to " + method.className() + ", not " + name);
            }
        }
        bases = List.copyOf(bases);
        methods = List.copyOf(methods);
        attributes = List.copyOf(attributes);
        decorators = List.copyOf(decorators);
    }

    /**
     * Class-level attribute declaration.
     */
    @JsonPropertyOrder({"name", "declared_type", "line"})
    public record Attribute(
        String name,
        @JsonProperty("declared_type") String declaredType,
        int line
    ) {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private int startLine;
        private int endLine;
        private List<String> bases = List.of();
        private List<FunctionEntity> methods = List.of();
        private List<Attribute> attributes = List.of();
        private String docstring;
        private List<String> decorators = List.of();

        public Builder name(String name) { this.name = name; return this; }
        public Builder startLine(int line) { this.startLine = line; return this; }
        public Builder endLine(int line) { this.endLine = line; return this; }
        public Builder bases(List<String> bases) { this.bases = bases; return this; }
        public Builder methods(List<FunctionEntity> methods) { this.methods = methods; return this; }
        public Builder attributes(List<Attribute> attrs) { this.attributes = attrs; return this; }
        public Builder docstring(String doc) { this.docstring = doc; return this; }
        public Builder decorators(List<String> decs) { this.decorators = decs; return this; }

        public ClassEntity build() {
            return new ClassEntity(name, startLine, endLine, bases, methods, attributes, docstring, decorators);
        }
    }
}
