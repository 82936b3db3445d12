package com.vidnyan.codesense.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A function or method extracted from source.
 * Immutable value object.
 */
@JsonPropertyOrder({"name", "start_line", "end_line", "signature", "parameters", "return_type",
        "body", "decorators", "docstring", "is_async", "is_method", "class_name"})
public record FunctionEntity(
    String name,
    @JsonProperty("start_line") int startLine,
    @JsonProperty("end_line") int endLine,
    String signature,
    List<Parameter> parameters,
    @JsonProperty("return_type") String returnType,
    String body,
    List<String> decorators,
    String docstring,
    @JsonProperty("is_async") boolean async,
    @JsonProperty("is_method") boolean method,
    @JsonProperty("class_name") String className
) {

    public FunctionEntity {
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    "end line " + endLine + " precedes start line " + startLine + " of " + name);
        }
        if (method != (className != null)) {
            throw new IllegalArgumentException("class name must be present exactly when " + name + " is a method");
        }
        parameters = List.copyOf(parameters);
        decorators = List.copyOf(decorators);
    }

    /**
     * Function parameter, in declaration order.
     */
    @JsonPropertyOrder({"name", "declared_type", "default_literal"})
    public record Parameter(
        String name,
        @JsonProperty("declared_type") String declaredType,
        @JsonProperty("default_literal") String defaultLiteral
    ) {}

    /**
     * Number of source lines covered, inclusive.
     */
    public int length() {
        return endLine - startLine + 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private int startLine;
        private int endLine;
        private String signature = "";
        private List<Parameter> parameters = List.of();
        private String returnType;
        private String body = "";
        private List<String> decorators = List.of();
        private String docstring;
        private boolean async;
        private String className;

        public Builder name(String name) { this.name = name; return this; }
        public Builder startLine(int line) { this.startLine = line; return this; }
        public Builder endLine(int line) { this.endLine = line; return this; }
        public Builder signature(String sig) { this.signature = sig; return this; }
        public Builder parameters(List<Parameter> params) { this.parameters = params; return this; }
        public Builder returnType(String type) { this.returnType = type; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder decorators(List<String> decs) { this.decorators = decs; return this; }
        public Builder docstring(String doc) { this.docstring = doc; return this; }
        public Builder async(boolean async) { this.async = async; return this; }
        public Builder className(String owner) { this.className = owner; return this; }

        public FunctionEntity build() {
            return new FunctionEntity(name, startLine, endLine, signature, parameters, returnType,
                    body, decorators, docstring, async, className != null, className);
        }
    }
}
