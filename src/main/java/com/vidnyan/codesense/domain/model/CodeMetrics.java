package com.vidnyan.codesense.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Size and shape statistics of one snippet.
 * {@code codeLines + blankLines + commentLines == totalLines} always holds.
 */
@JsonPropertyOrder({"total_lines", "code_lines", "blank_lines", "comment_lines", "functions_count",
        "classes_count", "imports_count", "complexity_score", "avg_function_length"})
public record CodeMetrics(
    @JsonProperty("total_lines") int totalLines,
    @JsonProperty("code_lines") int codeLines,
    @JsonProperty("blank_lines") int blankLines,
    @JsonProperty("comment_lines") int commentLines,
    @JsonProperty("functions_count") int functionCount,
    @JsonProperty("classes_count") int classCount,
    @JsonProperty("imports_count") int importCount,
    @JsonProperty("complexity_score") double complexityScore,
    @JsonProperty("avg_function_length") double averageFunctionLength
) {}
