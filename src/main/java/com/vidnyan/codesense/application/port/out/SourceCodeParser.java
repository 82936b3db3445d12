package com.vidnyan.codesense.application.port.out;

import com.vidnyan.codesense.domain.model.ParseResult;

/**
 * Port for extracting the structural model of source code.
 * Implementations never throw for malformed code; problems are reported in {@link ParseResult#errors()}.
 */
public interface SourceCodeParser {

    /**
     * Parse a snippet in the declared language.
     * @param code source text, may be empty
     * @param language language tag, e.g. "python"; unknown tags degrade to heuristic analysis
     */
    ParseResult parse(String code, String language);
}
