package com.vidnyan.codesense.adapter.out.parser;

import java.util.List;

/**
 * Python statement. Simple statements have a null keyword and carry all their tokens. Compound
 * statements carry the header tokens before the ':' (async prefix included) and their body.
 */
record PythonStatement(
        String keyword,
        boolean async,
        List<PythonToken> tokens,
        List<PythonStatement> decorators,
        List<PythonStatement> body,
        int startLine,
        int endLine
) {

    PythonStatement {
        tokens = List.copyOf(tokens);
        decorators = List.copyOf(decorators);
        body = List.copyOf(body);
    }

    static PythonStatement simple(List<PythonToken> tokens) {
        return new PythonStatement(null, false, tokens, List.of(), List.of(),
                tokens.get(0).line(), tokens.get(tokens.size() - 1).endLine());
    }

    boolean isCompound() {
        return keyword != null;
    }

    boolean is(String compoundKeyword) {
        return compoundKeyword.equals(keyword);
    }

    /** Index of the keyword token within the header, skipping an async prefix. */
    int keywordIndex() {
        return async ? 1 : 0;
    }

    PythonToken first() {
        return tokens.get(0);
    }
}
