package com.vidnyan.codesense.adapter.out.parser;

import java.util.List;

/**
 * One logical line: physical lines joined by open brackets, backslashes or multi-line strings.
 * {@code indent} is the column width of the first physical line, tabs expanded to multiples of 8.
 */
record PythonLogicalLine(int indent, int startLine, int endLine, List<PythonToken> tokens) {

    PythonLogicalLine {
        tokens = List.copyOf(tokens);
    }
}
