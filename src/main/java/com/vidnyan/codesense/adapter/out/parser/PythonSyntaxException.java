package com.vidnyan.codesense.adapter.out.parser;

/**
 * Python syntax error with the 1-indexed line it was detected on.
 */
class PythonSyntaxException extends RuntimeException {

    private final int line;

    PythonSyntaxException(int line, String message) {
        super(message);
        this.line = line;
    }

    int line() {
        return line;
    }

    /**
     * Diagnostic in the form "Syntax error at line N: message".
     */
    String diagnostic() {
        return "Syntax error at line " + line + ": " + getMessage();
    }
}
