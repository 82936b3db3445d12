package com.vidnyan.codesense.adapter.out.parser;

/**
 * Python lexical token with its source span. {@code end} is exclusive.
 */
record PythonToken(Kind kind, String text, int line, int endLine, int start, int end) {

    enum Kind {
        NAME,
        NUMBER,
        STRING,
        OP
    }

    boolean isOp(String op) {
        return kind == Kind.OP && text.equals(op);
    }

    boolean isName(String name) {
        return kind == Kind.NAME && text.equals(name);
    }

    boolean opens() {
        return kind == Kind.OP && (text.equals("(") || text.equals("[") || text.equals("{"));
    }

    boolean closes() {
        return kind == Kind.OP && (text.equals(")") || text.equals("]") || text.equals("}"));
    }
}
