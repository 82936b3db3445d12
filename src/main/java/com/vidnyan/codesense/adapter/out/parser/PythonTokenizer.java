package com.vidnyan.codesense.adapter.out.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Splits Python source into logical lines of tokens.
 * Comments and blank lines are dropped. Lexical errors raise {@link PythonSyntaxException}.
 */
final class PythonTokenizer {

    private static final List<String> OPERATORS = List.of(
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", ">>", "<<", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=");

    private static final String SINGLE_OPERATORS = "+-*/%@&|^~<>()[]{},:.;=";

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private static final Map<String, String> CLOSERS = Map.of("(", ")", "[", "]", "{", "}");

    private static final int TAB_SIZE = 8;

    private final String code;
    private final List<PythonLogicalLine> lines = new ArrayList<>();
    private final Deque<PythonToken> brackets = new ArrayDeque<>();

    private List<PythonToken> current = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int currentIndent;
    private int currentStartLine;
    private boolean atLineStart = true;

    PythonTokenizer(String code) {
        this.code = code;
    }

    List<PythonLogicalLine> tokenize() {
        while (pos < code.length()) {
            if (atLineStart) {
                readIndentation();
                continue;
            }
            char c = code.charAt(pos);
            if (c == '\n' || c == '\r') {
                consumeNewline();
                endPhysicalLine();
            } else if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                readContinuation();
            } else if (isIdentifierStart(code.codePointAt(pos))) {
                readName();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < code.length()
                    && Character.isDigit(code.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '"' || c == '\'') {
                readString(pos);
            } else {
                readOperator();
            }
        }
        if (!brackets.isEmpty()) {
            PythonToken open = brackets.peek();
            throw new PythonSyntaxException(open.line(), "'" + open.text() + "' was never closed");
        }
        flushLogicalLine();
        return lines;
    }

    private void readIndentation() {
        int indent = 0;
        while (pos < code.length()) {
            char c = code.charAt(pos);
            if (c == ' ') {
                indent++;
            } else if (c == '\t') {
                indent = (indent / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                indent = 0;
            } else {
                break;
            }
            pos++;
        }
        if (pos >= code.length()) {
            return;
        }
        char c = code.charAt(pos);
        if (c == '#') {
            skipComment();
        }
        if (pos < code.length() && (code.charAt(pos) == '\n' || code.charAt(pos) == '\r')) {
            // blank or comment-only line
            consumeNewline();
            line++;
            return;
        }
        if (pos >= code.length()) {
            return;
        }
        atLineStart = false;
        currentIndent = indent;
        currentStartLine = line;
    }

    private void consumeNewline() {
        if (code.charAt(pos) == '\r' && pos + 1 < code.length() && code.charAt(pos + 1) == '\n') {
            pos++;
        }
        pos++;
    }

    private void endPhysicalLine() {
        line++;
        if (brackets.isEmpty()) {
            flushLogicalLine();
            atLineStart = true;
        }
    }

    private void flushLogicalLine() {
        if (current.isEmpty()) {
            return;
        }
        PythonToken last = current.get(current.size() - 1);
        lines.add(new PythonLogicalLine(currentIndent, currentStartLine, last.endLine(), current));
        current = new ArrayList<>();
    }

    private void skipComment() {
        while (pos < code.length() && code.charAt(pos) != '\n' && code.charAt(pos) != '\r') {
            pos++;
        }
    }

    private void readContinuation() {
        int next = pos + 1;
        if (next < code.length() && (code.charAt(next) == '\n' || code.charAt(next) == '\r')) {
            pos = next;
            consumeNewline();
            line++;
            return;
        }
        if (next >= code.length()) {
            throw new PythonSyntaxException(line, "unexpected EOF while parsing");
        }
        throw new PythonSyntaxException(line, "unexpected character after line continuation character");
    }

    private void readName() {
        int start = pos;
        pos += Character.charCount(code.codePointAt(pos));
        while (pos < code.length() && isIdentifierPart(code.codePointAt(pos))) {
            pos += Character.charCount(code.codePointAt(pos));
        }
        String name = code.substring(start, pos);
        if (pos < code.length() && (code.charAt(pos) == '"' || code.charAt(pos) == '\'')
                && STRING_PREFIXES.contains(name.toLowerCase(Locale.ROOT))) {
            readString(start);
            return;
        }
        add(PythonToken.Kind.NAME, start, line);
    }

    private void readNumber() {
        int start = pos;
        boolean hex = code.startsWith("0x", pos) || code.startsWith("0X", pos);
        pos++;
        while (pos < code.length()) {
            char c = code.charAt(pos);
            char prev = code.charAt(pos - 1);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else if ((c == '+' || c == '-') && !hex && (prev == 'e' || prev == 'E')) {
                pos++;
            } else {
                break;
            }
        }
        add(PythonToken.Kind.NUMBER, start, line);
    }

    /**
     * Read a string literal whose prefix (if any) starts at {@code start}; {@code pos} is at the quote.
     */
    private void readString(int start) {
        int startLine = line;
        char quote = code.charAt(pos);
        boolean triple = code.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;
        while (true) {
            if (pos >= code.length()) {
                if (triple) {
                    throw new PythonSyntaxException(startLine,
                            "unterminated triple-quoted string literal (detected at line " + line + ")");
                }
                throw new PythonSyntaxException(line, "unterminated string literal (detected at line " + line + ")");
            }
            char c = code.charAt(pos);
            if (c == '\\') {
                if (code.startsWith("\r\n", pos + 1)) {
                    line++;
                    pos += 3;
                } else {
                    if (pos + 1 < code.length() && code.charAt(pos + 1) == '\n') {
                        line++;
                    }
                    pos += 2;
                }
            } else if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw new PythonSyntaxException(line, "unterminated string literal (detected at line " + line + ")");
                }
                if (c == '\n') {
                    line++;
                }
                pos++;
            } else if (c == quote && (!triple || code.startsWith(String.valueOf(quote).repeat(3), pos))) {
                pos += triple ? 3 : 1;
                break;
            } else {
                pos++;
            }
        }
        pos = Math.min(pos, code.length());
        add(PythonToken.Kind.STRING, start, startLine);
    }

    private void readOperator() {
        int start = pos;
        for (String op : OPERATORS) {
            if (code.startsWith(op, pos)) {
                pos += op.length();
                add(PythonToken.Kind.OP, start, line);
                return;
            }
        }
        char c = code.charAt(pos);
        if (SINGLE_OPERATORS.indexOf(c) < 0) {
            if (c < 128) {
                throw new PythonSyntaxException(line, "invalid syntax");
            }
            int codePoint = code.codePointAt(pos);
            throw new PythonSyntaxException(line, "invalid character '" + new String(Character.toChars(codePoint))
                    + "' (U+" + String.format("%04X", codePoint) + ")");
        }
        pos++;
        PythonToken token = add(PythonToken.Kind.OP, start, line);
        if (token.opens()) {
            brackets.push(token);
        } else if (token.closes()) {
            if (brackets.isEmpty()) {
                throw new PythonSyntaxException(line, "unmatched '" + token.text() + "'");
            }
            PythonToken open = brackets.pop();
            if (!CLOSERS.get(open.text()).equals(token.text())) {
                throw new PythonSyntaxException(line, "closing parenthesis '" + token.text()
                        + "' does not match opening parenthesis '" + open.text() + "'");
            }
        }
    }

    private PythonToken add(PythonToken.Kind kind, int start, int startLine) {
        PythonToken token = new PythonToken(kind, code.substring(start, pos), startLine, line, start, pos);
        current.add(token);
        return token;
    }

    private static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || Character.isLetter(codePoint)
                || (codePoint > 127 && Character.isUnicodeIdentifierStart(codePoint));
    }

    private static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || Character.isLetterOrDigit(codePoint)
                || (codePoint > 127 && Character.isUnicodeIdentifierPart(codePoint));
    }
}
