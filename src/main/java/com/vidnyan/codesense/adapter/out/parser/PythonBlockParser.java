package com.vidnyan.codesense.adapter.out.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Builds the statement tree from logical lines using indentation.
 *
 * Expressions are not parsed. Checks cover indentation, the ':' of compound headers, clause order
 * (elif/else/except/finally), decorators, and a dangling operator at the end of a simple statement.
 */
final class PythonBlockParser {

    private static final Set<String> COMPOUND_KEYWORDS = Set.of(
            "if", "elif", "else", "for", "while", "try", "except", "finally", "with", "def", "class");

    private static final Set<String> SOFT_KEYWORDS = Set.of("match", "case");

    private static final Set<String> ASYNC_TARGETS = Set.of("def", "for", "with");

    private static final Set<String> HEADER_ONLY = Set.of("else", "try", "finally");

    private static final Set<String> NOT_AFTER_SOFT_KEYWORD = Set.of(
            "=", ".", ":", ",", ")", "]", "}", ";", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "**=", "//=", ">>=", "<<=", "@=", ":=");

    private static final Set<String> DANGLING = Set.of(
            "=", "+", "-", "*", "/", "%", "@", "**", "//", "&", "|", "^", "<<", ">>", "<", ">", "<=", ">=",
            "==", "!=", ".", "->", ":=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "**=", "//=",
            ">>=", "<<=", "@=");

    private final List<PythonLogicalLine> lines;
    private int cursor;

    PythonBlockParser(List<PythonLogicalLine> lines) {
        this.lines = lines;
    }

    List<PythonStatement> parse() {
        if (lines.isEmpty()) {
            return List.of();
        }
        if (lines.get(0).indent() > 0) {
            throw new PythonSyntaxException(lines.get(0).startLine(), "unexpected indent");
        }
        return parseBlock(0, new ArrayDeque<>());
    }

    private List<PythonStatement> parseBlock(int indent, Deque<Integer> outer) {
        List<PythonStatement> block = new ArrayList<>();
        List<PythonStatement> decorators = new ArrayList<>();
        while (cursor < lines.size()) {
            PythonLogicalLine line = lines.get(cursor);
            if (line.indent() < indent) {
                if (!outer.contains(line.indent())) {
                    throw new PythonSyntaxException(line.startLine(),
                            "unindent does not match any outer indentation level");
                }
                break;
            }
            if (line.indent() > indent) {
                throw new PythonSyntaxException(line.startLine(), "unexpected indent");
            }
            cursor++;
            parseLine(line, indent, outer, block, decorators);
        }
        if (!decorators.isEmpty()) {
            throw new PythonSyntaxException(decorators.get(decorators.size() - 1).endLine(), "invalid syntax");
        }
        checkClauses(block);
        return block;
    }

    private void parseLine(PythonLogicalLine line, int indent, Deque<Integer> outer,
                           List<PythonStatement> block, List<PythonStatement> decorators) {
        List<PythonToken> tokens = line.tokens();
        if (tokens.get(0).isOp("@")) {
            if (tokens.size() == 1) {
                throw new PythonSyntaxException(line.startLine(), "invalid syntax");
            }
            decorators.add(PythonStatement.simple(tokens.subList(1, tokens.size())));
            return;
        }

        boolean async = tokens.get(0).isName("async") && tokens.size() > 1
                && tokens.get(1).kind() == PythonToken.Kind.NAME && ASYNC_TARGETS.contains(tokens.get(1).text());
        String keyword = compoundKeyword(tokens, async);
        if (keyword == null) {
            if (!decorators.isEmpty()) {
                throw new PythonSyntaxException(line.startLine(), "invalid syntax");
            }
            block.addAll(splitSimple(tokens));
            return;
        }

        int colon = findHeaderColon(tokens, async ? 1 : 0);
        if (colon < 0) {
            throw new PythonSyntaxException(line.endLine(), "expected ':'");
        }
        if (HEADER_ONLY.contains(keyword) && colon != 1) {
            throw new PythonSyntaxException(line.startLine(), "expected ':'");
        }
        if (!HEADER_ONLY.contains(keyword) && colon == (async ? 2 : 1) && !keyword.equals("except")) {
            throw new PythonSyntaxException(line.startLine(), "invalid syntax");
        }
        List<PythonToken> header = tokens.subList(0, colon);
        checkDefinitionHeader(keyword, header, async, line.startLine());

        List<PythonStatement> body;
        int endLine;
        if (colon < tokens.size() - 1) {
            List<PythonToken> rest = tokens.subList(colon + 1, tokens.size());
            if (compoundKeyword(rest, false) != null || rest.get(0).isOp("@")) {
                throw new PythonSyntaxException(rest.get(0).line(), "invalid syntax");
            }
            body = splitSimple(rest);
            endLine = line.endLine();
        } else {
            if (cursor >= lines.size() || lines.get(cursor).indent() <= indent) {
                int at = cursor < lines.size() ? lines.get(cursor).startLine() : line.endLine();
                throw new PythonSyntaxException(at,
                        "expected an indented block after " + describe(keyword) + " on line " + line.startLine());
            }
            outer.push(indent);
            body = parseBlock(lines.get(cursor).indent(), outer);
            outer.pop();
            endLine = body.get(body.size() - 1).endLine();
        }

        List<PythonStatement> attached = List.of();
        if (keyword.equals("def") || keyword.equals("class")) {
            attached = List.copyOf(decorators);
            decorators.clear();
        } else if (!decorators.isEmpty()) {
            throw new PythonSyntaxException(line.startLine(), "invalid syntax");
        }
        block.add(new PythonStatement(keyword, async, header, attached, body, line.startLine(), endLine));
    }

    private static String compoundKeyword(List<PythonToken> tokens, boolean async) {
        PythonToken first = tokens.get(async ? 1 : 0);
        if (first.kind() != PythonToken.Kind.NAME) {
            return null;
        }
        if (COMPOUND_KEYWORDS.contains(first.text())) {
            return first.text();
        }
        if (!async && SOFT_KEYWORDS.contains(first.text()) && tokens.size() > 2
                && !(tokens.get(1).kind() == PythonToken.Kind.OP && NOT_AFTER_SOFT_KEYWORD.contains(tokens.get(1).text()))
                && findHeaderColon(tokens, 0) > 0) {
            return first.text();
        }
        return null;
    }

    /**
     * Index of the ':' that ends a compound header, ignoring colons inside brackets and lambdas.
     */
    private static int findHeaderColon(List<PythonToken> tokens, int from) {
        int depth = 0;
        int lambdas = 0;
        for (int i = from; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (token.opens()) {
                depth++;
            } else if (token.closes()) {
                depth--;
            } else if (depth == 0 && token.isName("lambda")) {
                lambdas++;
            } else if (depth == 0 && token.isOp(":")) {
                if (lambdas == 0) {
                    return i;
                }
                lambdas--;
            }
        }
        return -1;
    }

    private static void checkDefinitionHeader(String keyword, List<PythonToken> header, boolean async, int line) {
        int k = async ? 1 : 0;
        if (keyword.equals("def")) {
            int open = header.size() > k + 1 && header.get(k + 1).kind() == PythonToken.Kind.NAME
                    ? skipTypeParameters(header, k + 2) : -1;
            boolean valid = open > 0 && open < header.size()
                    && header.get(open).isOp("(")
                    && closingIndex(header, open) > 0;
            if (valid) {
                int close = closingIndex(header, open);
                valid = close == header.size() - 1
                        || (header.get(close + 1).isOp("->") && close + 2 < header.size());
            }
            if (!valid) {
                throw new PythonSyntaxException(line, "invalid syntax");
            }
        } else if (keyword.equals("class")) {
            int open = header.size() >= 2 && header.get(1).kind() == PythonToken.Kind.NAME
                    ? skipTypeParameters(header, 2) : -1;
            boolean valid = open > 0
                    && (open == header.size()
                    || (header.get(open).isOp("(") && closingIndex(header, open) == header.size() - 1));
            if (!valid) {
                throw new PythonSyntaxException(line, "invalid syntax");
            }
        }
    }

    /**
     * Index just past a {@code [T, ...]} type parameter list at {@code index}, {@code index} itself when
     * there is none, or -1 when the list never closes.
     */
    static int skipTypeParameters(List<PythonToken> header, int index) {
        if (index >= header.size() || !header.get(index).isOp("[")) {
            return index;
        }
        int close = closingIndex(header, index);
        return close < 0 ? -1 : close + 1;
    }

    /**
     * Index of the bracket closing the one at {@code open}, or -1.
     */
    static int closingIndex(List<PythonToken> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            if (tokens.get(i).opens()) {
                depth++;
            } else if (tokens.get(i).closes() && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static List<PythonStatement> splitSimple(List<PythonToken> tokens) {
        List<PythonStatement> statements = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= tokens.size(); i++) {
            if (i == tokens.size() || tokens.get(i).isOp(";")) {
                if (i > start) {
                    List<PythonToken> part = tokens.subList(start, i);
                    PythonToken last = part.get(part.size() - 1);
                    if (last.kind() == PythonToken.Kind.OP && DANGLING.contains(last.text())) {
                        throw new PythonSyntaxException(last.line(), "invalid syntax");
                    }
                    statements.add(PythonStatement.simple(part));
                } else if (i < tokens.size()) {
                    throw new PythonSyntaxException(tokens.get(i).line(), "invalid syntax");
                }
                start = i + 1;
            }
        }
        return statements;
    }

    private static String describe(String keyword) {
        return switch (keyword) {
            case "def" -> "function definition";
            case "class" -> "class definition";
            default -> "'" + keyword + "' statement";
        };
    }

    /**
     * Clause order: elif follows if/elif; else follows if/elif, a loop, or an except; except follows try
     * or except; finally ends a try; a try needs at least one except or finally.
     */
    private static void checkClauses(List<PythonStatement> block) {
        Chain open = Chain.NONE;
        for (PythonStatement statement : block) {
            String keyword = statement.keyword() == null ? "" : statement.keyword();
            switch (keyword) {
                case "elif" -> {
                    if (open != Chain.IF) {
                        throw new PythonSyntaxException(statement.startLine(), "invalid syntax");
                    }
                }
                case "else" -> {
                    if (open == Chain.IF || open == Chain.LOOP) {
                        open = Chain.NONE;
                    } else if (open == Chain.HANDLED) {
                        open = Chain.TRY_ELSE;
                    } else {
                        throw new PythonSyntaxException(statement.startLine(), "invalid syntax");
                    }
                }
                case "except" -> {
                    if (open != Chain.TRY && open != Chain.HANDLED) {
                        throw new PythonSyntaxException(statement.startLine(), "invalid syntax");
                    }
                    open = Chain.HANDLED;
                }
                case "finally" -> {
                    if (open != Chain.TRY && open != Chain.HANDLED && open != Chain.TRY_ELSE) {
                        throw new PythonSyntaxException(statement.startLine(), "invalid syntax");
                    }
                    open = Chain.NONE;
                }
                default -> {
                    if (open == Chain.TRY) {
                        throw new PythonSyntaxException(statement.startLine(), "expected 'except' or 'finally' block");
                    }
                    open = switch (keyword) {
                        case "if" -> Chain.IF;
                        case "for", "while" -> Chain.LOOP;
                        case "try" -> Chain.TRY;
                        default -> Chain.NONE;
                    };
                }
            }
        }
        if (open == Chain.TRY) {
            PythonStatement last = block.get(block.size() - 1);
            throw new PythonSyntaxException(last.endLine(), "expected 'except' or 'finally' block");
        }
    }

    private enum Chain {
        NONE,
        IF,
        LOOP,
        TRY,
        HANDLED,
        TRY_ELSE
    }
}
