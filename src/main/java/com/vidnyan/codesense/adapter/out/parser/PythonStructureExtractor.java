package com.vidnyan.codesense.adapter.out.parser;

import com.vidnyan.codesense.domain.model.ClassEntity;
import com.vidnyan.codesense.domain.model.FunctionEntity;
import com.vidnyan.codesense.domain.model.GlobalVariable;
import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.model.SourceLanguage;
import com.vidnyan.codesense.domain.model.SourceText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tree-based extractor for Python.
 *
 * Source is tokenized into logical lines, grouped into an indentation tree and walked. Top-level
 * functions go to {@code functions}, classes (nested classes after their owner, depth-first) to
 * {@code classes}, and every import statement in the file to {@code imports} in source order.
 */
@Slf4j
@Component
public class PythonStructureExtractor implements StructureExtractor {

    private static final String LANGUAGE = "python";

    private static final Set<String> BRANCHES = Set.of("if", "elif", "for", "while", "except");

    @Override
    public ParseResult extract(String code, SourceLanguage language) {
        List<PythonStatement> module;
        try {
            List<PythonLogicalLine> logicalLines = new PythonTokenizer(code).tokenize();
            module = new PythonBlockParser(logicalLines).parse();
        } catch (PythonSyntaxException e) {
            log.debug("Python syntax error at line {}: {}", e.line(), e.getMessage());
            return ParseResult.degraded(LANGUAGE, List.of(e.diagnostic()), 0.0);
        }

        Walk walk = new Walk(code);
        List<FunctionEntity> functions = new ArrayList<>();
        List<ClassEntity> classes = new ArrayList<>();
        List<GlobalVariable> globals = new ArrayList<>();
        for (PythonStatement statement : module) {
            if (statement.is("def")) {
                functions.add(walk.function(statement, null));
            } else if (statement.is("class")) {
                walk.classes(statement, classes);
            } else if (!statement.isCompound()) {
                walk.globals(statement, globals);
            }
        }
        List<String> imports = new ArrayList<>();
        walk.imports(module, imports);

        return new ParseResult(LANGUAGE, functions, classes, imports, globals, List.of(), complexity(module));
    }

    /**
     * 1 + one per if/elif/for/while/except + one per and/or, scaled by 5 and capped at 100.
     */
    static double complexity(List<PythonStatement> module) {
        int[] raw = {1};
        countBranches(module, raw);
        return Math.min(ParseResult.MAX_COMPLEXITY, raw[0] * 5.0);
    }

    private static void countBranches(List<PythonStatement> statements, int[] raw) {
        for (PythonStatement statement : statements) {
            if (statement.isCompound() && BRANCHES.contains(statement.keyword())) {
                raw[0]++;
            }
            for (PythonToken token : statement.tokens()) {
                if (token.isName("and") || token.isName("or")) {
                    raw[0]++;
                }
            }
            countBranches(statement.decorators(), raw);
            countBranches(statement.body(), raw);
        }
    }

    /**
     * Tree walk over one source text.
     */
    private static final class Walk {

        private final String code;
        private final List<String> lines;

        Walk(String code) {
            this.code = code;
            this.lines = SourceText.lines(code);
        }

        FunctionEntity function(PythonStatement statement, String className) {
            List<PythonToken> header = statement.tokens();
            int k = statement.keywordIndex();
            String name = header.get(k + 1).text();
            int open = PythonBlockParser.skipTypeParameters(header, k + 2);
            int close = PythonBlockParser.closingIndex(header, open);

            List<FunctionEntity.Parameter> parameters = new ArrayList<>();
            for (List<PythonToken> part : splitTopLevel(header.subList(open + 1, close))) {
                FunctionEntity.Parameter parameter = parameter(part);
                if (parameter != null) {
                    parameters.add(parameter);
                }
            }
            String returnType = close + 1 < header.size() ? text(header.subList(close + 2, header.size())) : null;

            return FunctionEntity.builder()
                    .name(name)
                    .startLine(statement.startLine())
                    .endLine(statement.endLine())
                    .signature(signature(statement.async(), name, parameters, returnType))
                    .parameters(parameters)
                    .returnType(returnType)
                    .body(SourceText.slice(lines, statement.startLine(), statement.endLine()))
                    .decorators(decorators(statement))
                    .docstring(docstring(statement.body()))
                    .async(statement.async())
                    .className(className)
                    .build();
        }

        void classes(PythonStatement statement, List<ClassEntity> out) {
            List<PythonToken> header = statement.tokens();
            String name = header.get(1).text();

            int open = PythonBlockParser.skipTypeParameters(header, 2);
            List<String> bases = new ArrayList<>();
            if (header.size() > open) {
                for (List<PythonToken> part : splitTopLevel(header.subList(open + 1, header.size() - 1))) {
                    boolean keyword = part.size() > 1 && part.get(1).isOp("=");
                    if (!keyword) {
                        bases.add(text(part));
                    }
                }
            }

            List<FunctionEntity> methods = new ArrayList<>();
            List<ClassEntity.Attribute> attributes = new ArrayList<>();
            List<PythonStatement> nested = new ArrayList<>();
            for (PythonStatement member : statement.body()) {
                if (member.is("def")) {
                    methods.add(function(member, name));
                } else if (member.is("class")) {
                    nested.add(member);
                } else if (!member.isCompound()) {
                    ClassEntity.Attribute attribute = attribute(member);
                    if (attribute != null) {
                        attributes.add(attribute);
                    }
                }
            }

            out.add(ClassEntity.builder()
                    .name(name)
                    .startLine(statement.startLine())
                    .endLine(statement.endLine())
                    .bases(bases)
                    .methods(methods)
                    .attributes(attributes)
                    .docstring(docstring(statement.body()))
                    .decorators(decorators(statement))
                    .build());
            for (PythonStatement inner : nested) {
                classes(inner, out);
            }
        }

        /**
         * Module-level {@code NAME = value} assignments; chained targets each produce one entry.
         */
        void globals(PythonStatement statement, List<GlobalVariable> out) {
            List<PythonToken> tokens = statement.tokens();
            List<Integer> assigns = new ArrayList<>();
            int depth = 0;
            for (int i = 0; i < tokens.size(); i++) {
                PythonToken token = tokens.get(i);
                if (token.opens()) {
                    depth++;
                } else if (token.closes()) {
                    depth--;
                } else if (depth == 0 && token.isName("lambda")) {
                    break;
                } else if (depth == 0 && token.isOp(":")) {
                    // annotated assignment
                    return;
                } else if (depth == 0 && token.isOp("=")) {
                    assigns.add(i);
                }
            }
            if (assigns.isEmpty()) {
                return;
            }
            int last = assigns.get(assigns.size() - 1);
            String value = text(tokens.subList(last + 1, tokens.size()));
            int from = 0;
            for (int assign : assigns) {
                List<PythonToken> target = tokens.subList(from, assign);
                if (target.size() == 1 && target.get(0).kind() == PythonToken.Kind.NAME) {
                    out.add(new GlobalVariable(target.get(0).text(), statement.startLine(), value));
                }
                from = assign + 1;
            }
        }

        void imports(List<PythonStatement> statements, List<String> out) {
            for (PythonStatement statement : statements) {
                if (!statement.isCompound()) {
                    PythonToken first = statement.first();
                    if (first.isName("import")) {
                        importNames(statement.tokens(), out);
                    } else if (first.isName("from")) {
                        fromImportNames(statement.tokens(), out);
                    }
                }
                imports(statement.body(), out);
            }
        }

        private void importNames(List<PythonToken> tokens, List<String> out) {
            for (List<PythonToken> part : splitTopLevel(tokens.subList(1, tokens.size()))) {
                StringBuilder dotted = new StringBuilder();
                for (PythonToken token : part) {
                    if (token.isName("as")) {
                        break;
                    }
                    dotted.append(token.text());
                }
                out.add(dotted.toString());
            }
        }

        private void fromImportNames(List<PythonToken> tokens, List<String> out) {
            int importAt = -1;
            for (int i = 1; i < tokens.size(); i++) {
                if (tokens.get(i).isName("import")) {
                    importAt = i;
                    break;
                }
            }
            if (importAt < 0) {
                return;
            }
            StringBuilder module = new StringBuilder();
            for (PythonToken token : tokens.subList(1, importAt)) {
                module.append(token.text());
            }
            // relative levels are dropped: "from ..pkg import x" -> "pkg.x"
            String base = module.toString().replaceFirst("^\\.+", "");
            List<PythonToken> names = tokens.subList(importAt + 1, tokens.size());
            if (!names.isEmpty() && names.get(0).isOp("(")) {
                names = names.subList(1, names.size() - 1);
            }
            for (List<PythonToken> part : splitTopLevel(names)) {
                out.add(base + "." + part.get(0).text());
            }
        }

        private ClassEntity.Attribute attribute(PythonStatement statement) {
            List<PythonToken> tokens = statement.tokens();
            if (tokens.size() < 3 || tokens.get(0).kind() != PythonToken.Kind.NAME
                    || tokens.get(0).isName("lambda") || !tokens.get(1).isOp(":")) {
                return null;
            }
            int end = tokens.size();
            int depth = 0;
            for (int i = 2; i < tokens.size(); i++) {
                PythonToken token = tokens.get(i);
                if (token.opens()) {
                    depth++;
                } else if (token.closes()) {
                    depth--;
                } else if (depth == 0 && token.isOp("=")) {
                    end = i;
                    break;
                }
            }
            return new ClassEntity.Attribute(tokens.get(0).text(), text(tokens.subList(2, end)), statement.startLine());
        }

        private FunctionEntity.Parameter parameter(List<PythonToken> part) {
            if (part.size() == 1 && (part.get(0).isOp("*") || part.get(0).isOp("/"))) {
                return null;
            }
            int i = 0;
            String stars = "";
            if (part.get(0).isOp("*") || part.get(0).isOp("**")) {
                stars = part.get(0).text();
                i = 1;
            }
            String name = stars + part.get(i).text();
            int colon = -1;
            int equals = -1;
            int depth = 0;
            for (int j = i + 1; j < part.size(); j++) {
                PythonToken token = part.get(j);
                if (token.opens()) {
                    depth++;
                } else if (token.closes()) {
                    depth--;
                } else if (depth == 0 && colon < 0 && equals < 0 && token.isOp(":")) {
                    colon = j;
                } else if (depth == 0 && equals < 0 && token.isOp("=")) {
                    equals = j;
                }
            }
            String declaredType = null;
            if (colon > 0) {
                declaredType = text(part.subList(colon + 1, equals > 0 ? equals : part.size()));
            }
            String defaultLiteral = equals > 0 ? text(part.subList(equals + 1, part.size())) : null;
            return new FunctionEntity.Parameter(name, declaredType, defaultLiteral);
        }

        private List<String> decorators(PythonStatement statement) {
            List<String> decorators = new ArrayList<>();
            for (PythonStatement decorator : statement.decorators()) {
                decorators.add(text(decorator.tokens()));
            }
            return decorators;
        }

        /** Source text spanning the given tokens. */
        private String text(List<PythonToken> tokens) {
            if (tokens.isEmpty()) {
                return "";
            }
            return code.substring(tokens.get(0).start(), tokens.get(tokens.size() - 1).end());
        }
    }

    private static String signature(boolean async, String name, List<FunctionEntity.Parameter> parameters,
                                     String returnType) {
        List<String> rendered = new ArrayList<>();
        for (FunctionEntity.Parameter parameter : parameters) {
            String s = parameter.name();
            if (parameter.declaredType() != null) {
                s += ": " + parameter.declaredType();
            }
            if (parameter.defaultLiteral() != null) {
                s += " = " + parameter.defaultLiteral();
            }
            rendered.add(s);
        }
        String signature = (async ? "async def " : "def ") + name + "(" + String.join(", ", rendered) + ")";
        return returnType != null ? signature + " -> " + returnType : signature;
    }

    /**
     * Docstring of a body: its first statement when that is a plain (non-bytes, non-f) string
     * expression, unescaped and cleaned of common indentation.
     */
    static String docstring(List<PythonStatement> body) {
        if (body.isEmpty() || body.get(0).isCompound()) {
            return null;
        }
        StringBuilder value = new StringBuilder();
        for (PythonToken token : body.get(0).tokens()) {
            if (token.kind() != PythonToken.Kind.STRING) {
                return null;
            }
            String literal = token.text();
            int quote = 0;
            while (literal.charAt(quote) != '"' && literal.charAt(quote) != '\'') {
                quote++;
            }
            String prefix = literal.substring(0, quote).toLowerCase(Locale.ROOT);
            if (prefix.contains("b") || prefix.contains("f")) {
                return null;
            }
            int width = literal.startsWith("\"\"\"", quote) || literal.startsWith("'''", quote) ? 3 : 1;
            String content = literal.substring(quote + width, literal.length() - width);
            value.append(prefix.contains("r") ? content : unescape(content));
        }
        return cleandoc(value.toString());
    }

    static String unescape(String content) {
        StringBuilder out = new StringBuilder(content.length());
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c != '\\' || i + 1 >= content.length()) {
                out.append(c);
                continue;
            }
            char next = content.charAt(++i);
            switch (next) {
                case '\n' -> { }
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'v' -> out.append('\u000B');
                case 'x' -> {
                    if (isHex(content, i + 1, 2)) {
                        out.append((char) Integer.parseInt(content.substring(i + 1, i + 3), 16));
                        i += 2;
                    } else {
                        out.append('\\').append(next);
                    }
                }
                case 'u' -> {
                    if (isHex(content, i + 1, 4)) {
                        out.append((char) Integer.parseInt(content.substring(i + 1, i + 5), 16));
                        i += 4;
                    } else {
                        out.append('\\').append(next);
                    }
                }
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i;
                        while (end < content.length() && end < i + 3
                                && content.charAt(end) >= '0' && content.charAt(end) <= '7') {
                            end++;
                        }
                        out.append((char) Integer.parseInt(content.substring(i, end), 8));
                        i = end - 1;
                    } else {
                        out.append('\\').append(next);
                    }
                }
            }
        }
        return out.toString();
    }

    private static boolean isHex(String s, int from, int count) {
        if (from + count > s.length()) {
            return false;
        }
        for (int i = from; i < from + count; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Python's {@code inspect.cleandoc}: strip the first line, remove the common indentation of the
     * rest, and drop leading and trailing empty lines.
     */
    static String cleandoc(String doc) {
        List<String> docLines = new ArrayList<>(List.of(expandTabs(doc).split("\n", -1)));
        int margin = Integer.MAX_VALUE;
        for (String line : docLines.subList(1, docLines.size())) {
            String content = line.stripLeading();
            if (!content.isEmpty()) {
                margin = Math.min(margin, line.length() - content.length());
            }
        }
        docLines.set(0, docLines.get(0).stripLeading());
        if (margin < Integer.MAX_VALUE) {
            for (int i = 1; i < docLines.size(); i++) {
                String line = docLines.get(i);
                docLines.set(i, line.length() > margin ? line.substring(margin) : "");
            }
        }
        while (!docLines.isEmpty() && docLines.get(docLines.size() - 1).isEmpty()) {
            docLines.remove(docLines.size() - 1);
        }
        while (!docLines.isEmpty() && docLines.get(0).isEmpty()) {
            docLines.remove(0);
        }
        return String.join("\n", docLines);
    }

    private static String expandTabs(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int column = 0;
        for (char c : text.toCharArray()) {
            if (c == '\t') {
                int spaces = 8 - column % 8;
                out.append(" ".repeat(spaces));
                column += spaces;
            } else {
                out.append(c);
                column = c == '\n' ? 0 : column + 1;
            }
        }
        return out.toString();
    }

    /**
     * Split a token run on commas that are not inside brackets; empty parts are dropped.
     */
    static List<List<PythonToken>> splitTopLevel(List<PythonToken> tokens) {
        List<List<PythonToken>> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i <= tokens.size(); i++) {
            boolean boundary = i == tokens.size();
            if (!boundary) {
                PythonToken token = tokens.get(i);
                if (token.opens()) {
                    depth++;
                } else if (token.closes()) {
                    depth--;
                } else if (depth == 0 && token.isOp(",")) {
                    boundary = true;
                }
            }
            if (boundary) {
                if (i > start) {
                    parts.add(tokens.subList(start, i));
                }
                start = i + 1;
            }
        }
        return parts;
    }
}
