package com.vidnyan.codesense.adapter.out.parser;

import com.vidnyan.codesense.domain.model.ClassEntity;
import com.vidnyan.codesense.domain.model.FunctionEntity;
import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.model.SourceLanguage;
import com.vidnyan.codesense.domain.model.SourceText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based extractor for JavaScript and TypeScript.
 *
 * Functions are found by three patterns, applied in order: named declarations, arrow functions
 * assigned to a variable, and function expressions assigned to a variable. A function body runs from
 * the first '{' at or after the match start to its balanced '}'. Braces inside strings and comments
 * are counted too, and an unterminated block runs to the end of the text; both are known
 * approximations, kept as-is.
 */
@Component
public class ScriptStructureExtractor implements StructureExtractor {

    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "import\\s+(?:\\{[^}]+\\}|\\*\\s+as\\s+\\w+|\\w+)\\s+from\\s+['\"]([^'\"]+)['\"]");

    private static final List<Pattern> FUNCTION_PATTERNS = List.of(
            Pattern.compile("(?:async\\s+)?function\\s+(\\w+)\\s*\\(([^)]*)\\)\\s*(?::\\s*(\\w+))?\\s*\\{"),
            Pattern.compile("(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s+)?\\(([^)]*)\\)\\s*(?::\\s*(\\w+))?\\s*=>\\s*\\{?"),
            Pattern.compile("(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s+)?function\\s*\\(([^)]*)\\)")
    );

    private static final Pattern CLASS_PATTERN = Pattern.compile(
            "class\\s+(\\w+)(?:\\s+extends\\s+(\\w+))?\\s*\\{");

    @Override
    public ParseResult extract(String code, SourceLanguage language) {
        List<String> lines = SourceText.lines(code);

        List<String> imports = new ArrayList<>();
        Matcher importMatcher = IMPORT_PATTERN.matcher(code);
        while (importMatcher.find()) {
            imports.add(importMatcher.group(1));
        }

        List<FunctionEntity> functions = new ArrayList<>();
        for (Pattern pattern : FUNCTION_PATTERNS) {
            Matcher m = pattern.matcher(code);
            while (m.find()) {
                functions.add(toFunction(code, lines, m));
            }
        }

        List<ClassEntity> classes = new ArrayList<>();
        Matcher classMatcher = CLASS_PATTERN.matcher(code);
        while (classMatcher.find()) {
            int startLine = SourceText.lineAt(code, classMatcher.start());
            int braceEnd = findMatchingBrace(code, classMatcher.end() - 1);
            String base = classMatcher.group(2);
            classes.add(ClassEntity.builder()
                    .name(classMatcher.group(1))
                    .startLine(startLine)
                    .endLine(SourceText.lineAt(code, braceEnd))
                    .bases(base != null ? List.of(base) : List.of())
                    .build());
        }

        return new ParseResult(language.tag(), functions, classes, imports, List.of(), List.of(),
                HeuristicComplexity.estimate(code));
    }

    private FunctionEntity toFunction(String code, List<String> lines, Matcher m) {
        int startLine = SourceText.lineAt(code, m.start());
        int bodyStart = code.indexOf('{', m.start());
        int endLine = startLine;
        String body = "";
        if (bodyStart >= 0) {
            int bodyEnd = findMatchingBrace(code, bodyStart);
            body = bodyEnd >= code.length() ? code.substring(bodyStart) : code.substring(bodyStart, bodyEnd + 1);
            endLine = Math.max(startLine, SourceText.lineAt(code, bodyEnd));
        }
        String matched = m.group(0);
        return FunctionEntity.builder()
                .name(m.group(1))
                .startLine(startLine)
                .endLine(endLine)
                .signature(matched)
                .parameters(parseParameters(m.group(2)))
                .returnType(m.groupCount() >= 3 ? m.group(3) : null)
                .body(body)
                .async(matched.contains("async"))
                .build();
    }

    /**
     * Index of the '}' balancing the '{' at {@code open}, or the text length if the block never closes.
     */
    static int findMatchingBrace(String code, int open) {
        int depth = 0;
        for (int i = open; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return code.length();
    }

    /**
     * Split a parameter list into {@code name[?][: type][= default]} entries.
     */
    static List<FunctionEntity.Parameter> parseParameters(String params) {
        List<FunctionEntity.Parameter> result = new ArrayList<>();
        if (params == null || params.isBlank()) {
            return result;
        }
        for (String raw : splitTopLevel(params)) {
            String part = raw.strip();
            if (part.isEmpty()) {
                continue;
            }
            String defaultLiteral = null;
            int eq = indexOfTopLevel(part, '=');
            if (eq >= 0) {
                defaultLiteral = part.substring(eq + 1).strip();
                part = part.substring(0, eq).strip();
            }
            String declaredType = null;
            int colon = indexOfTopLevel(part, ':');
            if (colon >= 0) {
                declaredType = part.substring(colon + 1).strip();
                part = part.substring(0, colon).strip();
            }
            if (part.endsWith("?")) {
                part = part.substring(0, part.length() - 1);
            }
            result.add(new FunctionEntity.Parameter(part, declaredType, defaultLiteral));
        }
        return result;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int from = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{' || c == '<') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}' || (c == '>' && depth > 0)) {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(from, i));
                from = i + 1;
            }
        }
        parts.add(text.substring(from));
        return parts;
    }

    private static int indexOfTopLevel(String text, char target) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{' || c == '<') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}' || (c == '>' && depth > 0)) {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
