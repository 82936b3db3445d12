package com.vidnyan.codesense.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithImplements;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.javadoc.Javadoc;
import com.vidnyan.codesense.domain.model.ClassEntity;
import com.vidnyan.codesense.domain.model.FunctionEntity;
import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.model.SourceLanguage;
import com.vidnyan.codesense.domain.model.SourceText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JavaParser-based extractor for Java.
 *
 * A snippet does not have to be a full compilation unit. Parsing is tried as a compilation unit,
 * then as class members, then as method statements. The wrappers open on the snippet's first line
 * so reported line numbers stay those of the snippet.
 */
@Slf4j
@Component
public class JavaStructureExtractor implements StructureExtractor {

    private static final String LANGUAGE = "java";
    private static final String WRAPPER = "CodeSenseSnippet__";

    private static final List<String> PREFIXES = List.of(
            "",
            "class " + WRAPPER + " {",
            "class " + WRAPPER + " { void snippet__() {");

    private static final List<String> SUFFIXES = List.of("", "\n}", "\n}}");

    @Override
    public ParseResult extract(String code, SourceLanguage language) {
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

        List<Problem> firstProblems = List.of();
        for (int attempt = 0; attempt < PREFIXES.size(); attempt++) {
            com.github.javaparser.ParseResult<CompilationUnit> result =
                    parser.parse(PREFIXES.get(attempt) + code + SUFFIXES.get(attempt));
            if (result.isSuccessful() && result.getResult().isPresent()) {
                log.debug("Parsed Java snippet on attempt {}", attempt + 1);
                return walk(result.getResult().get(), code, attempt == 1);
            }
            if (attempt == 0) {
                firstProblems = result.getProblems();
            }
        }

        List<String> errors = new ArrayList<>();
        if (firstProblems.isEmpty()) {
            errors.add("Syntax error at line 0: unparseable input");
        } else {
            Problem problem = firstProblems.get(0);
            errors.add("Syntax error at line " + line(problem) + ": " + problem.getMessage().lines().findFirst().orElse(""));
        }
        return ParseResult.degraded(LANGUAGE, errors, 0.0);
    }

    private ParseResult walk(CompilationUnit cu, String code, boolean membersWrapped) {
        List<String> lines = SourceText.lines(code);

        List<String> imports = new ArrayList<>();
        for (ImportDeclaration importDeclaration : cu.getImports()) {
            imports.add(importDeclaration.getNameAsString() + (importDeclaration.isAsterisk() ? ".*" : ""));
        }

        List<FunctionEntity> functions = new ArrayList<>();
        List<ClassEntity> classes = new ArrayList<>();
        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            if (type.getNameAsString().equals(WRAPPER)) {
                if (membersWrapped) {
                    for (BodyDeclaration<?> member : type.getMembers()) {
                        if (member instanceof CallableDeclaration<?> callable) {
                            functions.add(function(callable, lines, null));
                        }
                    }
                }
                continue;
            }
            classes.add(toClass(type, lines));
        }

        return new ParseResult(LANGUAGE, functions, classes, imports, List.of(), List.of(), complexity(cu));
    }

    private ClassEntity toClass(TypeDeclaration<?> type, List<String> lines) {
        String name = type.getNameAsString();

        List<String> bases = new ArrayList<>();
        if (type instanceof ClassOrInterfaceDeclaration declaration) {
            declaration.getExtendedTypes().forEach(t -> bases.add(t.getNameWithScope()));
        }
        if (type instanceof NodeWithImplements<?> implementing) {
            for (ClassOrInterfaceType t : implementing.getImplementedTypes()) {
                bases.add(t.getNameWithScope());
            }
        }

        List<FunctionEntity> methods = new ArrayList<>();
        List<ClassEntity.Attribute> attributes = new ArrayList<>();
        if (type instanceof RecordDeclaration recordDeclaration) {
            recordDeclaration.getParameters().forEach(p ->
                    attributes.add(new ClassEntity.Attribute(p.getNameAsString(), p.getTypeAsString(), beginLine(p))));
        }
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof CallableDeclaration<?> callable) {
                methods.add(function(callable, lines, name));
            } else if (member instanceof FieldDeclaration field) {
                for (VariableDeclarator variable : field.getVariables()) {
                    attributes.add(new ClassEntity.Attribute(
                            variable.getNameAsString(), variable.getTypeAsString(), beginLine(variable)));
                }
            }
        }

        int start = declarationLine(type.getModifiers(), beginLine(type.getName()));
        return ClassEntity.builder()
                .name(name)
                .startLine(start)
                .endLine(Math.max(start, endLine(type)))
                .bases(bases)
                .methods(methods)
                .attributes(attributes)
                .docstring(javadoc(type.getJavadoc()))
                .decorators(annotations(type.getAnnotations()))
                .build();
    }

    private FunctionEntity function(CallableDeclaration<?> callable, List<String> lines, String className) {
        int nameLine = beginLine(callable.getName());
        if (callable instanceof MethodDeclaration method) {
            nameLine = Math.min(nameLine, beginLine(method.getType()));
        }
        int start = declarationLine(callable.getModifiers(), nameLine);
        int end = Math.max(start, endLine(callable));

        List<FunctionEntity.Parameter> parameters = new ArrayList<>();
        callable.getParameters().forEach(p -> parameters.add(new FunctionEntity.Parameter(
                p.getNameAsString(), p.getTypeAsString() + (p.isVarArgs() ? "..." : ""), null)));

        String returnType = callable instanceof MethodDeclaration method ? method.getTypeAsString() : null;

        return FunctionEntity.builder()
                .name(callable.getNameAsString())
                .startLine(start)
                .endLine(end)
                .signature(callable.getDeclarationAsString(true, true, true))
                .parameters(parameters)
                .returnType(returnType)
                .body(SourceText.slice(lines, start, end))
                .decorators(annotations(callable.getAnnotations()))
                .docstring(javadoc(callable.getJavadoc()))
                .async(false)
                .className(className)
                .build();
    }

    /**
     * 1 + one per if/loop/catch/case label + one per && and ||, scaled by 5 and capped at 100.
     */
    static double complexity(CompilationUnit cu) {
        int raw = 1;
        raw += cu.findAll(IfStmt.class).size();
        raw += cu.findAll(ForStmt.class).size();
        raw += cu.findAll(ForEachStmt.class).size();
        raw += cu.findAll(WhileStmt.class).size();
        raw += cu.findAll(DoStmt.class).size();
        raw += cu.findAll(CatchClause.class).size();
        raw += (int) cu.findAll(SwitchEntry.class).stream()
                .filter(entry -> !entry.getLabels().isEmpty())
                .count();
        raw += (int) cu.findAll(BinaryExpr.class).stream()
                .filter(expr -> expr.getOperator() == BinaryExpr.Operator.AND
                        || expr.getOperator() == BinaryExpr.Operator.OR)
                .count();
        return Math.min(ParseResult.MAX_COMPLEXITY, raw * 5.0);
    }

    private static List<String> annotations(List<AnnotationExpr> annotations) {
        List<String> rendered = new ArrayList<>();
        for (AnnotationExpr annotation : annotations) {
            rendered.add(annotation.getTokenRange().map(TokenRange::toString).orElse(annotation.toString()));
        }
        return rendered;
    }

    private static String javadoc(Optional<Javadoc> javadoc) {
        return javadoc.map(Javadoc::toText)
                .map(String::strip)
                .filter(text -> !text.isEmpty())
                .orElse(null);
    }

    /** First line of the declaration proper: modifiers, type or name, annotations excluded. */
    private static int declarationLine(List<Modifier> modifiers, int fallback) {
        int line = fallback;
        for (Modifier modifier : modifiers) {
            line = Math.min(line, beginLine(modifier));
        }
        return line;
    }

    private static int beginLine(Node node) {
        return node.getBegin().map(p -> p.line).orElse(1);
    }

    private static int endLine(Node node) {
        return node.getEnd().map(p -> p.line).orElse(1);
    }

    private static int line(Problem problem) {
        return problem.getLocation()
                .flatMap(range -> range.getBegin().getRange())
                .map(range -> range.begin.line)
                .orElse(0);
    }
}
