package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.model.graph.Visibility;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Indentation-aware Python parser. Physical lines are joined into logical lines (open brackets,
 * backslash continuations, multi-line strings) and nested by indentation into class and function
 * scopes. Functions local to another function are not entities: their calls count for the
 * enclosing function.
 * <p>
 * Calls in decorators and on the {@code def} line (default arguments, one-line bodies) count for
 * the enclosing function of a local function and for the declared function otherwise. Calls on a
 * {@code class} line, such as a base class built by a factory call, are not collected.
 */
@Service
public class PythonSourceParser extends AbstractLanguageParser {

    private static final Pattern CLASS_PATTERN = Pattern.compile("^class\\s+([A-Za-z_]\\w*)");
    private static final Pattern DEF_PATTERN = Pattern.compile("^(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern DECORATOR_PATTERN = Pattern.compile("^@\\s*([\\w.]+)");
    private static final Pattern CLASS_ATTRIBUTE_PATTERN = Pattern.compile("^([A-Za-z_]\\w*)\\s*(?::\\s*([^=]+?))?\\s*=(?!=)");
    private static final Pattern ANNOTATED_ATTRIBUTE_PATTERN = Pattern.compile("^([A-Za-z_]\\w*)\\s*:\\s*(.+)$");
    private static final Pattern SELF_ATTRIBUTE_PATTERN = Pattern.compile("(?m)^\\s*self\\.([A-Za-z_]\\w*)\\s*(?::\\s*([^=\\n]+?))?\\s*=(?!=)");
    private static final Pattern CALL_PATTERN = Pattern.compile("(?<![\\w])([A-Za-z_]\\w*)\\s*\\(");

    private static final Set<String> CALL_KEYWORDS = Set.of(
            "if", "elif", "while", "for", "return", "not", "and", "or", "in", "is", "lambda", "yield",
            "await", "assert", "del", "with", "except", "raise", "def", "class", "super", "print", "import", "from");

    private static final Map<String, String> DECORATOR_MODIFIERS = Map.of(
            "staticmethod", "static",
            "classmethod", "classmethod",
            "abstractmethod", "abstract",
            "override", "override",
            "property", "property");

    private final CanonicalIdGenerator idGenerator;

    public PythonSourceParser(CanonicalIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public String getLanguage() {
        return "python";
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("py");
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("py");
    }

    @Override
    public String getParserVersion() {
        return "1.0.0-indent";
    }

    // ========================= SCOPES =========================

    private enum ScopeKind {
        CLASS,
        FUNCTION,
        // local function or class: not an entity
        LOCAL
    }

    @Getter
    @AllArgsConstructor
    private static class Scope {
        private final int indent;
        private final ScopeKind kind;
        private final CodeEntity entity;
        private final Set<String> fieldNames;
    }

    @Getter
    @AllArgsConstructor
    private static class LogicalLine {
        private final int line;
        private final int indent;
        private final String text;
    }

    @Override
    protected void parseSource(ParseBatch batch, String relativePath, String content) {
        String text = SourceText.blankOut(content, SourceText.Syntax.PYTHON);
        List<LogicalLine> logicalLines = joinLogicalLines(text);
        CodeEntity file = batch.addFile(relativePath, SourceText.lineCount(text));
        String moduleName = moduleName(relativePath);

        Deque<Scope> scopes = new ArrayDeque<>();
        List<String> decorators = new ArrayList<>();
        List<LogicalLine> decoratorLines = new ArrayList<>();
        int lastLine = 1;

        for (LogicalLine logical : logicalLines) {
            String statement = logical.getText().trim();
            while (!scopes.isEmpty() && logical.getIndent() <= scopes.peek().getIndent()) {
                closeScope(scopes.pop(), lastLine);
            }
            lastLine = logical.getLine() + countNewlines(logical.getText());

            Matcher decorator = DECORATOR_PATTERN.matcher(statement);
            if (decorator.find()) {
                decorators.add(decorator.group(1));
                decoratorLines.add(logical);
                continue;
            }

            Scope top = scopes.peek();
            boolean local = top != null && top.getKind() != ScopeKind.CLASS;

            Matcher classMatcher = CLASS_PATTERN.matcher(statement);
            if (classMatcher.find()) {
                if (local) {
                    scopes.push(new Scope(logical.getIndent(), ScopeKind.LOCAL, null, null));
                } else {
                    CodeEntity parent = top != null ? top.getEntity() : file;
                    CodeEntity type = declareClass(batch, relativePath, logical, statement, classMatcher,
                            parent, top != null ? parent.getQualifiedName() : moduleName);
                    scopes.push(type != null
                            ? new Scope(logical.getIndent(), ScopeKind.CLASS, type, new HashSet<>())
                            : new Scope(logical.getIndent(), ScopeKind.LOCAL, null, null));
                }
                decorators.clear();
                decoratorLines.clear();
                continue;
            }

            Matcher defMatcher = DEF_PATTERN.matcher(statement);
            if (defMatcher.find()) {
                CodeEntity definitionCaller;
                if (local) {
                    Scope enclosing = enclosingFunction(scopes);
                    definitionCaller = enclosing != null ? enclosing.getEntity() : null;
                    scopes.push(new Scope(logical.getIndent(), ScopeKind.LOCAL, null, null));
                } else {
                    CodeEntity owner = top != null ? top.getEntity() : file;
                    String ownerName = top != null ? owner.getQualifiedName() : moduleName;
                    CodeEntity function = declareFunction(batch, relativePath, logical, statement, defMatcher,
                            owner, ownerName, decorators);
                    definitionCaller = function;
                    scopes.push(function != null
                            ? new Scope(logical.getIndent(), ScopeKind.FUNCTION, function, null)
                            : new Scope(logical.getIndent(), ScopeKind.LOCAL, null, null));
                }
                if (definitionCaller != null) {
                    for (LogicalLine decoratorLine : decoratorLines) {
                        collectCalls(batch, decoratorLine.getText(), decoratorLine.getLine(), definitionCaller);
                    }
                    // from the parameter list on, so the function's own name is not a call
                    collectCalls(batch, statement.substring(defMatcher.end() - 1), logical.getLine(),
                            definitionCaller);
                }
                decorators.clear();
                decoratorLines.clear();
                continue;
            }
            decorators.clear();
            decoratorLines.clear();

            if (top != null && top.getKind() == ScopeKind.CLASS) {
                declareClassAttribute(batch, relativePath, logical, statement, top);
                continue;
            }

            Scope function = enclosingFunction(scopes);
            if (function != null) {
                Scope classScope = ownerClassScope(scopes, function);
                if (classScope != null && "__init__".equals(function.getEntity().getName())) {
                    declareSelfAttributes(batch, relativePath, logical, classScope);
                }
                collectCalls(batch, logical.getText(), logical.getLine(), function.getEntity());
            }
        }
        while (!scopes.isEmpty()) {
            closeScope(scopes.pop(), lastLine);
        }
    }

    // ========================= LOGICAL LINES =========================

    private List<LogicalLine> joinLogicalLines(String text) {
        List<LogicalLine> result = new ArrayList<>();
        String[] physical = text.split("\n", -1);
        StringBuilder current = null;
        int startLine = 0;
        int indent = 0;
        int depth = 0;
        boolean inTripleString = false;

        for (int i = 0; i < physical.length; i++) {
            String line = physical[i];
            if (current == null) {
                if (line.isBlank()) {
                    continue;
                }
                current = new StringBuilder(line);
                startLine = i + 1;
                indent = indentOf(line);
            } else {
                current.append('\n').append(line);
            }
            depth += bracketBalance(line);
            if (tripleQuoteCount(line) % 2 == 1) {
                inTripleString = !inTripleString;
            }
            boolean continued = depth > 0 || inTripleString || line.stripTrailing().endsWith("\\");
            if (!continued) {
                result.add(new LogicalLine(startLine, indent, current.toString()));
                current = null;
                depth = 0;
            }
        }
        if (current != null) {
            result.add(new LogicalLine(startLine, indent, current.toString()));
        }
        return result;
    }

    private static int indentOf(String line) {
        int indent = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                indent++;
            } else if (c == '\t') {
                indent += 8 - (indent % 8);
            } else {
                break;
            }
        }
        return indent;
    }

    private static int bracketBalance(String line) {
        int balance = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                balance++;
            } else if (c == ')' || c == ']' || c == '}') {
                balance--;
            }
        }
        return balance;
    }

    private static int tripleQuoteCount(String line) {
        return countOccurrences(line, "\"\"\"") + countOccurrences(line, "'''");
    }

    private static int countOccurrences(String text, String token) {
        int count = 0;
        int index = text.indexOf(token);
        while (index >= 0) {
            count++;
            index = text.indexOf(token, index + token.length());
        }
        return count;
    }

    private static int countNewlines(String text) {
        return countOccurrences(text, "\n");
    }

    // ========================= DECLARATIONS =========================

    private CodeEntity declareClass(ParseBatch batch, String relativePath, LogicalLine logical, String statement,
                                    Matcher matcher, CodeEntity parent, String prefix) {
        String name = matcher.group(1);
        String qualifiedName = qualify(prefix, name);
        CodeEntity type = CodeEntity.builder()
                .id(idGenerator.generateEntityId(getLanguage(), EntityKind.CLASS, relativePath, qualifiedName))
                .kind(EntityKind.CLASS)
                .name(name)
                .qualifiedName(qualifiedName)
                .filePath(relativePath)
                .startLine(logical.getLine())
                .endLine(logical.getLine())
                .visibility(visibilityOf(name))
                .build();
        if (!batch.addEntity(type, parent.getId())) {
            return null;
        }

        int open = SourceText.skipWhitespace(statement, matcher.end());
        if (open < statement.length() && statement.charAt(open) == '(') {
            int close = SourceText.matchingClose(statement, open);
            for (String base : SourceText.splitTopLevel(statement.substring(open + 1, close))) {
                if (base.contains("=") || base.startsWith("*")) {
                    continue;
                }
                String simple = SourceText.simpleTypeName(base);
                if (simple == null || simple.isEmpty() || "object".equals(simple)) {
                    continue;
                }
                batch.addTypeReference(RawTypeReference.builder()
                        .sourceId(type.getId())
                        .typeName(simple)
                        .relationshipType(RelationshipType.EXTENDS)
                        .line(logical.getLine())
                        .build());
            }
        }
        return type;
    }

    private CodeEntity declareFunction(ParseBatch batch, String relativePath, LogicalLine logical, String statement,
                                       Matcher matcher, CodeEntity owner, String prefix, List<String> decorators) {
        String name = matcher.group(1);
        boolean isMethod = owner.getKind() != EntityKind.FILE;
        int open = matcher.end() - 1;
        int close = SourceText.matchingClose(statement, open);

        List<String> modifiers = new ArrayList<>();
        for (String decorator : decorators) {
            String simple = decorator.substring(decorator.lastIndexOf('.') + 1);
            String modifier = DECORATOR_MODIFIERS.get(simple);
            if (modifier != null) {
                modifiers.add(modifier);
            }
        }
        if (statement.startsWith("async")) {
            modifiers.add("async");
        }
        if (isMethod && "__init__".equals(name)) {
            modifiers.add("constructor");
        }

        List<String> parameterTypes = new ArrayList<>();
        int required = 0;
        int positional = 0;
        boolean unbounded = false;
        List<String> parameters = SourceText.splitTopLevel(statement.substring(open + 1, close));
        for (int i = 0; i < parameters.size(); i++) {
            String parameter = parameters.get(i).trim();
            String parameterName = parameter.split("[:=]", 2)[0].trim();
            if (i == 0 && isMethod && !modifiers.contains("static")
                    && ("self".equals(parameterName) || "cls".equals(parameterName))) {
                continue;
            }
            if ("/".equals(parameterName) || "*".equals(parameterName)) {
                continue;
            }
            if (parameterName.startsWith("*")) {
                unbounded = true;
                continue;
            }
            int colon = parameter.indexOf(':');
            int equals = parameter.indexOf('=');
            String annotation = colon >= 0
                    ? parameter.substring(colon + 1, equals > colon ? equals : parameter.length()).trim()
                    : "?";
            parameterTypes.add(annotation);
            positional++;
            if (equals < 0) {
                required++;
            }
        }

        String returnType = null;
        String tail = statement.substring(Math.min(close + 1, statement.length()));
        int arrow = tail.indexOf("->");
        if (arrow >= 0) {
            int colon = tail.lastIndexOf(':');
            returnType = tail.substring(arrow + 2, colon > arrow ? colon : tail.length()).trim();
        }

        String qualifiedName = qualify(prefix, name);
        String signature = name + "(" + String.join(", ", parameterTypes) + ")"
                + (returnType != null ? " -> " + returnType : "");
        CodeEntity function = CodeEntity.builder()
                .id(idGenerator.generateMethodId(getLanguage(), relativePath, qualifiedName, parameterTypes))
                .kind(EntityKind.METHOD)
                .name(name)
                .qualifiedName(qualifiedName)
                .filePath(relativePath)
                .startLine(logical.getLine())
                .endLine(logical.getLine())
                .visibility(visibilityOf(name))
                .signature(signature)
                .returnType(returnType)
                .parameterTypes(parameterTypes)
                .modifiers(modifiers)
                .build();
        if (!batch.declareMethod(function, owner, required, unbounded ? DeclaredMethod.UNBOUNDED : positional)) {
            return null;
        }
        addTypeUse(batch, function.getId(), returnType, logical.getLine());
        for (String parameterType : parameterTypes) {
            addTypeUse(batch, function.getId(), parameterType, logical.getLine());
        }
        return function;
    }

    private void declareClassAttribute(ParseBatch batch, String relativePath, LogicalLine logical, String statement,
                                       Scope classScope) {
        Matcher assignment = CLASS_ATTRIBUTE_PATTERN.matcher(statement);
        if (assignment.find()) {
            declareField(batch, relativePath, logical.getLine(), classScope, assignment.group(1), assignment.group(2));
            return;
        }
        Matcher annotated = ANNOTATED_ATTRIBUTE_PATTERN.matcher(statement);
        if (annotated.find()) {
            declareField(batch, relativePath, logical.getLine(), classScope, annotated.group(1), annotated.group(2));
        }
    }

    private void declareSelfAttributes(ParseBatch batch, String relativePath, LogicalLine logical, Scope classScope) {
        Matcher matcher = SELF_ATTRIBUTE_PATTERN.matcher(logical.getText());
        while (matcher.find()) {
            declareField(batch, relativePath, logical.getLine(), classScope, matcher.group(1), matcher.group(2));
        }
    }

    private void declareField(ParseBatch batch, String relativePath, int line, Scope classScope, String name,
                              String annotation) {
        if (!classScope.getFieldNames().add(name)) {
            return;
        }
        CodeEntity owner = classScope.getEntity();
        String type = annotation != null ? annotation.trim() : null;
        String qualifiedName = qualify(owner.getQualifiedName(), name);
        CodeEntity field = CodeEntity.builder()
                .id(idGenerator.generateEntityId(getLanguage(), EntityKind.FIELD, relativePath, qualifiedName))
                .kind(EntityKind.FIELD)
                .name(name)
                .qualifiedName(qualifiedName)
                .filePath(relativePath)
                .startLine(line)
                .endLine(line)
                .visibility(visibilityOf(name))
                .returnType(type)
                .build();
        if (batch.addEntity(field, owner.getId())) {
            addTypeUse(batch, field.getId(), type, line);
        }
    }

    private void addTypeUse(ParseBatch batch, String sourceId, String type, int line) {
        if (type == null) {
            return;
        }
        String simple = SourceText.simpleTypeName(type.replace("'", "").replace("\"", ""));
        if (simple == null || simple.isEmpty() || !Character.isUpperCase(simple.charAt(0))) {
            return;
        }
        batch.addTypeReference(RawTypeReference.builder()
                .sourceId(sourceId)
                .typeName(simple)
                .relationshipType(RelationshipType.REFERENCES)
                .line(line)
                .build());
    }

    // ========================= CALL SITES =========================

    private void collectCalls(ParseBatch batch, String text, int firstLine, CodeEntity caller) {
        Matcher matcher = CALL_PATTERN.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (CALL_KEYWORDS.contains(name) || (name.startsWith("__") && name.endsWith("__"))) {
                continue;
            }
            int line = firstLine + countNewlines(text.substring(0, matcher.start()));
            RawCall.RawCallBuilder call = RawCall.builder()
                    .callerId(caller.getId())
                    .callerOwnerId(caller.getParentId())
                    .calleeName(name)
                    .arity(SourceText.countArguments(text, matcher.end() - 1))
                    .line(line);

            String receiver = BraceLanguageParser.receiverBefore(text, matcher.start());
            if (receiver == null) {
                call.receiverKind(RawCall.ReceiverKind.NONE).implicitSelf(false);
                if (Character.isUpperCase(name.charAt(0))) {
                    batch.addTypeReference(RawTypeReference.builder()
                            .sourceId(caller.getId())
                            .typeName(name)
                            .relationshipType(RelationshipType.REFERENCES)
                            .line(line)
                            .build());
                }
            } else if ("self".equals(receiver) || "cls".equals(receiver)) {
                call.receiverKind(RawCall.ReceiverKind.SELF);
            } else if (!receiver.isEmpty() && Character.isUpperCase(receiver.charAt(0))) {
                call.receiverKind(RawCall.ReceiverKind.NAMED).receiverType(receiver);
            } else {
                call.receiverKind(RawCall.ReceiverKind.UNKNOWN);
            }
            batch.addCall(call.build());
        }
    }

    // ========================= HELPERS =========================

    private static Scope enclosingFunction(Deque<Scope> scopes) {
        for (Scope scope : scopes) {
            if (scope.getKind() == ScopeKind.FUNCTION) {
                return scope;
            }
        }
        return null;
    }

    private static Scope ownerClassScope(Deque<Scope> scopes, Scope function) {
        boolean passedFunction = false;
        for (Scope scope : scopes) {
            if (scope == function) {
                passedFunction = true;
            } else if (passedFunction) {
                return scope.getKind() == ScopeKind.CLASS ? scope : null;
            }
        }
        return null;
    }

    private static void closeScope(Scope scope, int lastLine) {
        if (scope.getEntity() != null) {
            scope.getEntity().setEndLine(Math.max(scope.getEntity().getStartLine(), lastLine));
        }
    }

    static String moduleName(String relativePath) {
        String module = relativePath.endsWith(".py")
                ? relativePath.substring(0, relativePath.length() - ".py".length())
                : relativePath;
        module = module.replace('/', '.');
        if (module.endsWith(".__init__")) {
            module = module.substring(0, module.length() - ".__init__".length());
        } else if ("__init__".equals(module)) {
            module = "";
        }
        return module;
    }

    static Visibility visibilityOf(String name) {
        if (name.startsWith("__") && name.endsWith("__")) {
            return Visibility.PUBLIC;
        }
        if (name.startsWith("__")) {
            return Visibility.PRIVATE;
        }
        if (name.startsWith("_")) {
            return Visibility.PROTECTED;
        }
        return Visibility.PUBLIC;
    }

    private static String qualify(String prefix, String name) {
        return prefix == null || prefix.isEmpty() ? name : prefix + "." + name;
    }
}
