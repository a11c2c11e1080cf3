package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.model.graph.Visibility;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based Kotlin parser: classes, interfaces, objects, functions (member, top-level and
 * extension) and member properties. Visibility defaults to public, as in the language.
 */
@Service
public class KotlinSourceParser extends BraceLanguageParser {

    private static final String ANNOTATIONS = "(?:@[\\w.]+(?:\\([^)\\n]*\\))?\\s+)*";

    private static final Pattern PACKAGE_PATTERN = Pattern.compile("(?m)^\\s*package\\s+([\\w.]+)");

    private static final Pattern TYPE_PATTERN = Pattern.compile(
            "(?m)^[ \\t]*" + ANNOTATIONS
                    + "((?:(?:public|private|protected|internal|abstract|final|open|sealed|data|inline|value|enum"
                    + "|annotation|inner|companion|fun|expect|actual)\\s+)*)"
                    + "(class|interface|object)\\s+([A-Za-z_]\\w*)");

    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
            "(?m)^[ \\t]*" + ANNOTATIONS
                    + "((?:(?:public|private|protected|internal|override|abstract|open|final|inline|suspend|operator"
                    + "|infix|tailrec|external|actual|expect)\\s+)*)"
                    + "fun\\s+(?:<[^>]*>\\s*)?(?:[A-Za-z_][\\w<>?, ]*\\.)?([A-Za-z_]\\w*)\\s*\\(");

    private static final Pattern PROPERTY_PATTERN = Pattern.compile(
            "(?m)^[ \\t]*" + ANNOTATIONS
                    + "((?:(?:public|private|protected|internal|override|open|final|const|lateinit|abstract)\\s+)*)"
                    + "(val|var)\\s+([A-Za-z_]\\w*)\\s*(?::\\s*([^=\\n{]+))?");

    private static final Pattern ANNOTATION_PATTERN = Pattern.compile("@[\\w.]+(?:\\([^)]*\\))?");

    private static final Set<String> CALL_KEYWORDS = Set.of(
            "if", "when", "while", "for", "catch", "return", "throw", "super", "this", "fun", "object",
            "constructor", "init", "in", "is", "as");

    public KotlinSourceParser(CanonicalIdGenerator idGenerator) {
        super(idGenerator);
    }

    @Override
    public String getLanguage() {
        return "kotlin";
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("kt", "kts");
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("kt", "kts");
    }

    @Override
    public String getParserVersion() {
        return "1.0.0-regex";
    }

    @Override
    protected String namespaceOf(String text, String relativePath) {
        Matcher matcher = PACKAGE_PATTERN.matcher(text);
        return matcher.find() ? matcher.group(1) : "";
    }

    // ========================= TYPES =========================

    @Override
    protected List<TypeDecl> findTypes(String text) {
        List<TypeDecl> types = new ArrayList<>();
        Matcher matcher = TYPE_PATTERN.matcher(text);
        while (matcher.find()) {
            List<String> modifiers = words(matcher.group(1));
            String keyword = matcher.group(2);
            EntityKind kind = "interface".equals(keyword) ? EntityKind.INTERFACE : EntityKind.CLASS;
            if ("object".equals(keyword)) {
                modifiers.add("object");
            }
            int headerEnd = headerEnd(text, matcher.end());
            int bodyStart = headerEnd < text.length() && text.charAt(headerEnd) == '{' ? headerEnd : -1;
            types.add(TypeDecl.builder()
                    .name(matcher.group(3))
                    .kind(kind)
                    .visibility(visibilityFrom(modifiers, Visibility.PUBLIC))
                    .modifiers(modifiers)
                    .start(matcher.start())
                    .bodyStart(bodyStart)
                    .bodyEnd(bodyStart >= 0 ? SourceText.matchingClose(text, bodyStart) : -1)
                    .supertypes(parseSupertypes(text.substring(matcher.end(), headerEnd), kind))
                    .build());
        }
        return types;
    }

    /**
     * Supertypes follow the first ':' outside brackets. An entry with a constructor call is the
     * superclass; entries without one are taken as implemented interfaces.
     */
    List<SuperRef> parseSupertypes(String header, EntityKind kind) {
        List<SuperRef> supertypes = new ArrayList<>();
        int colon = topLevelIndexOf(header, ':');
        if (colon < 0) {
            return supertypes;
        }
        String list = header.substring(colon + 1);
        int where = list.indexOf(" where ");
        if (where >= 0) {
            list = list.substring(0, where);
        }
        for (String entry : SourceText.splitTopLevel(list)) {
            String cleaned = ANNOTATION_PATTERN.matcher(entry).replaceAll("").trim();
            String name = SourceText.simpleTypeName(cleaned);
            if (name == null || name.isEmpty()) {
                continue;
            }
            boolean constructorCall = cleaned.contains("(");
            RelationshipType type = kind == EntityKind.INTERFACE || constructorCall
                    ? RelationshipType.EXTENDS : RelationshipType.IMPLEMENTS;
            supertypes.add(new SuperRef(name, type));
        }
        return supertypes;
    }

    // ========================= FUNCTIONS =========================

    @Override
    protected List<FunctionDecl> findFunctions(String text) {
        List<FunctionDecl> functions = new ArrayList<>();
        Matcher matcher = FUNCTION_PATTERN.matcher(text);
        while (matcher.find()) {
            List<String> modifiers = words(matcher.group(1));
            int open = matcher.end() - 1;
            int close = SourceText.matchingClose(text, open);
            int stop = headerEnd(text, close + 1);

            String returnType = null;
            String afterParams = text.substring(close + 1, stop).trim();
            if (afterParams.startsWith(":")) {
                returnType = afterParams.substring(1).trim();
                int where = returnType.indexOf(" where ");
                if (where >= 0) {
                    returnType = returnType.substring(0, where).trim();
                }
            }

            int bodyStart = -1;
            int bodyEnd = -1;
            if (stop < text.length() && text.charAt(stop) == '{') {
                bodyStart = stop;
                bodyEnd = SourceText.matchingClose(text, stop);
            } else if (stop < text.length() && text.charAt(stop) == '=') {
                bodyStart = stop;
                bodyEnd = expressionEnd(text, stop + 1);
            }

            FunctionDecl.FunctionDeclBuilder function = FunctionDecl.builder()
                    .name(matcher.group(2))
                    .visibility(visibilityFrom(modifiers, Visibility.PUBLIC))
                    .modifiers(modifiers)
                    .start(matcher.start())
                    .bodyStart(bodyStart)
                    .bodyEnd(bodyEnd)
                    .returnType(returnType != null && !returnType.isEmpty() ? returnType : null);
            applyParameters(function, text.substring(open + 1, close));
            functions.add(function.build());
        }
        return functions;
    }

    private void applyParameters(FunctionDecl.FunctionDeclBuilder function, String parameterList) {
        List<String> types = new ArrayList<>();
        int required = 0;
        boolean vararg = false;
        boolean trailingLambda = false;
        List<String> parameters = SourceText.splitTopLevel(parameterList);
        for (int i = 0; i < parameters.size(); i++) {
            String parameter = ANNOTATION_PATTERN.matcher(parameters.get(i)).replaceAll("").trim();
            int equals = topLevelIndexOf(parameter, '=');
            boolean hasDefault = equals >= 0;
            String declaration = hasDefault ? parameter.substring(0, equals) : parameter;
            int colon = topLevelIndexOf(declaration, ':');
            String type = colon >= 0 ? declaration.substring(colon + 1).trim() : "?";
            types.add(type);
            boolean isVararg = declaration.trim().startsWith("vararg ");
            vararg |= isVararg;
            if (!hasDefault && !isVararg) {
                required++;
            }
            if (i == parameters.size() - 1 && type.contains("->") && !hasDefault) {
                trailingLambda = true;
            }
        }
        // a trailing lambda argument is written outside the parentheses
        int minArity = trailingLambda ? Math.max(0, required - 1) : required;
        function.parameterTypes(types)
                .minArity(minArity)
                .maxArity(vararg ? DeclaredMethod.UNBOUNDED : parameters.size());
    }

    // ========================= PROPERTIES =========================

    @Override
    protected List<FieldDecl> findFields(String text) {
        List<FieldDecl> fields = new ArrayList<>();
        Matcher matcher = PROPERTY_PATTERN.matcher(text);
        while (matcher.find()) {
            List<String> modifiers = words(matcher.group(1));
            modifiers.add(matcher.group(2));
            String type = matcher.group(4) != null ? matcher.group(4).trim() : null;
            fields.add(FieldDecl.builder()
                    .name(matcher.group(3))
                    .type(type != null && !type.isEmpty() ? type : null)
                    .visibility(visibilityFrom(modifiers, Visibility.PUBLIC))
                    .modifiers(modifiers)
                    .start(matcher.start())
                    .build());
        }
        return fields;
    }

    @Override
    protected Set<String> callKeywords() {
        return CALL_KEYWORDS;
    }

    @Override
    protected String formatSignature(FunctionDecl function) {
        String signature = function.getName() + "(" + String.join(", ", function.getParameterTypes()) + ")";
        return function.getReturnType() != null ? signature + ": " + function.getReturnType() : signature;
    }

    private static int topLevelIndexOf(String text, char target) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '<' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == '>' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
