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
 * Regex-based Dart parser: classes, mixins, enums, methods, constructors, top-level functions
 * and fields. A leading underscore makes a name library-private.
 */
@Service
public class DartSourceParser extends BraceLanguageParser {

    private static final String ANNOTATIONS = "((?:@\\w+(?:\\([^)]*\\))?\\s+)*)";

    private static final Pattern LIBRARY_PATTERN = Pattern.compile("(?m)^\\s*library\\s+([\\w.]+)\\s*;");

    private static final Pattern TYPE_PATTERN = Pattern.compile(
            "(?m)^[ \\t]*((?:(?:abstract|base|final|sealed|interface|mixin)\\s+)*)"
                    + "(class|mixin|enum)\\s+([A-Za-z_$][\\w$]*)");

    private static final Pattern SUPERTYPE_KEYWORD = Pattern.compile("\\b(extends|with|implements|on)\\b");

    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
            "(?m)^[ \\t]*" + ANNOTATIONS
                    + "((?:(?:static|external|factory|const|abstract)\\s+)*)"
                    + "(?:([A-Za-z_$][\\w$.]*(?:<[^()\\n;{]*>)?\\??)\\s+)?"
                    + "([A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)?)\\s*\\(");

    private static final Pattern FIELD_PATTERN = Pattern.compile(
            "(?m)^[ \\t]*((?:(?:static|final|const|late|covariant|external)\\s+)*)"
                    + "([A-Za-z_$][\\w$.]*(?:<[^;=\\n(){}]*>)?\\??)\\s+([A-Za-z_$][\\w$]*)\\s*[;=]");

    private static final Set<String> CALL_KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "assert", "super", "this", "new",
            "throw", "await", "yield", "else", "case");

    // Words the optional return type group can swallow at the start of a statement
    private static final Set<String> STATEMENT_WORDS = Set.of(
            "return", "await", "throw", "new", "else", "yield", "case", "var", "final", "const", "late", "get", "set",
            "operator", "import", "export", "part", "library");

    public DartSourceParser(CanonicalIdGenerator idGenerator) {
        super(idGenerator);
    }

    @Override
    public String getLanguage() {
        return "dart";
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("dart");
    }

    @Override
    public String getParserVersion() {
        return "1.0.0-regex";
    }

    @Override
    protected String namespaceOf(String text, String relativePath) {
        Matcher matcher = LIBRARY_PATTERN.matcher(text);
        if (matcher.find()) {
            return matcher.group(1);
        }
        String withoutExtension = relativePath.endsWith(".dart")
                ? relativePath.substring(0, relativePath.length() - ".dart".length())
                : relativePath;
        return withoutExtension.replace('/', '.');
    }

    // ========================= TYPES =========================

    @Override
    protected List<TypeDecl> findTypes(String text) {
        List<TypeDecl> types = new ArrayList<>();
        Matcher matcher = TYPE_PATTERN.matcher(text);
        while (matcher.find()) {
            List<String> modifiers = words(matcher.group(1));
            String keyword = matcher.group(2);
            if (!"class".equals(keyword)) {
                modifiers.add(keyword);
            }
            EntityKind kind = "class".equals(keyword) && modifiers.contains("interface")
                    ? EntityKind.INTERFACE : EntityKind.CLASS;
            String name = matcher.group(3);
            int bodyStart = findBodyStart(text, matcher.end());
            int headerStop = bodyStart >= 0 ? bodyStart : headerEnd(text, matcher.end());
            types.add(TypeDecl.builder()
                    .name(name)
                    .kind(kind)
                    .visibility(name.startsWith("_") ? Visibility.PRIVATE : Visibility.PUBLIC)
                    .modifiers(modifiers)
                    .start(matcher.start())
                    .bodyStart(bodyStart)
                    .bodyEnd(bodyStart >= 0 ? SourceText.matchingClose(text, bodyStart) : -1)
                    .supertypes(parseSupertypes(text.substring(matcher.end(), headerStop), kind))
                    .build());
        }
        return types;
    }

    List<SuperRef> parseSupertypes(String header, EntityKind kind) {
        List<SuperRef> supertypes = new ArrayList<>();
        Matcher matcher = SUPERTYPE_KEYWORD.matcher(header);
        List<int[]> segments = new ArrayList<>();
        List<String> keywords = new ArrayList<>();
        while (matcher.find()) {
            segments.add(new int[]{matcher.end(), header.length()});
            if (segments.size() > 1) {
                segments.get(segments.size() - 2)[1] = matcher.start();
            }
            keywords.add(matcher.group(1));
        }
        for (int i = 0; i < segments.size(); i++) {
            String segment = header.substring(segments.get(i)[0], segments.get(i)[1]);
            RelationshipType type = "extends".equals(keywords.get(i))
                    ? RelationshipType.EXTENDS : RelationshipType.IMPLEMENTS;
            for (String entry : SourceText.splitTopLevel(segment)) {
                String name = SourceText.simpleTypeName(entry);
                if (name != null && !name.isEmpty()) {
                    supertypes.add(new SuperRef(name, type));
                }
            }
        }
        return supertypes;
    }

    // ========================= FUNCTIONS =========================

    @Override
    protected List<FunctionDecl> findFunctions(String text) {
        List<FunctionDecl> functions = new ArrayList<>();
        Matcher matcher = FUNCTION_PATTERN.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(4);
            String returnType = matcher.group(3);
            if (CALL_KEYWORDS.contains(name) || STATEMENT_WORDS.contains(name)
                    || (returnType != null && STATEMENT_WORDS.contains(returnType))) {
                continue;
            }
            List<String> modifiers = words(matcher.group(2));
            boolean constructorLike = returnType == null && Character.isUpperCase(name.charAt(0));

            int open = matcher.end() - 1;
            int close = SourceText.matchingClose(text, open);
            int after = SourceText.skipWhitespace(text, close + 1);
            int bodyStart;
            int bodyEnd;
            if (text.startsWith("=>", after)) {
                bodyStart = after;
                bodyEnd = expressionEnd(text, after + 2);
            } else if (text.startsWith("{", after) || text.startsWith("async", after) || text.startsWith("sync", after)) {
                bodyStart = findBodyStart(text, after);
                if (bodyStart < 0) {
                    int arrow = text.indexOf("=>", after);
                    if (arrow < 0 || arrow > headerEnd(text, after)) {
                        continue;
                    }
                    bodyStart = arrow;
                    bodyEnd = expressionEnd(text, arrow + 2);
                } else {
                    bodyEnd = SourceText.matchingClose(text, bodyStart);
                }
            } else if (text.startsWith(":", after) && constructorLike) {
                bodyStart = initializerEnd(text, after + 1);
                if (bodyStart < text.length() && text.charAt(bodyStart) == '{') {
                    bodyEnd = SourceText.matchingClose(text, bodyStart);
                } else {
                    // initializer list only: scan it for calls
                    bodyEnd = bodyStart;
                    bodyStart = after;
                }
            } else if (text.startsWith(";", after) && (returnType != null || constructorLike)) {
                bodyStart = -1;
                bodyEnd = -1;
            } else {
                continue;
            }

            if (!matcher.group(1).isEmpty() && matcher.group(1).contains("@override")) {
                modifiers.add("override");
            }
            String lastSegment = name.substring(name.lastIndexOf('.') + 1);
            FunctionDecl.FunctionDeclBuilder function = FunctionDecl.builder()
                    .name(name)
                    .visibility(lastSegment.startsWith("_") ? Visibility.PRIVATE : Visibility.PUBLIC)
                    .modifiers(modifiers)
                    .start(matcher.start(2))
                    .bodyStart(bodyStart)
                    .bodyEnd(bodyEnd)
                    .returnType(returnType);
            applyParameters(function, text.substring(open + 1, close));
            functions.add(function.build());
        }
        return functions;
    }

    /**
     * End of a constructor initializer list: the body '{' or the terminating ';'.
     */
    private static int initializerEnd(String text, int from) {
        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && (c == '{' || c == ';')) {
                return i;
            }
        }
        return text.length();
    }

    /**
     * Positional parameters are required; those in [...] are optional; those in {...} are named
     * and only count towards the minimum when marked required.
     */
    private void applyParameters(FunctionDecl.FunctionDeclBuilder function, String parameterList) {
        String positionalPart = parameterList;
        String optionalPart = "";
        boolean named = false;
        int optionalStart = firstTopLevel(parameterList, '[', '{');
        if (optionalStart >= 0) {
            named = parameterList.charAt(optionalStart) == '{';
            positionalPart = parameterList.substring(0, optionalStart);
            int optionalEnd = SourceText.matchingClose(parameterList, optionalStart);
            optionalPart = parameterList.substring(optionalStart + 1, Math.max(optionalStart + 1, optionalEnd));
        }

        List<String> positional = SourceText.splitTopLevel(positionalPart);
        List<String> optional = SourceText.splitTopLevel(optionalPart);
        List<String> types = new ArrayList<>();
        for (String parameter : positional) {
            types.add(parameterType(parameter));
        }
        int requiredNamed = 0;
        for (String parameter : optional) {
            types.add(parameterType(parameter));
            if (named && parameter.trim().startsWith("required ")) {
                requiredNamed++;
            }
        }
        function.parameterTypes(types)
                .minArity(positional.size() + requiredNamed)
                .maxArity(positional.size() + optional.size());
    }

    private static String parameterType(String parameter) {
        String declaration = parameter.trim();
        int equals = declaration.indexOf('=');
        if (equals >= 0) {
            declaration = declaration.substring(0, equals).trim();
        }
        for (String prefix : List.of("required ", "covariant ", "final ")) {
            if (declaration.startsWith(prefix)) {
                declaration = declaration.substring(prefix.length()).trim();
            }
        }
        if (declaration.startsWith("this.") || declaration.startsWith("super.")) {
            return "?";
        }
        int lastSpace = declaration.lastIndexOf(' ');
        return lastSpace > 0 ? declaration.substring(0, lastSpace).trim() : "dynamic";
    }

    private static int firstTopLevel(String text, char first, char second) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (depth == 0 && (c == first || c == second)) {
                return i;
            }
            if (c == '(' || c == '<' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == '>' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            }
        }
        return -1;
    }

    // ========================= FIELDS =========================

    @Override
    protected List<FieldDecl> findFields(String text) {
        List<FieldDecl> fields = new ArrayList<>();
        Matcher matcher = FIELD_PATTERN.matcher(text);
        while (matcher.find()) {
            List<String> modifiers = words(matcher.group(1));
            String type = matcher.group(2);
            if (Set.of("final", "const", "var", "late", "static").contains(type)) {
                modifiers.add(type);
                type = null;
            } else if (STATEMENT_WORDS.contains(type) || CALL_KEYWORDS.contains(type)) {
                continue;
            }
            String name = matcher.group(3);
            fields.add(FieldDecl.builder()
                    .name(name)
                    .type(type)
                    .visibility(name.startsWith("_") ? Visibility.PRIVATE : Visibility.PUBLIC)
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
        return function.getReturnType() != null ? function.getReturnType() + " " + signature : signature;
    }
}
