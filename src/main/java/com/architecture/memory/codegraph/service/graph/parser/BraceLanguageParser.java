package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.model.graph.Visibility;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based parser for languages with C-like braces. Subclasses find type, function and field
 * declarations with regular expressions; this class nests them by body ranges, assigns ids and
 * collects call sites inside function bodies.
 *
 * Constructs the patterns do not recognize are simply left out. This is a best-effort extraction,
 * not a grammar.
 */
public abstract class BraceLanguageParser extends AbstractLanguageParser {

    private static final Pattern CALL_PATTERN = Pattern.compile("(?<![\\w$])([A-Za-z_$][\\w$]*)\\s*\\(");

    protected final CanonicalIdGenerator idGenerator;

    protected BraceLanguageParser(CanonicalIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    // ========================= LANGUAGE HOOKS =========================

    /**
     * Package or library name used as qualified-name prefix, empty if none.
     */
    protected abstract String namespaceOf(String text, String relativePath);

    protected abstract List<TypeDecl> findTypes(String text);

    protected abstract List<FunctionDecl> findFunctions(String text);

    protected abstract List<FieldDecl> findFields(String text);

    /**
     * Identifiers followed by '(' that are not calls (control flow keywords and the like).
     */
    protected abstract Set<String> callKeywords();

    protected abstract String formatSignature(FunctionDecl function);

    // ========================= EXTRACTION =========================

    @Override
    protected void parseSource(ParseBatch batch, String relativePath, String content) {
        String text = SourceText.blankOut(content, SourceText.Syntax.C_LIKE);
        int[] lines = SourceText.lineOffsets(text);
        CodeEntity file = batch.addFile(relativePath, lines.length);
        String namespace = namespaceOf(text, relativePath);

        List<TypeDecl> types = new ArrayList<>(findTypes(text));
        types.sort(Comparator.comparingInt(TypeDecl::getStart));
        Map<TypeDecl, CodeEntity> typeEntities = new IdentityHashMap<>();
        for (TypeDecl type : types) {
            declareType(batch, relativePath, lines, file, namespace, types, typeEntities, type);
        }

        List<FunctionDecl> functions = new ArrayList<>(findFunctions(text));
        functions.sort(Comparator.comparingInt(FunctionDecl::getStart));
        List<FunctionDecl> accepted = new ArrayList<>();
        Map<FunctionDecl, CodeEntity> functionEntities = new IdentityHashMap<>();
        for (FunctionDecl function : functions) {
            if (insideAny(accepted, function.getStart())) {
                // local function: its calls count for the enclosing function
                continue;
            }
            TypeDecl ownerType = innermostType(types, function.getStart());
            CodeEntity owner = ownerType != null ? typeEntities.get(ownerType) : file;
            if (owner == null) {
                continue;
            }
            CodeEntity method = declareFunction(batch, relativePath, lines, namespace, owner, ownerType, function);
            if (method != null) {
                accepted.add(function);
                functionEntities.put(function, method);
            }
        }

        for (FieldDecl field : findFields(text)) {
            if (insideAny(accepted, field.getStart())) {
                continue;
            }
            TypeDecl ownerType = innermostType(types, field.getStart());
            if (ownerType == null || typeEntities.get(ownerType) == null) {
                continue;
            }
            declareField(batch, relativePath, lines, typeEntities.get(ownerType), field);
        }

        for (FunctionDecl function : accepted) {
            if (function.getBodyStart() >= 0) {
                CodeEntity method = functionEntities.get(function);
                collectCalls(batch, text, lines, method, method.getParentId(), function);
            }
        }
    }

    private void declareType(ParseBatch batch, String relativePath, int[] lines, CodeEntity file, String namespace,
                             List<TypeDecl> types, Map<TypeDecl, CodeEntity> typeEntities, TypeDecl type) {
        TypeDecl parentType = innermostType(types, type.getStart());
        CodeEntity parent = parentType != null ? typeEntities.get(parentType) : file;
        if (parent == null) {
            return;
        }
        String qualifiedName = qualify(parentType != null ? parent.getQualifiedName() : namespace, type.getName());
        int startLine = SourceText.lineAt(lines, type.getStart());
        CodeEntity entity = CodeEntity.builder()
                .id(idGenerator.generateEntityId(batch.getLanguage(), type.getKind(), relativePath, qualifiedName))
                .kind(type.getKind())
                .name(type.getName())
                .qualifiedName(qualifiedName)
                .filePath(relativePath)
                .startLine(startLine)
                .endLine(type.getBodyEnd() >= 0 ? SourceText.lineAt(lines, type.getBodyEnd()) : startLine)
                .visibility(type.getVisibility())
                .modifiers(new ArrayList<>(type.getModifiers()))
                .build();
        if (!batch.addEntity(entity, parent.getId())) {
            return;
        }
        typeEntities.put(type, entity);
        for (SuperRef superRef : type.getSupertypes()) {
            batch.addTypeReference(RawTypeReference.builder()
                    .sourceId(entity.getId())
                    .typeName(superRef.getName())
                    .relationshipType(superRef.getRelationshipType())
                    .line(startLine)
                    .build());
        }
    }

    private CodeEntity declareFunction(ParseBatch batch, String relativePath, int[] lines, String namespace,
                                       CodeEntity owner, TypeDecl ownerType, FunctionDecl function) {
        String ownerQualifiedName = ownerType != null ? owner.getQualifiedName() : namespace;
        String qualifiedName = qualify(ownerQualifiedName, function.getName());
        List<String> modifiers = new ArrayList<>(function.getModifiers());
        if (ownerType != null && isConstructorName(function.getName(), ownerType.getName()) && !modifiers.contains("constructor")) {
            modifiers.add("constructor");
        }
        int startLine = SourceText.lineAt(lines, function.getStart());
        CodeEntity method = CodeEntity.builder()
                .id(idGenerator.generateMethodId(batch.getLanguage(), relativePath, qualifiedName, function.getParameterTypes()))
                .kind(EntityKind.METHOD)
                .name(function.getName())
                .qualifiedName(qualifiedName)
                .filePath(relativePath)
                .startLine(startLine)
                .endLine(function.getBodyEnd() >= 0 ? SourceText.lineAt(lines, function.getBodyEnd()) : startLine)
                .visibility(function.getVisibility())
                .signature(formatSignature(function))
                .returnType(function.getReturnType())
                .parameterTypes(new ArrayList<>(function.getParameterTypes()))
                .modifiers(modifiers)
                .build();
        if (!batch.declareMethod(method, owner, function.getMinArity(), function.getMaxArity())) {
            return null;
        }
        addTypeUse(batch, method.getId(), function.getReturnType(), startLine);
        for (String parameterType : function.getParameterTypes()) {
            addTypeUse(batch, method.getId(), parameterType, startLine);
        }
        return method;
    }

    private void declareField(ParseBatch batch, String relativePath, int[] lines, CodeEntity owner, FieldDecl field) {
        String qualifiedName = qualify(owner.getQualifiedName(), field.getName());
        int line = SourceText.lineAt(lines, field.getStart());
        CodeEntity entity = CodeEntity.builder()
                .id(idGenerator.generateEntityId(batch.getLanguage(), EntityKind.FIELD, relativePath, qualifiedName))
                .kind(EntityKind.FIELD)
                .name(field.getName())
                .qualifiedName(qualifiedName)
                .filePath(relativePath)
                .startLine(line)
                .endLine(line)
                .visibility(field.getVisibility())
                .returnType(field.getType())
                .modifiers(new ArrayList<>(field.getModifiers()))
                .build();
        if (batch.addEntity(entity, owner.getId())) {
            addTypeUse(batch, entity.getId(), field.getType(), line);
        }
    }

    private void addTypeUse(ParseBatch batch, String sourceId, String type, int line) {
        String simple = SourceText.simpleTypeName(type);
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

    private void collectCalls(ParseBatch batch, String text, int[] lines, CodeEntity caller, String ownerId,
                              FunctionDecl function) {
        int end = Math.min(function.getBodyEnd() + 1, text.length());
        Matcher matcher = CALL_PATTERN.matcher(text);
        matcher.region(Math.min(function.getBodyStart() + 1, end), end);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (callKeywords().contains(name)) {
                continue;
            }
            String previousWord = previousWord(text, matcher.start());
            if ("fun".equals(previousWord)) {
                continue;
            }
            int line = SourceText.lineAt(lines, matcher.start());
            RawCall.RawCallBuilder call = RawCall.builder()
                    .callerId(caller.getId())
                    .callerOwnerId(ownerId)
                    .calleeName(name)
                    .arity(SourceText.countArguments(text, matcher.end() - 1))
                    .line(line);

            String receiver = receiverBefore(text, matcher.start());
            if (receiver == null) {
                call.receiverKind(RawCall.ReceiverKind.NONE).implicitSelf(true);
                if (Character.isUpperCase(name.charAt(0)) || "new".equals(previousWord)) {
                    batch.addTypeReference(RawTypeReference.builder()
                            .sourceId(caller.getId())
                            .typeName(name)
                            .relationshipType(RelationshipType.REFERENCES)
                            .line(line)
                            .build());
                }
            } else if ("this".equals(receiver)) {
                call.receiverKind(RawCall.ReceiverKind.SELF);
            } else if (Character.isUpperCase(receiver.charAt(0))) {
                call.receiverKind(RawCall.ReceiverKind.NAMED).receiverType(receiver);
            } else {
                call.receiverKind(RawCall.ReceiverKind.UNKNOWN);
            }
            batch.addCall(call.build());
        }
    }

    /**
     * The identifier before a '.', '?.' or '!!.' preceding {@code index}; "" for a chained
     * expression; null if the call has no receiver.
     */
    static String receiverBefore(String text, int index) {
        int i = index - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        if (i < 0 || text.charAt(i) != '.') {
            return null;
        }
        i--;
        while (i >= 0 && (text.charAt(i) == '?' || text.charAt(i) == '!')) {
            i--;
        }
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        int end = i + 1;
        while (i >= 0 && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_' || text.charAt(i) == '$')) {
            i--;
        }
        String receiver = text.substring(i + 1, end);
        return receiver.isEmpty() ? "" : receiver;
    }

    private static String previousWord(String text, int index) {
        int i = index - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        int end = i + 1;
        while (i >= 0 && Character.isLetter(text.charAt(i))) {
            i--;
        }
        return text.substring(i + 1, end);
    }

    // ========================= STRUCTURE HELPERS =========================

    /**
     * Index of the '{' opening the body after a declaration header, or -1 if the header ends first.
     */
    protected static int findBodyStart(String text, int from) {
        int end = headerEnd(text, from);
        return end < text.length() && text.charAt(end) == '{' ? end : -1;
    }

    /**
     * Index where a declaration header stops: its body '{', or a ';', '=', '}' or line break
     * (one that does not continue the header) outside brackets. Text length if none.
     */
    protected static int headerEnd(String text, int from) {
        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c == '-' || c == '=') && i + 1 < text.length() && text.charAt(i + 1) == '>') {
                if (c == '=' && depth == 0) {
                    return i;
                }
                i++;
                continue;
            }
            if (c == '(' || c == '<' || c == '[') {
                depth++;
            } else if (c == ')' || c == '>' || c == ']') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                if (c == '{' || c == ';' || c == '=' || c == '}') {
                    return i;
                }
                if (c == '\n' && !headerContinues(text, i)) {
                    return i;
                }
            }
        }
        return text.length();
    }

    private static boolean headerContinues(String text, int newline) {
        int before = newline - 1;
        while (before >= 0 && Character.isWhitespace(text.charAt(before))) {
            before--;
        }
        if (before >= 0 && (text.charAt(before) == ',' || text.charAt(before) == ':')) {
            return true;
        }
        int next = SourceText.skipWhitespace(text, newline);
        if (next >= text.length()) {
            return false;
        }
        char c = text.charAt(next);
        return c == ':' || c == ',' || c == '{' || c == '.'
                || text.startsWith("where", next) || text.startsWith("extends", next)
                || text.startsWith("implements", next) || text.startsWith("with", next)
                || text.startsWith("on ", next);
    }

    /**
     * End of an expression body starting at {@code from}: the first ';' or line break outside brackets.
     */
    protected static int expressionEnd(String text, int from) {
        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    return i - 1;
                }
                depth--;
            } else if (depth == 0 && (c == ';' || c == '\n')) {
                return i;
            }
        }
        return text.length() - 1;
    }

    private static TypeDecl innermostType(List<TypeDecl> types, int offset) {
        TypeDecl innermost = null;
        for (TypeDecl type : types) {
            if (type.getBodyStart() >= 0 && type.getBodyStart() < offset && offset < type.getBodyEnd()) {
                if (innermost == null || type.getBodyStart() > innermost.getBodyStart()) {
                    innermost = type;
                }
            }
        }
        return innermost;
    }

    private static boolean insideAny(List<FunctionDecl> functions, int offset) {
        for (FunctionDecl function : functions) {
            if (function.getBodyStart() >= 0 && function.getBodyStart() < offset && offset <= function.getBodyEnd()) {
                return true;
            }
        }
        return false;
    }

    protected boolean isConstructorName(String functionName, String typeName) {
        return functionName.equals(typeName) || functionName.startsWith(typeName + ".");
    }

    protected static String qualify(String prefix, String name) {
        return prefix == null || prefix.isEmpty() ? name : prefix + "." + name;
    }

    protected static Visibility visibilityFrom(List<String> modifiers, Visibility fallback) {
        for (String modifier : modifiers) {
            switch (modifier) {
                case "public":
                    return Visibility.PUBLIC;
                case "private":
                    return Visibility.PRIVATE;
                case "protected":
                    return Visibility.PROTECTED;
                case "internal":
                    return Visibility.PACKAGE;
                default:
                    break;
            }
        }
        return fallback;
    }

    protected static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        if (text != null) {
            for (String word : text.trim().split("\\s+")) {
                if (!word.isEmpty()) {
                    words.add(word);
                }
            }
        }
        return words;
    }

    // ========================= DECLARATIONS =========================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    protected static class TypeDecl {
        private String name;
        private EntityKind kind;
        private Visibility visibility;
        @Builder.Default
        private List<String> modifiers = new ArrayList<>();
        private int start;
        @Builder.Default
        private int bodyStart = -1;
        @Builder.Default
        private int bodyEnd = -1;
        @Builder.Default
        private List<SuperRef> supertypes = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    protected static class FunctionDecl {
        private String name;
        private Visibility visibility;
        @Builder.Default
        private List<String> modifiers = new ArrayList<>();
        private int start;
        @Builder.Default
        private int bodyStart = -1;
        @Builder.Default
        private int bodyEnd = -1;
        private String returnType;
        @Builder.Default
        private List<String> parameterTypes = new ArrayList<>();
        private int minArity;
        private int maxArity;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    protected static class FieldDecl {
        private String name;
        private String type;
        private Visibility visibility;
        @Builder.Default
        private List<String> modifiers = new ArrayList<>();
        private int start;
    }

    @Data
    @AllArgsConstructor
    protected static class SuperRef {
        private String name;
        private RelationshipType relationshipType;
    }
}
