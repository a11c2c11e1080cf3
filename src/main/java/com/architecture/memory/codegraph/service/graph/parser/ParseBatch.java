package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.dto.parse.LanguageParseResult;
import com.architecture.memory.codegraph.dto.parse.ParseError;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Confidence;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.Relationship;
import com.architecture.memory.codegraph.model.graph.Visibility;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result buffers of one language parser for one scan. Owned by a single worker thread,
 * so nothing here is synchronized. Declaration order is preserved everywhere: it is the
 * tie-break order used by {@link CallResolver}.
 */
@Slf4j
public class ParseBatch {

    @Getter
    private final ParseContext context;

    @Getter
    private final String language;

    private final Map<String, CodeEntity> entities = new LinkedHashMap<>();
    private final Map<String, Relationship> relationships = new LinkedHashMap<>();
    private final List<ParseError> errors = new ArrayList<>();

    private final List<DeclaredMethod> methods = new ArrayList<>();
    private final Map<String, List<CodeEntity>> typesBySimpleName = new LinkedHashMap<>();
    private final Map<String, CodeEntity> typesByQualifiedName = new LinkedHashMap<>();

    private final List<RawCall> calls = new ArrayList<>();
    private final List<RawTypeReference> typeReferences = new ArrayList<>();

    @Getter
    private int filesProcessed;

    public ParseBatch(ParseContext context, String language) {
        this.context = context;
        this.language = language;
    }

    // ========================= ENTITIES =========================

    public CodeEntity addFile(String relativePath, int lineCount) {
        filesProcessed++;
        String fileName = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        CodeEntity file = CodeEntity.builder()
                .id(context.getIdGenerator().generateFileId(language, relativePath))
                .kind(EntityKind.FILE)
                .name(fileName)
                .qualifiedName(relativePath)
                .filePath(relativePath)
                .startLine(1)
                .endLine(lineCount)
                .visibility(Visibility.DEFAULT)
                .language(language)
                .build();
        entities.putIfAbsent(file.getId(), file);
        return file;
    }

    /**
     * Add an entity contained by {@code parentId}. Types are indexed for reference resolution.
     *
     * @return false if an entity with the same id was already declared in this batch
     */
    public boolean addEntity(CodeEntity entity, String parentId) {
        entity.setParentId(parentId);
        entity.setLanguage(language);
        if (entities.putIfAbsent(entity.getId(), entity) != null) {
            log.debug("[ckg-parser:{}] Duplicate declaration ignored: {}", language, entity.getId());
            return false;
        }
        if (parentId != null) {
            addRelationship(Relationship.contains(parentId, entity.getId(), entity.getStartLine()));
        }
        if (entity.getKind() != null && entity.getKind().isType()) {
            typesBySimpleName.computeIfAbsent(entity.getName(), k -> new ArrayList<>()).add(entity);
            typesByQualifiedName.putIfAbsent(entity.getQualifiedName(), entity);
        }
        return true;
    }

    /**
     * Add a method entity and register it as a call target.
     */
    public boolean declareMethod(CodeEntity method, CodeEntity owner, int minArity, int maxArity) {
        if (!addEntity(method, owner.getId())) {
            return false;
        }
        methods.add(DeclaredMethod.builder()
                .entity(method)
                .ownerId(owner.getId())
                .ownerQualifiedName(owner.getQualifiedName())
                .topLevel(owner.getKind() == EntityKind.FILE)
                .minArity(minArity)
                .maxArity(maxArity)
                .build());
        return true;
    }

    public CodeEntity getEntity(String id) {
        return entities.get(id);
    }

    // ========================= RELATIONSHIPS =========================

    /**
     * Add a relationship, keeping the first occurrence. An exact edge replaces an earlier heuristic one.
     */
    public void addRelationship(Relationship relationship) {
        String key = relationship.key();
        Relationship existing = relationships.get(key);
        if (existing == null) {
            relationships.put(key, relationship);
        } else if (existing.getConfidence() == Confidence.HEURISTIC
                && relationship.getConfidence() == Confidence.EXACT) {
            existing.setConfidence(Confidence.EXACT);
        }
    }

    public void addCall(RawCall call) {
        calls.add(call);
    }

    public void addTypeReference(RawTypeReference reference) {
        if (reference.getTypeName() != null && !reference.getTypeName().isBlank()) {
            typeReferences.add(reference);
        }
    }

    public void addError(String filePath, String message, int line) {
        errors.add(ParseError.builder()
                .filePath(filePath)
                .language(language)
                .message(message)
                .line(line)
                .build());
    }

    // ========================= RESOLUTION INPUTS =========================

    List<DeclaredMethod> getMethods() {
        return Collections.unmodifiableList(methods);
    }

    List<RawCall> getCalls() {
        return Collections.unmodifiableList(calls);
    }

    List<RawTypeReference> getTypeReferences() {
        return Collections.unmodifiableList(typeReferences);
    }

    List<CodeEntity> typesNamed(String simpleName) {
        return typesBySimpleName.getOrDefault(simpleName, List.of());
    }

    CodeEntity typeWithQualifiedName(String qualifiedName) {
        return typesByQualifiedName.get(qualifiedName);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Resolve pending calls and type references, then package everything as a result.
     */
    public LanguageParseResult complete(String parserVersion, long durationMs) {
        new CallResolver().resolve(this);
        return LanguageParseResult.builder()
                .language(language)
                .parserVersion(parserVersion)
                .entities(new ArrayList<>(entities.values()))
                .relationships(new ArrayList<>(relationships.values()))
                .errors(new ArrayList<>(errors))
                .filesProcessed(filesProcessed)
                .durationMs(durationMs)
                .build();
    }
}
