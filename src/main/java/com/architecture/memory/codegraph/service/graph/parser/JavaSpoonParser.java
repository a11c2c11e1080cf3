package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.dto.parse.LanguageParseResult;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.model.graph.Visibility;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jdt.core.compiler.CategorizedProblem;
import org.eclipse.jdt.core.compiler.IProblem;
import org.springframework.stereotype.Service;
import spoon.Launcher;
import spoon.reflect.CtModel;
import spoon.reflect.code.CtConstructorCall;
import spoon.reflect.code.CtExpression;
import spoon.reflect.code.CtInvocation;
import spoon.reflect.code.CtThisAccess;
import spoon.reflect.code.CtTypeAccess;
import spoon.reflect.declaration.CtAnnotation;
import spoon.reflect.declaration.CtAnnotationType;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtEnum;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtField;
import spoon.reflect.declaration.CtInterface;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtModifiable;
import spoon.reflect.declaration.CtParameter;
import spoon.reflect.declaration.CtRecord;
import spoon.reflect.declaration.CtType;
import spoon.reflect.declaration.CtTypeMember;
import spoon.reflect.declaration.ModifierKind;
import spoon.reflect.reference.CtArrayTypeReference;
import spoon.reflect.reference.CtExecutableReference;
import spoon.reflect.reference.CtTypeReference;
import spoon.support.compiler.VirtualFile;
import spoon.support.compiler.jdt.JDTBasedSpoonCompiler;

import java.io.File;
import java.nio.charset.MalformedInputException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Java parser backed by a Spoon model.
 *
 * All files of a scan go into one Spoon model so that type references across files resolve.
 * No-classpath compilation recovers from syntax errors, so those are read back from the compiler
 * and reported per file while the recovered declarations are kept. If the model cannot be built
 * at all, every file is parsed again on its own and only the broken ones are reported.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JavaSpoonParser extends AbstractLanguageParser {

    private static final String LANGUAGE = "java";

    private final CanonicalIdGenerator idGenerator;

    @Override
    public String getLanguage() {
        return LANGUAGE;
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of(LANGUAGE);
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("jav");
    }

    @Override
    public String getParserVersion() {
        return "spoon-10.4.2";
    }

    // ========================= BATCH MODEL =========================

    @Override
    public LanguageParseResult parseFiles(ParseContext context, List<Path> files) {
        long start = System.currentTimeMillis();
        ParseBatch batch = new ParseBatch(context, LANGUAGE);

        Map<Path, String> readable = new LinkedHashMap<>();
        for (Path file : files) {
            String relativePath = context.relativePath(file);
            try {
                readable.put(file, readSource(file));
            } catch (NoSuchFileException e) {
                recordError(batch, relativePath, "File not found: " + relativePath, e);
            } catch (MalformedInputException e) {
                recordError(batch, relativePath, "Encoding error in " + relativePath + ": not valid UTF-8", e);
            } catch (Exception e) {
                recordError(batch, relativePath, "Failed to read " + relativePath + ": " + e.getMessage(), e);
            }
        }

        CtModel model = null;
        Launcher launcher = newLauncher(context);
        if (!readable.isEmpty()) {
            try {
                model = buildModel(launcher, readable);
            } catch (Exception e) {
                log.warn("[ckg-parser:java] Could not build a model over {} file(s), parsing files one by one: {}",
                        readable.size(), e.getMessage());
            }
        }

        if (model == null && !readable.isEmpty()) {
            batch = new ParseBatch(context, LANGUAGE);
            for (Path file : files) {
                parseFileSafely(batch, file);
            }
        } else if (model != null) {
            Map<String, CodeEntity> fileEntities = new LinkedHashMap<>();
            for (Map.Entry<Path, String> entry : readable.entrySet()) {
                String relativePath = context.relativePath(entry.getKey());
                fileEntities.put(relativePath, batch.addFile(relativePath, SourceText.lineCount(entry.getValue())));
            }
            for (CtType<?> type : model.getAllTypes()) {
                String relativePath = relativePathOf(context, type);
                CodeEntity file = relativePath != null ? fileEntities.get(relativePath) : null;
                if (file == null) {
                    String message = "No source file under the project root for type " + type.getQualifiedName()
                            + (relativePath != null ? " (" + relativePath + ")" : "");
                    batch.addError(relativePath != null ? relativePath : type.getQualifiedName(), message, 0);
                    log.warn("[ckg-parser:java] {}, skipped", message);
                    continue;
                }
                declareType(batch, type, relativePath, file);
            }
            reportSyntaxProblems(batch, launcher, null);
        }

        LanguageParseResult result = batch.complete(getParserVersion(), System.currentTimeMillis() - start);
        log.info("[ckg-parser:java] Parsed {} file(s): {} entities, {} relationships, {} error(s) in {} ms",
                result.getFilesProcessed(), result.getEntities().size(), result.getRelationships().size(),
                result.getErrors().size(), result.getDurationMs());
        return result;
    }

    private CtModel buildModel(Launcher launcher, Map<Path, String> sources) {
        for (Path file : sources.keySet()) {
            launcher.addInputResource(file.toString());
        }
        return launcher.buildModel();
    }

    private Launcher newLauncher(ParseContext context) {
        Launcher launcher = new Launcher();
        launcher.getEnvironment().setNoClasspath(true);
        launcher.getEnvironment().setComplianceLevel(context.getJavaComplianceLevel());
        launcher.getEnvironment().setIgnoreDuplicateDeclarations(true);
        launcher.getEnvironment().setCommentEnabled(false);
        return launcher;
    }

    /**
     * Single-file fallback: the file is compiled alone, so only references within it and
     * simple-name matches across the batch resolve.
     */
    @Override
    protected void parseSource(ParseBatch batch, String relativePath, String content) {
        Launcher launcher = newLauncher(batch.getContext());
        launcher.addInputResource(new VirtualFile(content, relativePath));
        CtModel model = launcher.buildModel();
        CodeEntity file = batch.addFile(relativePath, SourceText.lineCount(content));
        for (CtType<?> type : model.getAllTypes()) {
            declareType(batch, type, relativePath, file);
        }
        reportSyntaxProblems(batch, launcher, relativePath);
    }

    /**
     * Records one parse error per syntax problem the compiler recovered from. Unresolved types
     * are expected without a classpath and are not reported.
     *
     * @param fixedPath file to attribute every problem to, or null to use the problem's own file
     */
    private void reportSyntaxProblems(ParseBatch batch, Launcher launcher, String fixedPath) {
        if (!(launcher.getModelBuilder() instanceof JDTBasedSpoonCompiler)) {
            return;
        }
        JDTBasedSpoonCompiler compiler = (JDTBasedSpoonCompiler) launcher.getModelBuilder();
        for (CategorizedProblem problem : compiler.getProblems()) {
            if (!problem.isError() || (problem.getID() & IProblem.Syntax) == 0) {
                continue;
            }
            String relativePath = fixedPath != null ? fixedPath : originOf(batch.getContext(), problem);
            String message = "Syntax error in " + relativePath + " at line " + problem.getSourceLineNumber()
                    + ": " + problem.getMessage();
            batch.addError(relativePath, message, problem.getSourceLineNumber());
            log.warn("[ckg-parser:java] {}", message);
        }
    }

    private String originOf(ParseContext context, CategorizedProblem problem) {
        char[] origin = problem.getOriginatingFileName();
        return origin != null ? context.relativePath(Path.of(new String(origin))) : "<unknown>";
    }

    private String relativePathOf(ParseContext context, CtType<?> type) {
        try {
            File file = type.getPosition().getFile();
            return file != null ? context.relativePath(file.toPath()) : null;
        } catch (Exception e) {
            return null;
        }
    }

    // ========================= DECLARATIONS =========================

    private void declareType(ParseBatch batch, CtType<?> type, String relativePath, CodeEntity parent) {
        if (type.isImplicit() || type.isAnonymous()) {
            return;
        }
        boolean isInterface = type instanceof CtInterface || type instanceof CtAnnotationType;
        EntityKind kind = isInterface ? EntityKind.INTERFACE : EntityKind.CLASS;
        String qualifiedName = qualifiedNameOf(type.getQualifiedName());

        List<String> modifiers = modifiersOf(type);
        if (type instanceof CtEnum) {
            modifiers.add("enum");
        } else if (type instanceof CtRecord) {
            modifiers.add("record");
        } else if (type instanceof CtAnnotationType) {
            modifiers.add("annotation");
        }

        CodeEntity entity = CodeEntity.builder()
                .id(idGenerator.generateEntityId(LANGUAGE, kind, relativePath, qualifiedName))
                .kind(kind)
                .name(type.getSimpleName())
                .qualifiedName(qualifiedName)
                .filePath(relativePath)
                .startLine(safeGetLine(type))
                .endLine(safeGetEndLine(type))
                .visibility(visibilityOf(type, parent))
                .modifiers(modifiers)
                .build();
        if (!batch.addEntity(entity, parent.getId())) {
            return;
        }

        if (type.getSuperclass() != null) {
            addTypeReference(batch, entity.getId(), type.getSuperclass(), RelationshipType.EXTENDS, entity.getStartLine());
        }
        for (CtTypeReference<?> superInterface : type.getSuperInterfaces()) {
            addTypeReference(batch, entity.getId(), superInterface,
                    isInterface ? RelationshipType.EXTENDS : RelationshipType.IMPLEMENTS, entity.getStartLine());
        }

        for (CtTypeMember member : type.getTypeMembers()) {
            if (member.isImplicit()) {
                continue;
            }
            if (member instanceof CtField) {
                declareField(batch, (CtField<?>) member, relativePath, entity);
            } else if (member instanceof CtMethod) {
                declareExecutable(batch, (CtMethod<?>) member, type.getSimpleName(), false, relativePath, entity);
            } else if (member instanceof CtConstructor) {
                declareExecutable(batch, (CtConstructor<?>) member, type.getSimpleName(), true, relativePath, entity);
            } else if (member instanceof CtType) {
                declareType(batch, (CtType<?>) member, relativePath, entity);
            }
        }
    }

    private void declareField(ParseBatch batch, CtField<?> field, String relativePath, CodeEntity owner) {
        String qualifiedName = owner.getQualifiedName() + "." + field.getSimpleName();
        CodeEntity entity = CodeEntity.builder()
                .id(idGenerator.generateEntityId(LANGUAGE, EntityKind.FIELD, relativePath, qualifiedName))
                .kind(EntityKind.FIELD)
                .name(field.getSimpleName())
                .qualifiedName(qualifiedName)
                .filePath(relativePath)
                .startLine(safeGetLine(field))
                .endLine(safeGetEndLine(field))
                .visibility(visibilityOf(field, owner))
                .returnType(typeName(field.getType()))
                .modifiers(modifiersOf(field))
                .build();
        if (batch.addEntity(entity, owner.getId()) && field.getType() != null) {
            addTypeReference(batch, entity.getId(), field.getType(), RelationshipType.REFERENCES, entity.getStartLine());
        }
    }

    private void declareExecutable(ParseBatch batch, CtExecutable<?> executable, String typeName, boolean constructor,
                                   String relativePath, CodeEntity owner) {
        String name = constructor ? typeName : executable.getSimpleName();
        List<String> parameterTypes = executable.getParameters().stream()
                .map(p -> typeName(p.getType()))
                .toList();
        String qualifiedName = owner.getQualifiedName() + "." + name;
        String returnType = constructor ? null : typeName(executable.getType());

        List<String> modifiers = modifiersOf((CtModifiable) executable);
        if (constructor) {
            modifiers.add("constructor");
        }
        if (hasAnnotation(executable, "Override")) {
            modifiers.add("override");
        }

        String parameters = "(" + String.join(", ", parameterTypes) + ")";
        CodeEntity method = CodeEntity.builder()
                .id(idGenerator.generateMethodId(LANGUAGE, relativePath, qualifiedName, parameterTypes))
                .kind(EntityKind.METHOD)
                .name(name)
                .qualifiedName(qualifiedName)
                .filePath(relativePath)
                .startLine(safeGetLine(executable))
                .endLine(safeGetEndLine(executable))
                .visibility(visibilityOf((CtModifiable) executable, owner))
                .signature(returnType != null ? returnType + " " + name + parameters : name + parameters)
                .returnType(returnType)
                .parameterTypes(new ArrayList<>(parameterTypes))
                .modifiers(modifiers)
                .build();

        int parameterCount = executable.getParameters().size();
        boolean varArgs = parameterCount > 0 && executable.getParameters().get(parameterCount - 1).isVarArgs();
        int minArity = varArgs ? parameterCount - 1 : parameterCount;
        int maxArity = varArgs ? DeclaredMethod.UNBOUNDED : parameterCount;
        if (!batch.declareMethod(method, owner, minArity, maxArity)) {
            return;
        }

        if (!constructor && executable.getType() != null) {
            addTypeReference(batch, method.getId(), executable.getType(), RelationshipType.REFERENCES, method.getStartLine());
        }
        for (CtParameter<?> parameter : executable.getParameters()) {
            if (parameter.getType() != null) {
                addTypeReference(batch, method.getId(), parameter.getType(), RelationshipType.REFERENCES, safeGetLine(parameter));
            }
            if (batch.getContext().isIncludeParameters()) {
                declareParameter(batch, parameter, relativePath, method);
            }
        }

        collectInvocations(batch, executable, method, owner);
    }

    private void declareParameter(ParseBatch batch, CtParameter<?> parameter, String relativePath, CodeEntity method) {
        String qualifiedName = method.getQualifiedName() + "." + parameter.getSimpleName();
        // the method's parameter list keeps parameters of overloads apart
        String key = method.getQualifiedName()
                + "(" + String.join(",", method.getParameterTypes()) + ")." + parameter.getSimpleName();
        CodeEntity entity = CodeEntity.builder()
                .id(idGenerator.generateEntityId(LANGUAGE, EntityKind.PARAMETER, relativePath, key))
                .kind(EntityKind.PARAMETER)
                .name(parameter.getSimpleName())
                .qualifiedName(qualifiedName)
                .filePath(relativePath)
                .startLine(safeGetLine(parameter))
                .endLine(safeGetEndLine(parameter))
                .returnType(typeName(parameter.getType()))
                .build();
        batch.addEntity(entity, method.getId());
    }

    // ========================= CALL SITES =========================

    private void collectInvocations(ParseBatch batch, CtExecutable<?> executable, CodeEntity caller, CodeEntity owner) {
        if (executable.getBody() == null) {
            return;
        }
        executable.getBody().getElements(e -> e instanceof CtInvocation).forEach(element -> {
            CtInvocation<?> invocation = (CtInvocation<?>) element;
            CtExecutableReference<?> execRef = invocation.getExecutable();
            if (execRef == null || execRef.getSimpleName() == null || execRef.getSimpleName().startsWith("<")) {
                return;
            }
            RawCall.RawCallBuilder call = RawCall.builder()
                    .callerId(caller.getId())
                    .callerOwnerId(owner.getId())
                    .calleeName(execRef.getSimpleName())
                    .arity(invocation.getArguments().size())
                    .line(safeGetLine(invocation));

            String declaringType = execRef.getDeclaringType() != null
                    ? qualifiedNameOf(execRef.getDeclaringType().getQualifiedName())
                    : null;
            CtExpression<?> target = invocation.getTarget();
            if (declaringType != null && !declaringType.isEmpty() && !declaringType.startsWith("<")) {
                call.receiverKind(RawCall.ReceiverKind.NAMED).receiverType(declaringType);
            } else if (target == null || target instanceof CtThisAccess) {
                call.receiverKind(RawCall.ReceiverKind.SELF);
            } else if (target instanceof CtTypeAccess && ((CtTypeAccess<?>) target).getAccessedType() != null) {
                call.receiverKind(RawCall.ReceiverKind.NAMED)
                        .receiverType(((CtTypeAccess<?>) target).getAccessedType().getSimpleName());
            } else {
                call.receiverKind(RawCall.ReceiverKind.UNKNOWN);
            }
            batch.addCall(call.build());
        });

        executable.getBody().getElements(e -> e instanceof CtConstructorCall).forEach(element -> {
            CtConstructorCall<?> constructorCall = (CtConstructorCall<?>) element;
            CtTypeReference<?> created = constructorCall.getType();
            if (created == null) {
                return;
            }
            int line = safeGetLine(constructorCall);
            addTypeReference(batch, caller.getId(), created, RelationshipType.REFERENCES, line);
            batch.addCall(RawCall.builder()
                    .callerId(caller.getId())
                    .callerOwnerId(owner.getId())
                    .calleeName(created.getSimpleName())
                    .arity(constructorCall.getArguments().size())
                    .receiverKind(RawCall.ReceiverKind.NAMED)
                    .receiverType(qualifiedNameOf(created.getQualifiedName()))
                    .line(line)
                    .build());
        });
    }

    // ========================= HELPERS =========================

    private void addTypeReference(ParseBatch batch, String sourceId, CtTypeReference<?> type,
                                  RelationshipType relationshipType, int line) {
        if (type == null || type.isPrimitive()) {
            return;
        }
        CtTypeReference<?> referenced = type;
        if (type instanceof CtArrayTypeReference) {
            referenced = ((CtArrayTypeReference<?>) type).getArrayType();
        }
        if (referenced == null || referenced.isPrimitive()) {
            return;
        }
        batch.addTypeReference(RawTypeReference.builder()
                .sourceId(sourceId)
                .typeName(qualifiedNameOf(referenced.getQualifiedName()))
                .relationshipType(relationshipType)
                .line(line)
                .build());
    }

    private static String qualifiedNameOf(String spoonName) {
        return spoonName == null ? null : spoonName.replace('$', '.');
    }

    private static String typeName(CtTypeReference<?> type) {
        return type == null ? "?" : type.getSimpleName();
    }

    private static List<String> modifiersOf(CtModifiable element) {
        return element.getModifiers().stream()
                .map(ModifierKind::toString)
                .sorted()
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static Visibility visibilityOf(CtModifiable element, CodeEntity owner) {
        ModifierKind visibility = element.getVisibility();
        if (visibility == null) {
            // members of an interface are implicitly public
            return owner.getKind() == EntityKind.INTERFACE ? Visibility.PUBLIC : Visibility.PACKAGE;
        }
        return switch (visibility) {
            case PUBLIC -> Visibility.PUBLIC;
            case PRIVATE -> Visibility.PRIVATE;
            case PROTECTED -> Visibility.PROTECTED;
            default -> Visibility.PACKAGE;
        };
    }

    private static boolean hasAnnotation(CtElement element, String simpleName) {
        for (CtAnnotation<?> annotation : element.getAnnotations()) {
            if (annotation.getAnnotationType() != null
                    && simpleName.equals(annotation.getAnnotationType().getSimpleName())) {
                return true;
            }
        }
        return false;
    }

    private int safeGetLine(CtElement element) {
        try { return element.getPosition().getLine(); } catch (Exception e) { return 0; }
    }

    private int safeGetEndLine(CtElement element) {
        try { return element.getPosition().getEndLine(); } catch (Exception e) { return 0; }
    }
}
