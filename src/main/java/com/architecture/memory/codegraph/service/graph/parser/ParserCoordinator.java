package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.ProjectSource;
import com.architecture.memory.codegraph.dto.parse.CoordinatorResult;
import com.architecture.memory.codegraph.dto.parse.LanguageParseResult;
import com.architecture.memory.codegraph.dto.parse.ParseError;
import com.architecture.memory.codegraph.exception.SourceTreeException;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Dispatches the files of a project to the language parsers and merges their results.
 *
 * Each language runs as one task on the parser pool and owns its own {@link ParseBatch}; results
 * are merged in language order once every task has finished. Only an unreadable project root
 * fails the call. Everything else, from unsupported files to a crashed parser, ends up as
 * warnings or parse errors in the result.
 */
@Service
@Slf4j
public class ParserCoordinator {

    private final ParserRegistry parserRegistry;
    private final CanonicalIdGenerator idGenerator;
    private final CodeGraphProperties properties;
    private final Executor parserExecutor;

    public ParserCoordinator(ParserRegistry parserRegistry,
                             CanonicalIdGenerator idGenerator,
                             CodeGraphProperties properties,
                             @Qualifier("parserExecutor") Executor parserExecutor) {
        this.parserRegistry = parserRegistry;
        this.idGenerator = idGenerator;
        this.properties = properties;
        this.parserExecutor = parserExecutor;
    }

    public CoordinatorResult coordinate(String projectId, ProjectSource source) {
        return coordinate(projectId, source.getRootPath(), source.getLanguages(), source.getFiles());
    }

    /**
     * @param languages language tags or aliases to parse; empty means every registered language
     * @param files     file paths, absolute or relative to {@code rootPath}
     * @throws SourceTreeException if {@code rootPath} is not a readable directory
     */
    public CoordinatorResult coordinate(String projectId, String rootPath, List<String> languages, List<String> files) {
        long start = System.currentTimeMillis();
        Path root = resolveRoot(rootPath);
        log.info("[ckg-coordinator] Coordinating parse of project {}: {} file(s), languages {}",
                projectId, files.size(), languages);

        CoordinatorResult result = CoordinatorResult.builder().projectId(projectId).build();

        Set<String> requested = requestedLanguages(languages, result);
        Map<String, List<Path>> filesByLanguage = groupByLanguage(root, files, requested, result);

        ParseContext context = ParseContext.builder()
                .projectId(projectId)
                .rootPath(root)
                .idGenerator(idGenerator)
                .includeParameters(properties.getParser().isIncludeParameters())
                .javaComplianceLevel(properties.getParser().getJavaComplianceLevel())
                .build();

        Map<String, CompletableFuture<LanguageParseResult>> tasks = new TreeMap<>();
        filesByLanguage.forEach((language, languageFiles) -> {
            LanguageParser parser = parserRegistry.getParser(language);
            tasks.put(language, CompletableFuture.supplyAsync(() -> parser.parseFiles(context, languageFiles), parserExecutor));
        });

        tasks.forEach((language, task) -> merge(result, collect(language, task, context, filesByLanguage.get(language))));

        result.setDurationMs(System.currentTimeMillis() - start);
        logSummary(result);
        return result;
    }

    // ========================= INPUT =========================

    private Path resolveRoot(String rootPath) {
        if (rootPath == null || rootPath.isBlank()) {
            throw new SourceTreeException("Project root path is empty");
        }
        Path root;
        try {
            root = Path.of(rootPath).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new SourceTreeException("Invalid project root path: " + rootPath, e);
        }
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new SourceTreeException("Project root is not a readable directory: " + rootPath);
        }
        try {
            return root.toRealPath();
        } catch (IOException e) {
            throw new SourceTreeException("Cannot resolve project root: " + rootPath, e);
        }
    }

    private Set<String> requestedLanguages(List<String> languages, CoordinatorResult result) {
        Set<String> requested = new LinkedHashSet<>();
        if (languages == null || languages.isEmpty()) {
            requested.addAll(parserRegistry.getSupportedLanguages());
            return requested;
        }
        for (String language : languages) {
            if (parserRegistry.hasParser(language)) {
                requested.add(parserRegistry.canonicalLanguage(language));
            } else {
                String warning = "No parser available for language: " + language;
                result.getWarnings().add(warning);
                log.warn("[ckg-coordinator] {}", warning);
            }
        }
        return requested;
    }

    private Map<String, List<Path>> groupByLanguage(Path root, List<String> files, Set<String> requested,
                                                    CoordinatorResult result) {
        Map<String, List<Path>> filesByLanguage = new TreeMap<>();
        Map<String, Integer> skippedByExtension = new TreeMap<>();
        for (String file : files) {
            Path path = Path.of(file);
            Path resolved = path.isAbsolute() ? path : root.resolve(path);
            String extension = extensionOf(resolved);
            Optional<LanguageParser> parser = parserRegistry.findByExtension(extension);
            if (parser.isEmpty() || !requested.contains(parser.get().getLanguage())) {
                skippedByExtension.merge(extension.isEmpty() ? "(none)" : "." + extension, 1, Integer::sum);
                continue;
            }
            filesByLanguage.computeIfAbsent(parser.get().getLanguage(), k -> new ArrayList<>()).add(resolved);
        }
        skippedByExtension.forEach((extension, count) -> {
            result.setFilesSkipped(result.getFilesSkipped() + count);
            String note = String.format("Skipped %d file(s) with unsupported language: %s", count, extension);
            result.getWarnings().add(note);
            log.debug("[ckg-coordinator] {}", note);
        });
        return filesByLanguage;
    }

    private static String extensionOf(Path file) {
        Path fileName = file.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1) : "";
    }

    // ========================= MERGE =========================

    /**
     * Waits for one language task. A parser that throws is reported as a parse error for each of its files.
     */
    private LanguageParseResult collect(String language, CompletableFuture<LanguageParseResult> task,
                                        ParseContext context, List<Path> files) {
        try {
            return task.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[ckg-coordinator] Parser for {} failed on {} file(s)", language, files.size(), cause);
            List<ParseError> errors = files.stream()
                    .map(file -> ParseError.of(context.relativePath(file), language,
                            "Parser failed: " + cause.getMessage()))
                    .toList();
            return LanguageParseResult.builder()
                    .language(language)
                    .parserVersion(parserRegistry.getParser(language).getParserVersion())
                    .errors(new ArrayList<>(errors))
                    .filesProcessed(files.size())
                    .build();
        }
    }

    private void merge(CoordinatorResult result, LanguageParseResult languageResult) {
        result.getEntities().addAll(languageResult.getEntities());
        result.getRelationships().addAll(languageResult.getRelationships());
        result.getErrors().addAll(languageResult.getErrors());
        result.getPerLanguageStats().put(languageResult.getLanguage(), languageResult.toStats());
        result.setFilesProcessed(result.getFilesProcessed() + languageResult.getFilesProcessed());
    }

    private void logSummary(CoordinatorResult result) {
        log.info("[ckg-coordinator] Project {} parsed in {} ms: {} file(s), {} skipped, {} entities, {} relationships, {} error(s)",
                result.getProjectId(), result.getDurationMs(), result.getFilesProcessed(), result.getFilesSkipped(),
                result.getEntities().size(), result.getRelationships().size(), result.getErrors().size());
        if (result.getDurationMs() > properties.getSlowOperationThresholdMs()) {
            log.warn("[ckg-coordinator] Slow parse for project {}: {} ms (threshold {} ms)",
                    result.getProjectId(), result.getDurationMs(), properties.getSlowOperationThresholdMs());
        }
    }
}
