package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.dto.parse.LanguageParseResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Parses files one at a time into a shared {@link ParseBatch}, recording a parse error for any
 * file that cannot be read or processed, and resolves calls once every file is in.
 */
@Slf4j
public abstract class AbstractLanguageParser implements LanguageParser {

    @Override
    public LanguageParseResult parseFiles(ParseContext context, List<Path> files) {
        long start = System.currentTimeMillis();
        ParseBatch batch = new ParseBatch(context, getLanguage());

        for (Path file : files) {
            parseFileSafely(batch, file);
        }

        LanguageParseResult result = batch.complete(getParserVersion(), System.currentTimeMillis() - start);
        log.info("[ckg-parser:{}] Parsed {} file(s): {} entities, {} relationships, {} error(s) in {} ms",
                getLanguage(), result.getFilesProcessed(), result.getEntities().size(),
                result.getRelationships().size(), result.getErrors().size(), result.getDurationMs());
        return result;
    }

    protected void parseFileSafely(ParseBatch batch, Path file) {
        String relativePath = batch.getContext().relativePath(file);
        try {
            String content = readSource(file);
            parseSource(batch, relativePath, content);
        } catch (NoSuchFileException e) {
            recordError(batch, relativePath, "File not found: " + relativePath, e);
        } catch (MalformedInputException e) {
            recordError(batch, relativePath, "Encoding error in " + relativePath + ": not valid UTF-8", e);
        } catch (Exception e) {
            recordError(batch, relativePath, "Failed to parse " + relativePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Extract the entities of one file into the batch. May throw: the caller records the failure
     * and keeps whatever was added before it.
     */
    protected abstract void parseSource(ParseBatch batch, String relativePath, String content) throws Exception;

    protected String readSource(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    protected void recordError(ParseBatch batch, String relativePath, String message, Exception e) {
        batch.addError(relativePath, message, 0);
        log.warn("[ckg-parser:{}] {}", getLanguage(), message);
        log.debug("[ckg-parser:{}] Parse failure detail for {}", getLanguage(), relativePath, e);
    }
}
