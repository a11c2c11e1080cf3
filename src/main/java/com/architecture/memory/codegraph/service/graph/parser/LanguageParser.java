package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.dto.parse.LanguageParseResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Extracts entities and relationships from the source files of one language.
 * Implementations are registered in {@link ParserRegistry} under their language tag.
 *
 * A parser must never fail the whole batch because of one file: per-file failures are
 * recorded as {@link com.architecture.memory.codegraph.dto.parse.ParseError}s in the result.
 */
public interface LanguageParser {

    /**
     * Canonical lower-case language tag, e.g. "java".
     */
    String getLanguage();

    /**
     * File extensions handled by this parser, without the dot.
     */
    Set<String> getFileExtensions();

    /**
     * Alternative tags resolving to this parser, e.g. "py" for python.
     */
    default Set<String> getAliases() {
        return Set.of();
    }

    String getParserVersion();

    LanguageParseResult parseFiles(ParseContext context, List<Path> files);
}
