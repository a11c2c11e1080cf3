package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.dto.parse.ParserInfo;
import com.architecture.memory.codegraph.exception.UnsupportedLanguageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps language tags, aliases and file extensions to {@link LanguageParser} implementations.
 * Every parser bean in the context is registered at startup; more can be added at runtime.
 */
@Component
@Slf4j
public class ParserRegistry {

    private final Map<String, LanguageParser> parsersByLanguage = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    public ParserRegistry(List<LanguageParser> parsers) {
        parsers.forEach(this::register);
        log.info("[ckg-coordinator] Parser registry initialized with languages: {}", getSupportedLanguages());
    }

    public void register(LanguageParser parser) {
        String language = normalize(parser.getLanguage());
        LanguageParser previous = parsersByLanguage.put(language, parser);
        if (previous != null && previous != parser) {
            log.warn("[ckg-coordinator] Parser for '{}' replaced: {} -> {}", language,
                    previous.getClass().getSimpleName(), parser.getClass().getSimpleName());
        }
        for (String alias : parser.getAliases()) {
            aliases.put(normalize(alias), language);
        }
    }

    public boolean unregister(String language) {
        String canonical = canonicalLanguage(language);
        LanguageParser removed = parsersByLanguage.remove(canonical);
        if (removed == null) {
            return false;
        }
        aliases.values().removeIf(canonical::equals);
        log.info("[ckg-coordinator] Parser for '{}' unregistered", canonical);
        return true;
    }

    public boolean hasParser(String language) {
        return language != null && parsersByLanguage.containsKey(canonicalLanguage(language));
    }

    /**
     * @throws UnsupportedLanguageException if no parser handles the tag or alias
     */
    public LanguageParser getParser(String language) {
        LanguageParser parser = language == null ? null : parsersByLanguage.get(canonicalLanguage(language));
        if (parser == null) {
            throw new UnsupportedLanguageException(language);
        }
        return parser;
    }

    public Optional<LanguageParser> findByExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = normalize(extension.startsWith(".") ? extension.substring(1) : extension);
        return parsersByLanguage.values().stream()
                .filter(parser -> parser.getFileExtensions().contains(normalized))
                .min((a, b) -> a.getLanguage().compareTo(b.getLanguage()));
    }

    /**
     * Canonical tag for a tag or alias; the normalized input if it is neither.
     */
    public String canonicalLanguage(String language) {
        String normalized = normalize(language);
        return aliases.getOrDefault(normalized, normalized);
    }

    public List<String> getSupportedLanguages() {
        List<String> languages = new ArrayList<>(parsersByLanguage.keySet());
        languages.sort(String::compareTo);
        return languages;
    }

    public List<ParserInfo> getParserInfo() {
        return getSupportedLanguages().stream()
                .map(parsersByLanguage::get)
                .map(parser -> ParserInfo.builder()
                        .language(parser.getLanguage())
                        .parserVersion(parser.getParserVersion())
                        .fileExtensions(parser.getFileExtensions())
                        .aliases(parser.getAliases())
                        .build())
                .toList();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
