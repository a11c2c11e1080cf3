package com.architecture.memory.codegraph.exception;

import lombok.Getter;

/**
 * No parser is registered for a language tag.
 */
@Getter
public class UnsupportedLanguageException extends CodeGraphException {

    private final String language;

    public UnsupportedLanguageException(String language) {
        super("No parser available for language: " + language);
        this.language = language;
    }
}
