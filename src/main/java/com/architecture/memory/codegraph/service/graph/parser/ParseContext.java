package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import lombok.Builder;
import lombok.Getter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Immutable settings of one scan, shared read-only by every parser worker of that scan.
 */
@Getter
@Builder
public class ParseContext {

    private final String projectId;
    private final Path rootPath;
    private final CanonicalIdGenerator idGenerator;
    private final boolean includeParameters;
    private final int javaComplianceLevel;

    /**
     * Path of a file relative to the project root, with forward slashes.
     * Falls back to comparing real paths, since a compiler may report a symlinked root canonicalized.
     */
    public String relativePath(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path root = rootPath.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            Path realFile = realPathOrSelf(absolute);
            Path realRoot = realPathOrSelf(root);
            if (realFile.startsWith(realRoot)) {
                absolute = realFile;
                root = realRoot;
            }
        }
        Path relative = absolute.startsWith(root) ? root.relativize(absolute) : file;
        return idGenerator.normalizePath(relative.toString());
    }

    private static Path realPathOrSelf(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path;
        }
    }
}
