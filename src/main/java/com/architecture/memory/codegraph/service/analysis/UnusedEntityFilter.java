package com.architecture.memory.codegraph.service.analysis;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Visibility;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Predicate;

/**
 * Exclusion predicate for unused-entity detection, driven by {@code ckg.analyzer.unused.*}.
 * Matches the entities that are expected to have no callers inside the project: entry points,
 * framework callbacks, accessors, tests, overrides, constructors and, optionally, public API.
 */
@Component
@RequiredArgsConstructor
public class UnusedEntityFilter implements Predicate<CodeEntity> {

    private final CodeGraphProperties properties;

    /**
     * @return true if the entity must not be reported as unused
     */
    @Override
    public boolean test(CodeEntity entity) {
        CodeGraphProperties.Unused config = properties.getAnalyzer().getUnused();
        String name = entity.getName() != null ? entity.getName() : "";

        if (!config.getKinds().contains(entity.getKind())) {
            return true;
        }
        if (config.getExcludedNames().contains(name)) {
            return true;
        }
        if (isDunder(name)) {
            return true;
        }
        for (String prefix : config.getExcludedNamePrefixes()) {
            if (isAccessorLike(name, prefix)) {
                return true;
            }
        }
        for (String suffix : config.getExcludedNameSuffixes()) {
            if (name.endsWith(suffix)) {
                return true;
            }
        }
        if (config.isExcludeOverrides() && entity.hasModifier("override")) {
            return true;
        }
        if (config.isExcludeConstructors() && entity.hasModifier("constructor")) {
            return true;
        }
        return config.isExcludePublicApi() && entity.getVisibility() == Visibility.PUBLIC;
    }

    // getName, get_name, isValid; not "settle" or "issue"
    private static boolean isAccessorLike(String name, String prefix) {
        if (!name.startsWith(prefix) || name.length() <= prefix.length()) {
            return false;
        }
        char next = name.charAt(prefix.length());
        return Character.isUpperCase(next) || next == '_';
    }

    // Python protocol methods are called by the runtime
    private static boolean isDunder(String name) {
        return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
    }
}
