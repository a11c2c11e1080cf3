package com.architecture.memory.codegraph.config;

import com.architecture.memory.codegraph.model.graph.EntityKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the code graph engine, bound from the {@code ckg.*} namespace.
 *
 * <p>Example (application.yml):
 * <pre>
 * ckg:
 *   store:
 *     type: neo4j
 *     uri: bolt://localhost:7687
 *   builder:
 *     batch-size: 500
 *   impact:
 *     default-depth: 2
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ckg")
public class CodeGraphProperties {

    /**
     * Operations slower than this are logged at WARN. They are never aborted.
     */
    @Min(0)
    private long slowOperationThresholdMs = 5000;

    @Valid
    private Store store = new Store();

    @Valid
    private Parser parser = new Parser();

    @Valid
    private Builder builder = new Builder();

    @Valid
    private Analyzer analyzer = new Analyzer();

    @Valid
    private Impact impact = new Impact();

    @Data
    public static class Store {

        /**
         * Backend implementation: "neo4j" or "memory".
         */
        @NotBlank
        private String type = "neo4j";

        private String uri = "bolt://localhost:7687";
        private String username = "neo4j";
        private String password = "password";
        private String database = "neo4j";

        @Min(1)
        private long connectionTimeoutMs = 10000;
    }

    @Data
    public static class Parser {

        /**
         * Worker threads for language parsers. 0 means one per available processor.
         */
        @Min(0)
        private int poolSize = 0;

        /**
         * Emit Parameter entities for Java method parameters.
         */
        private boolean includeParameters = false;

        @Min(8)
        private int javaComplianceLevel = 17;

        public int resolvePoolSize() {
            return poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
        }
    }

    @Data
    public static class Builder {

        /**
         * Maximum rows per node or relationship batch.
         */
        @Min(1)
        private int batchSize = 500;

        /**
         * Retries of the node write transaction before the build is marked failed.
         */
        @Min(0)
        private int maxRetries = 1;

        /**
         * Default wait used by callers awaiting a build-completion signal.
         */
        @Min(0)
        private long lockTimeoutMs = 60000;
    }

    @Data
    public static class Analyzer {

        @NotNull
        private List<EntityKind> cycleScopes = new ArrayList<>(List.of(EntityKind.CLASS, EntityKind.FILE));

        @Valid
        private Unused unused = new Unused();
    }

    @Data
    public static class Unused {

        private List<EntityKind> kinds = new ArrayList<>(List.of(EntityKind.CLASS, EntityKind.INTERFACE, EntityKind.METHOD));

        private List<String> excludedNames = new ArrayList<>(List.of(
                "main", "toString", "equals", "hashCode", "clone", "finalize",
                "Main", "Application", "App", "__init__"));

        private List<String> excludedNamePrefixes = new ArrayList<>(List.of("get", "set", "is"));

        private List<String> excludedNameSuffixes = new ArrayList<>(List.of("Test", "Tests"));

        private boolean excludeOverrides = true;

        private boolean excludeConstructors = true;

        /**
         * Suppress public entities entirely, for libraries whose callers live outside the project.
         */
        private boolean excludePublicApi = false;
    }

    @Data
    public static class Impact {

        @Min(1)
        private int defaultDepth = 2;

        /**
         * Direct callers above this count add a gradual-rollout recommendation.
         */
        @Min(1)
        private int highFanInThreshold = 5;
    }
}
