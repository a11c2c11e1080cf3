package com.architecture.memory.codegraph.config;

import com.architecture.memory.codegraph.exception.ConfigurationException;
import com.architecture.memory.codegraph.repository.graph.GraphStoreDriver;
import com.architecture.memory.codegraph.repository.graph.GraphStoreSettings;
import com.architecture.memory.codegraph.repository.graph.InMemoryGraphStoreDriver;
import com.architecture.memory.codegraph.repository.graph.Neo4jGraphStoreDriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Selects and connects the graph store backend named by {@code ckg.store.type}.
 */
@Slf4j
@Configuration
public class GraphStoreConfig {

    @Bean(destroyMethod = "close")
    public GraphStoreDriver graphStoreDriver(CodeGraphProperties properties) {
        CodeGraphProperties.Store store = properties.getStore();
        GraphStoreDriver driver = createDriver(store.getType());
        driver.connect(GraphStoreSettings.from(store));
        log.info("[ckg-store] Graph store '{}' connected", driver.getName());
        return driver;
    }

    static GraphStoreDriver createDriver(String type) {
        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "neo4j":
                return new Neo4jGraphStoreDriver();
            case "memory":
                return new InMemoryGraphStoreDriver();
            default:
                throw new ConfigurationException("Unknown graph store type: " + type);
        }
    }
}
