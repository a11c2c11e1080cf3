package com.architecture.memory.codegraph.config;

import com.architecture.memory.codegraph.exception.ConfigurationException;
import com.architecture.memory.codegraph.repository.graph.GraphStoreDriver;
import com.architecture.memory.codegraph.repository.graph.InMemoryGraphStoreDriver;
import com.architecture.memory.codegraph.repository.graph.Neo4jGraphStoreDriver;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphStoreConfigTest {

    @Test
    void createDriver_selectsBackendByType() {
        assertThat(GraphStoreConfig.createDriver("neo4j")).isInstanceOf(Neo4jGraphStoreDriver.class);
        assertThat(GraphStoreConfig.createDriver(" Memory ")).isInstanceOf(InMemoryGraphStoreDriver.class);
    }

    @Test
    void createDriver_rejectsUnknownType() {
        assertThatThrownBy(() -> GraphStoreConfig.createDriver("cassandra"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Unknown graph store type: cassandra");
    }

    @Test
    void graphStoreDriver_connectsConfiguredBackend() {
        CodeGraphProperties properties = new CodeGraphProperties();
        properties.getStore().setType("memory");

        GraphStoreDriver driver = new GraphStoreConfig().graphStoreDriver(properties);

        assertThat(driver.isConnected()).isTrue();
        assertThat(driver.getName()).isEqualTo("memory");
        driver.close();
    }
}
