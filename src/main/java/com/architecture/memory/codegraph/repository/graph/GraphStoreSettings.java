package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStoreSettings {
    private String uri;
    private String username;
    private String password;
    private String database;
    private long connectionTimeoutMs;

    public static GraphStoreSettings from(CodeGraphProperties.Store store) {
        return GraphStoreSettings.builder()
                .uri(store.getUri())
                .username(store.getUsername())
                .password(store.getPassword())
                .database(store.getDatabase())
                .connectionTimeoutMs(store.getConnectionTimeoutMs())
                .build();
    }
}
