package com.architecture.memory.codegraph.service.graph;

import com.architecture.memory.codegraph.model.graph.EntityKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalIdGeneratorTest {

    private final CanonicalIdGenerator idGenerator = new CanonicalIdGenerator();

    @Test
    void generateFileId_normalizesSeparatorsAndLeadingDot() {
        assertThat(idGenerator.generateFileId("java", ".\\src\\main\\App.java"))
                .isEqualTo("java:file:src/main/App.java");
    }

    @Test
    void generateEntityId_usesLowercaseKindLabel() {
        assertThat(idGenerator.generateEntityId("kotlin", EntityKind.INTERFACE, "src/Repo.kt", "com.example.Repo"))
                .isEqualTo("kotlin:interface:src/Repo.kt#com.example.Repo");
    }

    @Test
    void generateMethodId_keepsOverloadsDistinct() {
        String ints = idGenerator.generateMethodId("java", "A.java", "A.sum", List.of("int", "int"));
        String longs = idGenerator.generateMethodId("java", "A.java", "A.sum", List.of("long", "long"));

        assertThat(ints).isEqualTo("java:method:A.java#A.sum(int,int)");
        assertThat(ints).isNotEqualTo(longs);
    }

    @Test
    void generateMethodId_dropsGenericArgumentsAndWhitespace() {
        assertThat(idGenerator.generateMethodId("java", "A.java", "A.put", List.of("Map<String, Integer>", " String ")))
                .isEqualTo("java:method:A.java#A.put(Map,String)");
        assertThat(idGenerator.generateMethodId("python", "a.py", "a.run", null))
                .isEqualTo("python:method:a.py#a.run()");
    }

    @Test
    void sameNameInDifferentLanguages_doesNotCollide() {
        assertThat(idGenerator.generateEntityId("java", EntityKind.CLASS, "Order", "Order"))
                .isNotEqualTo(idGenerator.generateEntityId("kotlin", EntityKind.CLASS, "Order", "Order"));
    }

    @Test
    void nullInputs_produceUnknownIds() {
        assertThat(idGenerator.generateProjectId(null)).isEqualTo("project:unknown");
        assertThat(idGenerator.generateFileId(null, "a")).isEqualTo("file:unknown");
        assertThat(idGenerator.generateEntityId("java", null, "a", "b")).isEqualTo("entity:unknown");
        assertThat(idGenerator.normalizeType(" ")).isEqualTo("?");
    }
}
