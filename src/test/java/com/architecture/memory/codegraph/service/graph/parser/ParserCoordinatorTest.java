package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.parse.CoordinatorResult;
import com.architecture.memory.codegraph.dto.parse.LanguageParseResult;
import com.architecture.memory.codegraph.exception.SourceTreeException;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserCoordinatorTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private ParserRegistry registry;
    private ParserCoordinator coordinator;

    @BeforeEach
    void setUp() {
        CanonicalIdGenerator idGenerator = new CanonicalIdGenerator();
        executor = Executors.newFixedThreadPool(2);
        registry = new ParserRegistry(List.of(new KotlinSourceParser(idGenerator), new PythonSourceParser(idGenerator)));
        coordinator = new ParserCoordinator(registry, idGenerator, new CodeGraphProperties(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void mergesResultsOfAllLanguages() throws IOException {
        write("app/main.py", "class App:\n    def run(self):\n        pass\n");
        write("src/Tool.kt", "class Tool {\n    fun use() {}\n}\n");

        CoordinatorResult result = coordinator.coordinate("p1", tempDir.toString(), List.of(),
                List.of("app/main.py", "src/Tool.kt"));

        assertThat(result.getFilesProcessed()).isEqualTo(2);
        assertThat(result.getPerLanguageStats()).containsOnlyKeys("kotlin", "python");
        assertThat(result.getEntities()).filteredOn(e -> e.getKind() == EntityKind.CLASS).hasSize(2);
        assertThat(result.getLanguagesWithResults()).containsExactly("kotlin", "python");
        assertThat(result.getSuccessRate()).isEqualTo(1.0);
    }

    @Test
    void skipsFilesWithoutParser_andNotesThem() throws IOException {
        write("app/main.py", "def main():\n    pass\n");
        write("native/lib.rs", "fn main() {}\n");

        CoordinatorResult result = coordinator.coordinate("p1", tempDir.toString(), List.of("python"),
                List.of("app/main.py", "native/lib.rs"));

        assertThat(result.getFilesProcessed()).isEqualTo(1);
        assertThat(result.getFilesSkipped()).isEqualTo(1);
        assertThat(result.getWarnings()).contains("Skipped 1 file(s) with unsupported language: .rs");
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void warnsAboutRequestedLanguageWithoutParser() throws IOException {
        write("app/main.py", "def main():\n    pass\n");

        CoordinatorResult result = coordinator.coordinate("p1", tempDir.toString(), List.of("py", "rust"),
                List.of("app/main.py"));

        assertThat(result.getWarnings()).contains("No parser available for language: rust");
        assertThat(result.getPerLanguageStats()).containsOnlyKeys("python");
    }

    @Test
    void reportsParseErrorPerFile_whenParserFails() throws IOException {
        registry.register(new FailingParser());
        write("a.fail", "x");
        write("b.fail", "y");
        write("app/main.py", "def main():\n    pass\n");

        CoordinatorResult result = coordinator.coordinate("p1", tempDir.toString(), List.of(),
                List.of("a.fail", "b.fail", "app/main.py"));

        assertThat(result.getErrors()).hasSize(2)
                .allSatisfy(error -> assertThat(error.getMessage()).startsWith("Parser failed: boom"));
        assertThat(result.getEntities()).isNotEmpty();
        assertThat(result.getFilesProcessed()).isEqualTo(3);
    }

    @Test
    void rejectsMissingRoot() {
        String missing = tempDir.resolve("does-not-exist").toString();

        assertThatThrownBy(() -> coordinator.coordinate("p1", missing, List.of(), List.of()))
                .isInstanceOf(SourceTreeException.class)
                .hasMessageContaining("not a readable directory");
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static class FailingParser implements LanguageParser {

        @Override
        public String getLanguage() {
            return "failing";
        }

        @Override
        public Set<String> getFileExtensions() {
            return Set.of("fail");
        }

        @Override
        public String getParserVersion() {
            return "0";
        }

        @Override
        public LanguageParseResult parseFiles(ParseContext context, List<Path> files) {
            throw new IllegalStateException("boom");
        }
    }
}
