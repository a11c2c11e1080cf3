package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.dto.parse.LanguageParseResult;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.Relationship;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.model.graph.Visibility;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DartSourceParserTest {

    private static final String CART = String.join("\n",
            "import 'package:shop/item.dart';",
            "",
            "abstract class Priced {",
            "  double total();",
            "}",
            "",
            "class Cart extends Object with Logging implements Priced {",
            "  final List<Item> _items = [];",
            "",
            "  void addItem(Item item) {",
            "    _items.add(item);",
            "    _recalculate();",
            "  }",
            "",
            "  void _recalculate() {",
            "    print(total());",
            "  }",
            "",
            "  @override",
            "  double total() => 0.0;",
            "}",
            "",
            "class Item {",
            "  final String name;",
            "  Item(this.name);",
            "}",
            "",
            "mixin Logging {",
            "  void log(String message, [int level = 0]) {}",
            "}",
            "");

    @TempDir
    Path tempDir;

    private DartSourceParser parser;
    private ParseContext context;

    @BeforeEach
    void setUp() {
        CanonicalIdGenerator idGenerator = new CanonicalIdGenerator();
        parser = new DartSourceParser(idGenerator);
        context = ParseContext.builder().projectId("p1").rootPath(tempDir).idGenerator(idGenerator).build();
    }

    @Test
    void extractsClassesAndMixins_qualifiedByLibraryPath() throws IOException {
        LanguageParseResult result = parse("lib/cart.dart", CART);

        assertThat(result.getErrors()).isEmpty();
        assertThat(names(result, EntityKind.CLASS)).containsExactlyInAnyOrder(
                "lib.cart.Priced", "lib.cart.Cart", "lib.cart.Item", "lib.cart.Logging");
        assertThat(find(result, "lib.cart.Logging").getModifiers()).contains("mixin");
        assertThat(find(result, "lib.cart.Priced").getModifiers()).contains("abstract");
    }

    @Test
    void extractsMethodsConstructorsAndPrivateMembers() throws IOException {
        LanguageParseResult result = parse("lib/cart.dart", CART);

        assertThat(names(result, EntityKind.METHOD)).containsExactlyInAnyOrder(
                "lib.cart.Priced.total",
                "lib.cart.Cart.addItem",
                "lib.cart.Cart._recalculate",
                "lib.cart.Cart.total",
                "lib.cart.Item.Item",
                "lib.cart.Logging.log");

        assertThat(find(result, "lib.cart.Cart._recalculate").getVisibility()).isEqualTo(Visibility.PRIVATE);
        assertThat(find(result, "lib.cart.Cart.total").getModifiers()).contains("override");
        assertThat(find(result, "lib.cart.Item.Item").getModifiers()).contains("constructor");
        assertThat(find(result, "lib.cart.Cart.addItem").getSignature()).isEqualTo("void addItem(Item)");

        CodeEntity items = find(result, "lib.cart.Cart._items");
        assertThat(items.getKind()).isEqualTo(EntityKind.FIELD);
        assertThat(items.getVisibility()).isEqualTo(Visibility.PRIVATE);
    }

    @Test
    void resolvesCallsOnImplicitThis() throws IOException {
        LanguageParseResult result = parse("lib/cart.dart", CART);

        String addItem = find(result, "lib.cart.Cart.addItem").getId();
        String recalculate = find(result, "lib.cart.Cart._recalculate").getId();
        String total = find(result, "lib.cart.Cart.total").getId();

        assertThat(edges(result, RelationshipType.CALLS))
                .anyMatch(r -> r.getSourceId().equals(addItem) && r.getTargetId().equals(recalculate))
                .anyMatch(r -> r.getSourceId().equals(recalculate) && r.getTargetId().equals(total));
    }

    @Test
    void mapsSupertypeClauses() throws IOException {
        LanguageParseResult result = parse("lib/cart.dart", CART);

        String cart = find(result, "lib.cart.Cart").getId();
        String priced = find(result, "lib.cart.Priced").getId();
        String logging = find(result, "lib.cart.Logging").getId();

        assertThat(edges(result, RelationshipType.IMPLEMENTS))
                .anyMatch(r -> r.getSourceId().equals(cart) && r.getTargetId().equals(priced))
                .anyMatch(r -> r.getSourceId().equals(cart) && r.getTargetId().equals(logging));
    }

    @Test
    void usesLibraryDirective_asNamespace() throws IOException {
        LanguageParseResult result = parse("lib/util.dart", "library shop.util;\n\nint twice(int x) => x * 2;\n");

        assertThat(names(result, EntityKind.METHOD)).containsExactly("shop.util.twice");
    }

    private LanguageParseResult parse(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return parser.parseFiles(context, List.of(file));
    }

    private static List<String> names(LanguageParseResult result, EntityKind kind) {
        return result.getEntities().stream().filter(e -> e.getKind() == kind).map(CodeEntity::getQualifiedName).toList();
    }

    private static CodeEntity find(LanguageParseResult result, String qualifiedName) {
        return result.getEntities().stream()
                .filter(e -> qualifiedName.equals(e.getQualifiedName()))
                .findFirst()
                .orElseThrow();
    }

    private static List<Relationship> edges(LanguageParseResult result, RelationshipType type) {
        return result.getRelationships().stream().filter(r -> r.getType() == type).toList();
    }
}
