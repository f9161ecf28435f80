package club.ppmc.transpiler.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.transpiler.model.ParseOutcome;
import club.ppmc.transpiler.model.SyntaxNode;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyntaxTreeServiceTest {

    private SyntaxTreeService service;

    @BeforeEach
    void setUp() {
        service = new SyntaxTreeService(SettingsFixtures.defaults());
    }

    @Test
    void deepTreeIsCutAtDepthCapWithSentinel() {
        SyntaxNode root = service.normalize(FakeTreeNode.chain(200));

        assertThat(depth(root)).isEqualTo(50);
        SyntaxNode deepest = root;
        while (!deepest.children().isEmpty()) {
            deepest = deepest.children().get(0);
        }
        assertThat(deepest.type()).isEqualTo(SyntaxNode.MAX_DEPTH_REACHED);
        assertThat(deepest.isDepthSentinel()).isTrue();
        assertThat(deepest.children()).isEmpty();
    }

    @Test
    void leafAtDepthCapIsKeptAsIs() {
        SyntaxNode root = service.normalize(FakeTreeNode.chain(50));

        SyntaxNode deepest = root;
        while (!deepest.children().isEmpty()) {
            deepest = deepest.children().get(0);
        }
        assertThat(depth(root)).isEqualTo(50);
        assertThat(deepest.type()).isEqualTo("block");
    }

    @Test
    void wideNodeKeepsOnlyFirstChildren() {
        FakeTreeNode root = FakeTreeNode.node("compilation_unit", "wide", 0);
        for (int i = 0; i < 100; i++) {
            root.with(FakeTreeNode.node("statement", "s" + i, i));
        }

        SyntaxNode result = service.normalize(root);

        assertThat(result.children()).hasSize(20);
        assertThat(result.children().get(0).text()).isEqualTo("s0");
        assertThat(result.children().get(19).text()).isEqualTo("s19");
    }

    @Test
    void excerptsAreTruncatedAndIdsAreUnique() {
        String longText = "x".repeat(500);
        FakeTreeNode root = FakeTreeNode.node("compilation_unit", longText, 0)
                .with(FakeTreeNode.node("class_declaration", "class A {}", 1),
                        FakeTreeNode.node("class_declaration", "class B {}", 2));

        SyntaxNode result = service.normalize(root);

        assertThat(result.text()).hasSize(100);
        Set<String> ids = new HashSet<>();
        collectIds(result, ids);
        assertThat(ids).hasSize(3);
    }

    @Test
    void customBoundsAreHonoured() {
        var narrow = new SyntaxTreeService(SettingsFixtures.withTreeBounds(3, 2, 5));
        FakeTreeNode root = FakeTreeNode.chain(10);
        root.with(FakeTreeNode.node("a", "aaaaaaaa", 1), FakeTreeNode.node("b", "b", 2));

        SyntaxNode result = narrow.normalize(root);

        assertThat(depth(result)).isEqualTo(3);
        assertThat(result.children()).hasSize(2);
        assertThat(result.children().get(1).text()).isEqualTo("aaaaa");
    }

    @Test
    void placeholderHasTwoLevels() {
        SyntaxNode tree = service.buildTree(ParseOutcome.grammarUnavailable("none"), "Dim a\nDim b\nDim c");

        assertThat(tree.id()).isEqualTo("root");
        assertThat(tree.type()).isEqualTo("compilation_unit");
        assertThat(tree.startLine()).isZero();
        assertThat(tree.endLine()).isEqualTo(2);
        assertThat(tree.children()).singleElement().satisfies(child -> {
            assertThat(child.type()).isEqualTo("class_declaration");
            assertThat(child.text()).isEqualTo("Parsed structure");
            assertThat(child.endLine()).isEqualTo(2);
            assertThat(child.children()).isEmpty();
        });
    }

    @Test
    void placeholderChildSpansAtMostTenLines() {
        SyntaxNode tree = service.placeholder("x\n".repeat(30));

        assertThat(tree.endLine()).isEqualTo(30);
        assertThat(tree.children().get(0).endLine()).isEqualTo(10);
    }

    private static int depth(SyntaxNode node) {
        int max = 0;
        for (SyntaxNode child : node.children()) {
            max = Math.max(max, depth(child) + 1);
        }
        return max;
    }

    private static void collectIds(SyntaxNode node, Set<String> ids) {
        ids.add(node.id());
        node.children().forEach(child -> collectIds(child, ids));
    }
}
