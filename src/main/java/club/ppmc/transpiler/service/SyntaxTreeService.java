/**
 * SyntaxTreeService.java
 *
 * 将原生语法树转换为有界的 SyntaxNode 表示。
 * 采用深度优先的先序遍历。深度上限和子节点数量上限在遍历过程中执行，
 * 因此无论输入是什么形状，递归深度都不会超过深度上限，也不会构建超出上限的节点。
 * 位于深度上限且仍有子节点的节点，
 * 会被替换为没有子节点的 "max_depth_reached" 哨兵节点。
 *
 * 对于没有语法的方言，会合成一棵两层的占位树，形状约定相同，
 * 使用方因此永远不需要处理语法树缺失的情况。
 */
package club.ppmc.transpiler.service;

import club.ppmc.transpiler.model.ParseOutcome;
import club.ppmc.transpiler.model.ParseTreeNode;
import club.ppmc.transpiler.model.SyntaxNode;
import club.ppmc.transpiler.model.TranspilerSettings;
import club.ppmc.transpiler.util.TextExcerpts;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SyntaxTreeService {

    static final String PLACEHOLDER_ROOT_ID = "root";
    static final String PLACEHOLDER_ROOT_TYPE = "compilation_unit";
    static final String PLACEHOLDER_CHILD_TYPE = "class_declaration";
    static final String PLACEHOLDER_CHILD_TEXT = "Parsed structure";
    private static final int PLACEHOLDER_CHILD_LINES = 10;

    private final SettingsService settingsService;

    public SyntaxTreeService(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    /**
     * 返回解析结果对应的规范化语法树：解析成功时是原生语法树的有界副本，
     * 否则是占位树。
     */
    public SyntaxNode buildTree(ParseOutcome outcome, String code) {
        if (outcome != null && outcome.isParsed()) {
            return normalize(outcome.root());
        }
        return placeholder(code);
    }

    /** 原生语法树的有界副本。 */
    public SyntaxNode normalize(ParseTreeNode root) {
        TranspilerSettings settings = settingsService.getSettings();
        var walk = new Walk(settings.getMaxTreeDepth(), settings.getMaxChildren(), settings.getExcerptLength());
        SyntaxNode result = walk.visit(root, 0);
        log.debug("规范化语法树共 {} 个节点", walk.nextId - 1);
        return result;
    }

    /** 代替没有语法的方言的最小两层语法树。 */
    public SyntaxNode placeholder(String code) {
        int excerptLength = settingsService.getSettings().getExcerptLength();
        int lastLine = TextExcerpts.lineCount(code) - 1;
        var child =
                new SyntaxNode(
                        "n1",
                        PLACEHOLDER_CHILD_TYPE,
                        PLACEHOLDER_CHILD_TEXT,
                        0,
                        Math.min(PLACEHOLDER_CHILD_LINES, lastLine),
                        List.of());
        return new SyntaxNode(
                PLACEHOLDER_ROOT_ID,
                PLACEHOLDER_ROOT_TYPE,
                TextExcerpts.truncate(code, excerptLength),
                0,
                lastLine,
                List.of(child));
    }

    /** 一次遍历；生成的树内 id 唯一。 */
    private static final class Walk {
        private final int maxDepth;
        private final int maxChildren;
        private final int excerptLength;
        private int nextId = 1;

        Walk(int maxDepth, int maxChildren, int excerptLength) {
            this.maxDepth = Math.max(0, maxDepth);
            this.maxChildren = Math.max(0, maxChildren);
            this.excerptLength = excerptLength;
        }

        SyntaxNode visit(ParseTreeNode node, int depth) {
            String id = "n" + nextId++;
            String text = TextExcerpts.truncate(node.text(), excerptLength);
            int childCount = node.childCount();

            if (depth >= maxDepth && childCount > 0) {
                return new SyntaxNode(
                        id, SyntaxNode.MAX_DEPTH_REACHED, text, node.startLine(), node.endLine(), List.of());
            }

            int kept = Math.min(childCount, maxChildren);
            var children = new ArrayList<SyntaxNode>(kept);
            for (int i = 0; i < kept; i++) {
                children.add(visit(node.child(i), depth + 1));
            }
            return new SyntaxNode(id, node.type(), text, node.startLine(), node.endLine(), children);
        }
    }
}
