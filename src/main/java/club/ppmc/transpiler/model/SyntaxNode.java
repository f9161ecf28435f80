/**
 * SyntaxNode.java
 *
 * 有界且可安全传输的语法树中的不可变节点，由解析接口返回，也作为上下文发送给外部智能体。
 * 实例由 SyntaxTreeService 根据原生语法树构建，或者作为占位树合成；
 * 构建后不再修改。
 */
package club.ppmc.transpiler.model;

import java.util.List;

/**
 * @param id 不透明标识符，在一棵树内唯一。
 * @param type 节点类型：语法标签（如 "class_declaration"）或合成类型。
 * @param text 节点覆盖的源代码截断摘录。
 * @param startLine 节点的第一行（从 0 开始）。
 * @param endLine 节点的最后一行（从 0 开始），不小于 {@code startLine}。
 * @param children 有序子节点，数量有上限；被深度截断的节点没有子节点。
 */
public record SyntaxNode(
        String id, String type, String text, int startLine, int endLine, List<SyntaxNode> children) {

    /** 哨兵节点的类型，替代被深度上限截断的子树。 */
    public static final String MAX_DEPTH_REACHED = "max_depth_reached";

    public SyntaxNode {
        children = children == null ? List.of() : List.copyOf(children);
        if (endLine < startLine) {
            endLine = startLine;
        }
    }

    public boolean isDepthSentinel() {
        return MAX_DEPTH_REACHED.equals(type);
    }
}
