/**
 * ParseTreeNode.java
 *
 * 原生语法树节点的只读视图。语法树规范化和代码校验只依赖这个接口，
 * 因此它们与语法库无关，测试也可以传入构造的语法树。
 */
package club.ppmc.transpiler.model;

public interface ParseTreeNode {

    /** 节点的语法标签，例如 "class_declaration" 或 "ERROR"。 */
    String type();

    /** 节点覆盖的第一行（从 0 开始）。 */
    int startLine();

    /** 节点覆盖的最后一行（从 0 开始）。 */
    int endLine();

    /** 节点覆盖的源代码文本。 */
    String text();

    int childCount();

    ParseTreeNode child(int index);

    /** 解析器为了从缺失的记号中恢复而插入此节点时为 true。 */
    default boolean isMissing() {
        return false;
    }
}
