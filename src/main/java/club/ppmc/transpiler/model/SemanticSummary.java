/**
 * SemanticSummary.java
 *
 * 语法树中声明的只读摘要，分为四个有序列表。
 * 每次请求重新计算，从不缓存。这些列表永远不为 null。
 */
package club.ppmc.transpiler.model;

import java.util.List;

/**
 * @param classes 声明的类型。
 * @param methods 可调用成员（方法、函数和构造函数）。
 * @param properties 数据成员（字段和属性）。
 * @param imports import / using 指令。
 */
public record SemanticSummary(
        List<SemanticEntry> classes,
        List<SemanticEntry> methods,
        List<SemanticEntry> properties,
        List<SemanticEntry> imports) {

    public SemanticSummary {
        classes = classes == null ? List.of() : List.copyOf(classes);
        methods = methods == null ? List.of() : List.copyOf(methods);
        properties = properties == null ? List.of() : List.copyOf(properties);
        imports = imports == null ? List.of() : List.copyOf(imports);
    }

    public static SemanticSummary empty() {
        return new SemanticSummary(List.of(), List.of(), List.of(), List.of());
    }
}
