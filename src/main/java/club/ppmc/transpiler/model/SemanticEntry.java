package club.ppmc.transpiler.model;

/**
 * 语义摘要中找到的一个声明。
 *
 * @param name 声明节点截断后的文本片段。
 * @param line 声明开始的行（从 0 开始）。
 */
public record SemanticEntry(String name, int line) {}
