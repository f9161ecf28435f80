package club.ppmc.transpiler.model;

/**
 * 一条校验结果。
 *
 * @param message 便于阅读的描述。
 * @param line 结果对应的行（从 0 开始）；涉及整个输入时为 0。
 */
public record ValidationIssue(String message, int line) {}
