package club.ppmc.transpiler.model;

import java.util.List;

/**
 * 描述一个受支持方言的目录条目。
 *
 * @param value 规范标签。
 * @param label 显示名称。
 * @param aliases 规范化后此方言接受的标签。
 * @param grammarAvailable 是否有真实的语法支持此方言的解析。
 */
public record DialectInfo(String value, String label, List<String> aliases, boolean grammarAvailable) {}
