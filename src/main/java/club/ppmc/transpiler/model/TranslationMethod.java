/**
 * TranslationMethod.java
 *
 * 标识翻译结果由哪条路径产生。序列化为转换响应中的
 * {@code method} 字段。
 */
package club.ppmc.transpiler.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TranslationMethod {
    /** 应用了单个直接规则集。 */
    RULE_BASED("rule-based"),
    /** 串联了两个规则集（VB6 -> VB.NET -> C#）。 */
    RULE_BASED_COMPOSED("rule-based-composed"),
    /** 由外部智能体完成翻译。 */
    AGENT_AUGMENTED("mcp-ai"),
    /** 不支持的转换组合或内部错误。 */
    ERROR("error");

    private final String wireName;

    TranslationMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
