/**
 * RewriteException.java
 *
 * 当某条改写规则无法应用于输入时抛出（例如替换模板引用了模式中不存在的分组，或者正则匹配耗尽了栈）。
 * 它记录失败的阶段和规则，使操作边界可以报告准确的内部错误，而不是裸露的堆栈信息。
 */
package club.ppmc.transpiler.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class RewriteException extends RuntimeException {

    /** 失败的规则阶段名称，例如 "VB.NET -> C# rules"。 */
    private final String stage;

    /** 失败规则在其阶段中的位置。 */
    private final int ruleIndex;

    /** 失败规则的可打印形式。 */
    private final String rule;

    public RewriteException(String stage, int ruleIndex, String rule, Throwable cause) {
        super("Rule #" + ruleIndex + " of '" + stage + "' failed: " + describe(cause), cause);
        this.stage = stage;
        this.ruleIndex = ruleIndex;
        this.rule = rule;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * 失败信息的结构化形式，用于日志记录。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "REWRITE_ERROR",
                "message", getMessage(),
                "stage", stage,
                "ruleIndex", ruleIndex,
                "rule", rule);
    }
}
