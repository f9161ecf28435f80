/**
 * RuleListStage.java
 *
 * 依次应用一组有序的改写规则，每条规则处理上一条规则的输出。
 * 顺序很重要：后面的规则是针对前面规则生成的文本形状编写的。
 * 规则失败（包括正则匹配耗尽栈）会被包装为带有阶段和位置的 RewriteException。
 */
package club.ppmc.transpiler.service.rules;

import club.ppmc.transpiler.exception.RewriteException;
import java.util.List;

public final class RuleListStage implements RewriteStage {

    private final String name;
    private final List<RewriteRule> rules;

    public RuleListStage(String name, List<RewriteRule> rules) {
        this.name = name;
        this.rules = List.copyOf(rules);
    }

    @Override
    public String name() {
        return name;
    }

    public List<RewriteRule> rules() {
        return rules;
    }

    @Override
    public String apply(String text) {
        String result = text;
        for (int i = 0; i < rules.size(); i++) {
            RewriteRule rule = rules.get(i);
            try {
                result = rule.apply(result);
            } catch (RuntimeException | StackOverflowError e) {
                throw new RewriteException(name, i, rule.toString(), e);
            }
        }
        return result;
    }
}
