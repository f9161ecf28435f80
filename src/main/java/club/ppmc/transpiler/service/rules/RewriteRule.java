/**
 * RewriteRule.java
 *
 * 规则集中的一个有序（模式，替换）对。模式在构建规则表时只编译一次；
 * 应用规则时，文本中的每个匹配都会被替换模板替换
 * （$n 引用捕获分组）。
 */
package club.ppmc.transpiler.service.rules;

import java.util.regex.Pattern;
import lombok.Getter;

@Getter
public final class RewriteRule {

    private final String regex;
    private final String replacement;
    /** 关键字是否忽略大小写匹配（VB 方言不区分大小写，C# 区分）。 */
    private final boolean caseInsensitive;
    /** ^ 和 $ 是否在文本的每一行锚定，而不仅是在首尾。 */
    private final boolean multiline;
    private final Pattern pattern;

    public RewriteRule(String regex, String replacement, boolean caseInsensitive, boolean multiline) {
        this.regex = regex;
        this.replacement = replacement;
        this.caseInsensitive = caseInsensitive;
        this.multiline = multiline;
        int flags = 0;
        if (caseInsensitive) {
            flags |= Pattern.CASE_INSENSITIVE;
        }
        if (multiline) {
            flags |= Pattern.MULTILINE;
        }
        this.pattern = Pattern.compile(regex, flags);
    }

    /** 按行锚定、忽略关键字大小写的规则。 */
    public static RewriteRule anyCase(String regex, String replacement) {
        return new RewriteRule(regex, replacement, true, true);
    }

    /** 按行锚定、按原样匹配关键字的规则。 */
    public static RewriteRule exactCase(String regex, String replacement) {
        return new RewriteRule(regex, replacement, false, true);
    }

    public String apply(String text) {
        return pattern.matcher(text).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return "/" + regex + "/ -> '" + replacement + "'";
    }
}
