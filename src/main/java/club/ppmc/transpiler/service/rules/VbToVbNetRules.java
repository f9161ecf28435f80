/**
 * VbToVbNetRules.java
 *
 * Visual Basic 6 到 VB.NET。两种方言的大部分语法相同，因此这张表主要
 * 统一关键字大小写，并替换 VB6 特有的结构（Variant、Set、Wend、
 * Debug.Print）。
 */
package club.ppmc.transpiler.service.rules;

import static club.ppmc.transpiler.service.rules.RewriteRule.anyCase;

import club.ppmc.transpiler.model.Dialect;
import java.util.List;

final class VbToVbNetRules {

    static final String WARNING =
            "Manual review recommended: Some VB6 features may not be directly compatible with VB.NET";

    private VbToVbNetRules() {}

    static List<RewriteRule> rules() {
        return List.of(
                anyCase("\\bDim[ \\t]+(\\w+)[ \\t]+As[ \\t]+Variant\\b", "Dim $1 As Object"),
                anyCase("\\bDim[ \\t]+(\\w+)[ \\t]+As[ \\t]+Integer\\b", "Dim $1 As Integer"),
                anyCase("\\bDim[ \\t]+(\\w+)[ \\t]+As[ \\t]+String\\b", "Dim $1 As String"),
                anyCase("\\bSub[ \\t]+Main[ \\t]*\\([ \\t]*\\)", "Sub Main()"),
                anyCase("\\bEnd[ \\t]+Sub\\b", "End Sub"),
                anyCase("\\bEnd[ \\t]+Function\\b", "End Function"),
                anyCase("\\bPublic[ \\t]+Sub\\b", "Public Sub"),
                anyCase("\\bPrivate[ \\t]+Sub\\b", "Private Sub"),
                anyCase("\\bPublic[ \\t]+Function\\b", "Public Function"),
                anyCase("\\bPrivate[ \\t]+Function\\b", "Private Function"),
                // VB.NET 中对象赋值不需要 Set 关键字
                anyCase("^([ \\t]*)Set[ \\t]+(\\w+)[ \\t]*=", "$1$2 ="),
                anyCase("\\bWend\\b", "End While"),
                anyCase("\\bDebug\\.Print[ \\t]+(.+)$", "Debug.WriteLine($1)"));
    }

    static RewritePipeline pipeline() {
        return new RewritePipeline(
                DialectPair.of(Dialect.VB, Dialect.VBNET),
                List.of(new RuleListStage("Visual Basic 6 -> VB.NET rules", rules())),
                WARNING);
    }
}
