/**
 * CSharpToVbNetRules.java
 *
 * C# 到 VB.NET。声明头原地改写并保留大括号，随后由 End 关键字处理把这些大括号
 * 转换为对应的 End 关键字。语句结束符最后删除。
 * C# 区分大小写，因此每条规则都按原样匹配关键字。
 */
package club.ppmc.transpiler.service.rules;

import static club.ppmc.transpiler.service.rules.RewriteRule.exactCase;

import club.ppmc.transpiler.model.Dialect;
import java.util.ArrayList;
import java.util.List;

final class CSharpToVbNetRules {

    static final String WARNING = "Converted C# to VB.NET. Review semicolons and brackets.";

    private static final String MODS =
            "(?:public|private|protected|internal|static|abstract|sealed|override|virtual|readonly"
                    + "|partial|async|extern|unsafe|new)";

    /** 缩进 ($1) 及其后任意数量的声明修饰符 ($2)。 */
    private static final String PREFIX = "^([ \\t]*)((?:" + MODS + "[ \\t]+)*)";

    /** 带泛型参数和数组维度的 C# 类型名。 */
    private static final String TYPE = "[\\w.]+(?:<[\\w.<>, \\t]*>)?(?:\\[\\])*";

    /** 可以作为语句开头、因而不可能是成员类型的单词。 */
    private static final String NOT_A_TYPE =
            "(?!(?:" + MODS.substring(3, MODS.length() - 1)
                    + "|if|else|for|foreach|while|do|switch|catch|using|return|new|lock|throw|await"
                    + "|yield|case|goto|var|const|class|struct|interface|namespace|void"
                    + "|Sub|Function|Property|Class|Structure|Interface|Module|Namespace|Dim|Const)\\b)";

    private static final String[][] TYPES = {
        {"int", "Integer"},
        {"string", "String"},
        {"bool", "Boolean"},
        {"double", "Double"},
        {"long", "Long"},
        {"short", "Short"},
        {"float", "Single"},
        {"decimal", "Decimal"},
        {"char", "Char"},
        {"byte", "Byte"},
        {"object", "Object"},
    };

    private static final String[][] MODIFIERS = {
        {"public", "Public"},
        {"private", "Private"},
        {"protected", "Protected"},
        {"internal", "Friend"},
        {"static", "Shared"},
        {"override", "Overrides"},
        {"virtual", "Overridable"},
        {"sealed", "NotInheritable"},
        {"readonly", "ReadOnly"},
        {"partial", "Partial"},
    };

    private CSharpToVbNetRules() {}

    static List<RewriteRule> rules() {
        List<RewriteRule> rules = new ArrayList<>();

        // 注释、导入和命名空间
        rules.add(exactCase("^([^\"\\r\\n/]*+(?:(?:\"[^\"\\r\\n]*+\"|/(?!/))[^\"\\r\\n/]*+)*+)//", "$1'"));
        rules.add(exactCase("^([ \\t]*)using[ \\t]+([\\w.]+)[ \\t]*;", "$1Imports $2"));
        rules.add(exactCase("^([ \\t]*)namespace[ \\t]+([\\w.]+)", "$1Namespace $2"));

        // 类型声明
        rules.add(exactCase(
                "^([ \\t]*)((?:" + MODS + "[ \\t]+)*)static[ \\t]+((?:" + MODS + "[ \\t]+)*)class[ \\t]+(\\w+)",
                "$1$2$3Module $4"));
        rules.add(exactCase(
                PREFIX + "(class|struct)[ \\t]+(\\w+(?:<[^>\\r\\n]*>)?)[ \\t]*:[ \\t]*([\\w.]+(?:<[^>\\r\\n]*>)?)"
                        + "[^{\\r\\n]*?[ \\t]*\\{",
                "$1$2$3 $4 {\n$1    Inherits $5"));
        rules.add(exactCase(
                PREFIX + "(class|struct)[ \\t]+(\\w+(?:<[^>\\r\\n]*>)?)[ \\t]*:[ \\t]*([\\w.]+(?:<[^>\\r\\n]*>)?)[^{\\r\\n]*?[ \\t]*$",
                "$1$2$3 $4\n$1    Inherits $5"));
        rules.add(exactCase(PREFIX + "class[ \\t]+(\\w+)", "$1$2Class $3"));
        rules.add(exactCase(PREFIX + "struct[ \\t]+(\\w+)", "$1$2Structure $3"));
        rules.add(exactCase(PREFIX + "interface[ \\t]+(\\w+)", "$1$2Interface $3"));

        // 属性
        rules.add(exactCase(
                PREFIX + "(" + TYPE + ")[ \\t]+(\\w+)[ \\t]*\\{[ \\t]*get;[ \\t]*set;[ \\t]*\\}",
                "$1$2Property $4 As $3"));
        rules.add(exactCase(
                PREFIX + "(" + TYPE + ")[ \\t]+(\\w+)[ \\t]*\\{[ \\t]*get;[ \\t]*\\}",
                "$1$2ReadOnly Property $4 As $3"));

        // 方法和构造函数
        rules.add(exactCase(PREFIX + "void[ \\t]+(\\w+)[ \\t]*\\(([^)\\r\\n]*)\\)", "$1$2Sub $3($4)"));
        rules.add(exactCase(
                PREFIX + NOT_A_TYPE + "(" + TYPE + ")[ \\t]+(\\w+)[ \\t]*\\(([^)\\r\\n]*)\\)(?=[ \\t]*(?:\\{|;|$))",
                "$1$2Function $4($5) As $3"));
        rules.add(exactCase(
                "^([ \\t]*)((?:" + MODS + "[ \\t]+)+)(\\w+)[ \\t]*\\(([^)\\r\\n]*)\\)(?=[ \\t]*(?:\\{|$|:))",
                "$1$2Sub New($4)"));

        // 控制流，保留大括号供 End 关键字处理使用
        rules.add(exactCase("^([ \\t]*)(\\}[ \\t]*)?else[ \\t]+if[ \\t]*\\((.*)\\)[ \\t]*(\\{?)[ \\t]*$", "$1$2ElseIf $3 Then $4"));
        rules.add(exactCase("^([ \\t]*)if[ \\t]*\\((.*)\\)[ \\t]*(\\{?)[ \\t]*$", "$1If $2 Then $3"));
        rules.add(exactCase("^([ \\t]*)if[ \\t]*\\((.*)\\)[ \\t]+([A-Za-z_][^\\r\\n]*;)[ \\t]*$", "$1If $2 Then $3"));
        rules.add(exactCase("^([ \\t]*)(\\}[ \\t]*)?else[ \\t]*(\\{?)[ \\t]*$", "$1$2Else $3"));
        rules.add(exactCase(
                "^([ \\t]*)foreach[ \\t]*\\([ \\t]*var[ \\t]+(\\w+)[ \\t]+in[ \\t]+(.*)\\)[ \\t]*(\\{?)[ \\t]*$",
                "$1For Each $2 In $3 $4"));
        rules.add(exactCase(
                "^([ \\t]*)foreach[ \\t]*\\([ \\t]*(" + TYPE + ")[ \\t]+(\\w+)[ \\t]+in[ \\t]+(.*)\\)[ \\t]*(\\{?)[ \\t]*$",
                "$1For Each $3 As $2 In $4 $5"));
        rules.add(exactCase(
                "^([ \\t]*)for[ \\t]*\\([ \\t]*(?:int|var)[ \\t]+(\\w+)[ \\t]*=[ \\t]*([^;]+?);[ \\t]*\\2[ \\t]*<=[ \\t]*([^;]+?);"
                        + "[ \\t]*(?:\\2\\+\\+|\\+\\+\\2|\\2[ \\t]*\\+=[ \\t]*1)[ \\t]*\\)[ \\t]*(\\{?)[ \\t]*$",
                "$1For $2 = $3 To $4 $5"));
        rules.add(exactCase(
                "^([ \\t]*)for[ \\t]*\\([ \\t]*(?:int|var)[ \\t]+(\\w+)[ \\t]*=[ \\t]*([^;]+?);[ \\t]*\\2[ \\t]*<[ \\t]*([^;]+?);"
                        + "[ \\t]*(?:\\2\\+\\+|\\+\\+\\2|\\2[ \\t]*\\+=[ \\t]*1)[ \\t]*\\)[ \\t]*(\\{?)[ \\t]*$",
                "$1For $2 = $3 To $4 - 1 $5"));
        rules.add(exactCase("^([ \\t]*)while[ \\t]*\\((.*)\\)[ \\t]*(\\{?)[ \\t]*$", "$1While $2 $3"));
        rules.add(exactCase("^([ \\t]*)try[ \\t]*(\\{?)[ \\t]*$", "$1Try $2"));
        rules.add(exactCase(
                "^([ \\t]*)(\\}[ \\t]*)?catch[ \\t]*\\([ \\t]*([\\w.]+)[ \\t]+(\\w+)[ \\t]*\\)[ \\t]*(\\{?)[ \\t]*$",
                "$1$2Catch $4 As $3 $5"));
        rules.add(exactCase(
                "^([ \\t]*)(\\}[ \\t]*)?catch[ \\t]*\\([ \\t]*([\\w.]+)[ \\t]*\\)[ \\t]*(\\{?)[ \\t]*$",
                "$1$2Catch ex As $3 $4"));
        rules.add(exactCase("^([ \\t]*)(\\}[ \\t]*)?catch[ \\t]*(\\{?)[ \\t]*$", "$1$2Catch $3"));
        rules.add(exactCase("^([ \\t]*)(\\}[ \\t]*)?finally[ \\t]*(\\{?)[ \\t]*$", "$1$2Finally $3"));
        rules.add(exactCase("\\bbreak;", "Exit For"));
        rules.add(exactCase("\\bcontinue;", "Continue For"));

        // 参数
        rules.add(exactCase("(\\(|,[ \\t]*)(?:ref|out)[ \\t]+(" + TYPE + ")[ \\t]+(\\w+)(?=[ \\t]*[,)=])", "$1ByRef $3 As $2"));
        rules.add(exactCase(
                "(\\(|,[ \\t]*)(?!ByRef\\b|ByVal\\b)(" + TYPE + ")[ \\t]+(\\w+)(?=[ \\t]*[,)=])", "$1ByVal $3 As $2"));

        // 局部变量、常量和字段
        rules.add(exactCase(
                "^([ \\t]*)var[ \\t]+(\\w+)[ \\t]*=[ \\t]*new[ \\t]+(" + TYPE + ")[ \\t]*(\\([^;\\r\\n]*\\))?[ \\t]*;",
                "$1Dim $2 As New $3$4"));
        rules.add(exactCase("^([ \\t]*)var[ \\t]+(\\w+)[ \\t]*=[ \\t]*(.+);", "$1Dim $2 = $3"));
        rules.add(exactCase(
                PREFIX + "const[ \\t]+(" + TYPE + ")[ \\t]+(\\w+)[ \\t]*=[ \\t]*(.+);",
                "$1$2Const $4 As $3 = $5"));
        rules.add(exactCase(
                "^([ \\t]*)(" + TYPE + ")[ \\t]+(\\w+)[ \\t]*=[ \\t]*new[ \\t]+\\2[ \\t]*(\\([^;\\r\\n]*\\))?[ \\t]*;",
                "$1Dim $3 As New $2$4"));
        rules.add(exactCase(
                "^([ \\t]*)((?:(?:public|private|protected|internal|static|readonly)[ \\t]+)+)"
                        + NOT_A_TYPE + "(" + TYPE + ")[ \\t]+(\\w+)[ \\t]*=[ \\t]*([^;\\r\\n]+);",
                "$1$2$4 As $3 = $5"));
        rules.add(exactCase(
                "^([ \\t]*)((?:(?:public|private|protected|internal|static|readonly)[ \\t]+)+)"
                        + NOT_A_TYPE + "(" + TYPE + ")[ \\t]+(\\w+)[ \\t]*;",
                "$1$2$4 As $3"));
        rules.add(exactCase(
                "^([ \\t]*)(int|string|bool|double|long|short|float|decimal|char|byte|object|DateTime)"
                        + "[ \\t]+(\\w+)[ \\t]*=[ \\t]*(.+);",
                "$1Dim $3 As $2 = $4"));
        rules.add(exactCase(
                "^([ \\t]*)(int|string|bool|double|long|short|float|decimal|char|byte|object|DateTime)"
                        + "[ \\t]+(\\w+)[ \\t]*;",
                "$1Dim $3 As $2"));

        // 跳转
        rules.add(exactCase("\\breturn[ \\t]+(.+);", "Return $1"));
        rules.add(exactCase("\\breturn[ \\t]*;", "Return"));
        rules.add(exactCase("^([ \\t]*)throw[ \\t]+", "$1Throw "));

        // 运算符和字面量
        rules.add(exactCase("(\\w+)\\+\\+;", "$1 += 1;"));
        rules.add(exactCase("(\\w+)--;", "$1 -= 1;"));
        rules.add(exactCase("&&", "AndAlso"));
        rules.add(exactCase("\\|\\|", "OrElse"));
        rules.add(exactCase("!=[ \\t]*null\\b", "IsNot Nothing"));
        rules.add(exactCase("==[ \\t]*null\\b", "Is Nothing"));
        rules.add(exactCase("!=", "<>"));
        rules.add(exactCase("==", "="));
        rules.add(exactCase("\\bnull\\b", "Nothing"));
        rules.add(exactCase("\\bthis\\.", "Me."));
        rules.add(exactCase("\\btrue\\b", "True"));
        rules.add(exactCase("\\bfalse\\b", "False"));
        rules.add(exactCase("!(?=[\\w(])", "Not "));
        rules.add(exactCase("\\bnew[ \\t]+", "New "));
        rules.add(exactCase("[ \\t]+%[ \\t]+", " Mod "));

        // 修饰符
        rules.add(exactCase("\\babstract(?=[ \\t]+(?:(?!(?:Class|Module)\\b)\\w+[ \\t]+)*+(?:Class|Module)\\b)", "MustInherit"));
        rules.add(exactCase("\\babstract\\b", "MustOverride"));
        for (String[] modifier : MODIFIERS) {
            rules.add(exactCase("\\b" + modifier[0] + "\\b", modifier[1]));
        }

        // 泛型、数组和类型名
        // 执行两次，以便同时转换一层嵌套的类型参数
        rules.add(exactCase("<([\\w.()]++(?:[ \\t]*,[ \\t]*[\\w.()]++)*+)>", "(Of $1)"));
        rules.add(exactCase("<([\\w.()]++(?:[ \\t]*,[ \\t]*[\\w.()]++)*+)>", "(Of $1)"));
        rules.add(exactCase("(?<=\\w)\\[\\]", "()"));
        for (String[] type : TYPES) {
            rules.add(exactCase("(?<=\\bAs[ \\t]|\\bNew[ \\t]|\\(Of[ \\t]|,[ \\t])" + type[0] + "\\b", type[1]));
        }

        // 语句结束符
        rules.add(exactCase("[ \\t]*;[ \\t]*$", ""));
        return List.copyOf(rules);
    }

    static RewritePipeline pipeline() {
        return new RewritePipeline(
                DialectPair.of(Dialect.CSHARP, Dialect.VBNET),
                List.of(new RuleListStage("C# -> VB.NET rules", rules()), BlockClosingPass.endKeywords()),
                WARNING);
    }
}
