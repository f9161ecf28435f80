/**
 * VbNetToCSharpRules.java
 *
 * VB.NET 到 C#。先在 VB 修饰符仍然存在时改写声明和块头，
 * 然后依次处理语句、运算符、修饰符和类型名，最后添加语句结束符。
 * 每个 "End X" 都变为右大括号；随后由大括号闭合处理
 * 为输入中未关闭的块追加大括号。
 */
package club.ppmc.transpiler.service.rules;

import static club.ppmc.transpiler.service.rules.RewriteRule.anyCase;

import club.ppmc.transpiler.model.Dialect;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class VbNetToCSharpRules {

    static final String WARNING = "Converted VB.NET to C#. Review Option Strict and type conversions.";

    private static final String MODS =
            "(?:Public|Private|Protected|Friend|Shared|Overrides|Overridable|MustInherit"
                    + "|NotInheritable|MustOverride|ReadOnly|Partial|Overloads|Shadows)";

    /** 缩进 ($1) 及其后任意数量的声明修饰符 ($2)。 */
    private static final String PREFIX = "^([ \\t]*)((?:" + MODS + "[ \\t]+)*)";

    /** VB 类型名，包括泛型参数。 */
    private static final String TYPE = "[\\w.]+(?:\\(Of[^)\\r\\n]*\\))?";

    /** 成员头末尾的 Implements/Handles 子句，会被去掉。 */
    private static final String CLAUSE = "(?:[ \\t]+(?:Implements|Handles)[ \\t]+[\\w., \\t]+)?";

    /** 排除 "Sub New" 头部行。 */
    private static final String NOT_CTOR_LINE = "(?![ \\t]*(?:" + MODS + "[ \\t]+)*Sub[ \\t]+New\\b)";

    /** 从行首到某个关键字为止 ($1)。 */
    private static final String CODE = "^([^\\r\\n]*?)";

    /** 同一行中前面没有 "//" 的位置；放在它所保护的关键字之后。 */
    private static final String UNCOMMENTED = "(?<!//[^\\r\\n]{0,4000})";

    private static final Map<String, String> MODIFIERS =
            orderedMap(
                    "Public", "public",
                    "Private", "private",
                    "Protected", "protected",
                    "Friend", "internal",
                    "Shared", "static",
                    "Overrides", "override",
                    "Overridable", "virtual",
                    "MustInherit", "abstract",
                    "MustOverride", "abstract",
                    "NotInheritable", "sealed",
                    "ReadOnly", "readonly",
                    "Partial", "partial");

    private static final Map<String, String> TYPES =
            orderedMap(
                    "Integer", "int",
                    "String", "string",
                    "Boolean", "bool",
                    "Double", "double",
                    "Long", "long",
                    "Short", "short",
                    "Single", "float",
                    "Decimal", "decimal",
                    "Char", "char",
                    "Byte", "byte",
                    "Object", "object",
                    "Date", "DateTime");

    private static final String STATEMENT_KEYWORDS =
            "if|else|for|foreach|while|do|switch|case|default|try|catch|finally|return|using"
                    + "|namespace|class|struct|interface|public|private|protected|internal|static"
                    + "|abstract|sealed|override|virtual|readonly|partial|const|var|void|new|throw"
                    + "|break|continue|goto";

    private VbNetToCSharpRules() {}

    static List<RewriteRule> rules() {
        List<RewriteRule> rules = new ArrayList<>();

        // 注释和行结构
        rules.add(anyCase("^([^\"'\\r\\n]*+(?:\"[^\"\\r\\n]*+\"[^\"'\\r\\n]*+)*+)'", "$1//"));
        rules.add(anyCase("[ \\t]+_[ \\t]*\\r?\\n[ \\t]*", " "));
        rules.add(anyCase("^[ \\t]*Option[ \\t]+(?:Strict|Explicit|Infer|Compare)\\b.*$", ""));
        rules.add(anyCase("^([ \\t]*)Imports[ \\t]+([\\w.]+)[ \\t]*$", "$1using $2;"));
        rules.add(anyCase("^([ \\t]*)Namespace[ \\t]+([\\w.]+)[ \\t]*$", "$1namespace $2 {"));
        rules.add(anyCase("^([ \\t]*)End[ \\t]+Namespace\\b", "$1}"));

        // 类型声明
        rules.add(anyCase(PREFIX + "Class[ \\t]+(\\w+(?:\\(Of[^)\\r\\n]*\\))?)[ \\t]*$", "$1$2class $3 {"));
        rules.add(anyCase(PREFIX + "Structure[ \\t]+(\\w+)[ \\t]*$", "$1$2struct $3 {"));
        rules.add(anyCase(PREFIX + "Interface[ \\t]+(\\w+)[ \\t]*$", "$1$2interface $3 {"));
        rules.add(anyCase(PREFIX + "Module[ \\t]+(\\w+)[ \\t]*$", "$1$2static class $3 {"));
        rules.add(anyCase(
                "(\\b(?:class|struct)[ \\t]+[^{:\\r\\n]*?)[ \\t]*\\{[ \\t]*\\r?\\n[ \\t]*Inherits[ \\t]+([\\w.]+)[ \\t]*$",
                "$1 : $2 {"));
        rules.add(anyCase(
                "(\\b(?:class|struct)[ \\t]+[^{:\\r\\n]*:[^{\\r\\n]*?)[ \\t]*\\{[ \\t]*\\r?\\n[ \\t]*Implements[ \\t]+([\\w., \\t]+?)[ \\t]*$",
                "$1, $2 {"));
        rules.add(anyCase(
                "(\\b(?:class|struct)[ \\t]+[^{:\\r\\n]*?)[ \\t]*\\{[ \\t]*\\r?\\n[ \\t]*Implements[ \\t]+([\\w., \\t]+?)[ \\t]*$",
                "$1 : $2 {"));
        rules.add(anyCase("^([ \\t]*)End[ \\t]+(?:Class|Structure|Interface|Module)\\b", "$1}"));

        // 成员；先处理没有方法体的声明
        rules.add(anyCase(
                "^([ \\t]*)((?:" + MODS + "[ \\t]+)*MustOverride[ \\t]+(?:" + MODS + "[ \\t]+)*)"
                        + "Sub[ \\t]+(\\w+)[ \\t]*\\(([^)\\r\\n]*)\\)[ \\t]*$",
                "$1$2void $3($4);"));
        rules.add(anyCase(
                "^([ \\t]*)((?:" + MODS + "[ \\t]+)*MustOverride[ \\t]+(?:" + MODS + "[ \\t]+)*)"
                        + "Function[ \\t]+(\\w+)[ \\t]*\\(([^)\\r\\n]*)\\)[ \\t]+As[ \\t]+(" + TYPE + ")[ \\t]*$",
                "$1$2$5 $3($4);"));
        // 类头之后的第一个 Sub New 成为该类的构造函数
        rules.add(anyCase(
                "(\\bclass[ \\t]+(\\w+)\\b[^\\r\\n]*+(?:\\r?\\n" + NOT_CTOR_LINE + "(?![^\\r\\n]*\\bclass[ \\t])[^\\r\\n]*+)*+\\r?\\n)"
                        + "([ \\t]*)((?:" + MODS + "[ \\t]+)*)"
                        + "Sub[ \\t]+New[ \\t]*\\(([^)\\r\\n]*)\\)[ \\t]*$",
                "$1$3$4$2($5) {"));
        rules.add(anyCase(
                PREFIX + "Sub[ \\t]+(\\w+)[ \\t]*\\(([^)\\r\\n]*)\\)" + CLAUSE + "[ \\t]*$",
                "$1$2void $3($4) {"));
        rules.add(anyCase(
                PREFIX + "Function[ \\t]+(\\w+)[ \\t]*\\(([^)\\r\\n]*)\\)[ \\t]+As[ \\t]+(" + TYPE + ")" + CLAUSE + "[ \\t]*$",
                "$1$2$5 $3($4) {"));
        rules.add(anyCase(
                PREFIX + "Function[ \\t]+(\\w+)[ \\t]*\\(([^)\\r\\n]*)\\)" + CLAUSE + "[ \\t]*$",
                "$1$2object $3($4) {"));
        rules.add(anyCase("^([ \\t]*)End[ \\t]+(?:Sub|Function)\\b", "$1}"));
        rules.add(anyCase(
                "^([ \\t]*)((?:" + MODS + "[ \\t]+)*)ReadOnly[ \\t]+((?:" + MODS + "[ \\t]+)*)"
                        + "Property[ \\t]+(\\w+)(?:[ \\t]*\\([ \\t]*\\))?[ \\t]+As[ \\t]+(" + TYPE + ")[ \\t]*$",
                "$1$2$3$5 $4 { get; }"));
        rules.add(anyCase(
                PREFIX + "Property[ \\t]+(\\w+)(?:[ \\t]*\\([ \\t]*\\))?[ \\t]+As[ \\t]+(" + TYPE + ")[ \\t]*$",
                "$1$2$4 $3 { get; set; }"));
        rules.add(anyCase(
                PREFIX + "Const[ \\t]+(\\w+)[ \\t]+As[ \\t]+(" + TYPE + ")[ \\t]*=[ \\t]*(.+?)[ \\t]*$",
                "$1$2const $4 $3 = $5;"));

        // 参数
        rules.add(anyCase("\\bOptional[ \\t]+", ""));
        rules.add(anyCase("\\bByVal[ \\t]+(\\w+)[ \\t]+As[ \\t]+(" + TYPE + ")", "$2 $1"));
        rules.add(anyCase("\\bByRef[ \\t]+(\\w+)[ \\t]+As[ \\t]+(" + TYPE + ")", "ref $2 $1"));
        rules.add(anyCase("([(,][ \\t]*)(\\w+)[ \\t]+As[ \\t]+(" + TYPE + ")(?=[ \\t]*[,)=])", "$1$3 $2"));

        // 局部变量和字段
        rules.add(anyCase(
                "^([ \\t]*)Dim[ \\t]+(\\w+)[ \\t]+As[ \\t]+New[ \\t]+(" + TYPE + ")[ \\t]*\\(([^\\r\\n]*)\\)[ \\t]*$",
                "$1var $2 = new $3($4);"));
        rules.add(anyCase(
                "^([ \\t]*)Dim[ \\t]+(\\w+)[ \\t]+As[ \\t]+New[ \\t]+(" + TYPE + ")[ \\t]*$",
                "$1var $2 = new $3();"));
        rules.add(anyCase(
                "^([ \\t]*)Dim[ \\t]+(\\w+)[ \\t]+As[ \\t]+(" + TYPE + ")[ \\t]*=[ \\t]*(.+?)[ \\t]*$",
                "$1$3 $2 = $4;"));
        rules.add(anyCase("^([ \\t]*)Dim[ \\t]+(\\w+)[ \\t]+As[ \\t]+(" + TYPE + ")[ \\t]*$", "$1$3 $2;"));
        rules.add(anyCase("^([ \\t]*)Dim[ \\t]+(\\w+)[ \\t]*=[ \\t]*(.+?)[ \\t]*$", "$1var $2 = $3;"));
        rules.add(anyCase(
                "^([ \\t]*)((?:(?:Public|Private|Protected|Friend|Shared|ReadOnly)[ \\t]+)+)"
                        + "(?!(?:Sub|Function|Property|Class|Structure|Interface|Module|Const|Event|Enum"
                        + "|Declare|Delegate)\\b)(\\w+)[ \\t]+As[ \\t]+(" + TYPE + ")[ \\t]*=[ \\t]*(.+?)[ \\t]*$",
                "$1$2$4 $3 = $5;"));
        rules.add(anyCase(
                "^([ \\t]*)((?:(?:Public|Private|Protected|Friend|Shared|ReadOnly)[ \\t]+)+)"
                        + "(?!(?:Sub|Function|Property|Class|Structure|Interface|Module|Const|Event|Enum"
                        + "|Declare|Delegate)\\b)(\\w+)[ \\t]+As[ \\t]+(" + TYPE + ")[ \\t]*$",
                "$1$2$4 $3;"));

        // 跳转，包括单行 If 之后的跳转；行尾注释保持不变
        rules.add(anyCase(CODE + "\\bReturn" + UNCOMMENTED + "[ \\t]+(.+?)[ \\t]*$", "$1return $2;"));
        rules.add(anyCase(CODE + "\\bReturn" + UNCOMMENTED + "[ \\t]*$", "$1return;"));
        rules.add(anyCase(CODE + "\\bExit" + UNCOMMENTED + "[ \\t]+(?:Sub|Function|Property)\\b", "$1return;"));
        rules.add(anyCase(CODE + "\\bExit" + UNCOMMENTED + "[ \\t]+(?:For|Do|While)\\b", "$1break;"));
        rules.add(anyCase(CODE + "\\bContinue" + UNCOMMENTED + "[ \\t]+(?:For|Do|While)\\b", "$1continue;"));
        rules.add(anyCase("^([ \\t]*)Throw[ \\t]+(.+?)[ \\t]*$", "$1throw $2;"));
        rules.add(anyCase("^([ \\t]*)Call[ \\t]+", "$1"));

        // 条件
        rules.add(anyCase("^([ \\t]*)(?:ElseIf|Else[ \\t]+If)[ \\t]+(.+?)[ \\t]+Then[ \\t]*$", "$1} else if ($2) {"));
        rules.add(anyCase("^([ \\t]*)If[ \\t]+(.+?)[ \\t]+Then[ \\t]*$", "$1if ($2) {"));
        rules.add(anyCase("^([ \\t]*)If[ \\t]+(.+?)[ \\t]+Then[ \\t]+(\\S.*?)[ \\t]*$", "$1if ($2) $3"));
        rules.add(anyCase("^([ \\t]*)Else[ \\t]*$", "$1} else {"));
        rules.add(anyCase("^([ \\t]*)End[ \\t]+If\\b", "$1}"));

        // 循环
        rules.add(anyCase(
                "^([ \\t]*)For[ \\t]+Each[ \\t]+(\\w+)[ \\t]+As[ \\t]+(" + TYPE + ")[ \\t]+In[ \\t]+(.+?)[ \\t]*$",
                "$1foreach ($3 $2 in $4) {"));
        rules.add(anyCase("^([ \\t]*)For[ \\t]+Each[ \\t]+(\\w+)[ \\t]+In[ \\t]+(.+?)[ \\t]*$", "$1foreach (var $2 in $3) {"));
        rules.add(anyCase(
                "^([ \\t]*)For[ \\t]+(\\w+)(?:[ \\t]+As[ \\t]+\\w+)?[ \\t]*=[ \\t]*(.+?)[ \\t]+To[ \\t]+(.+?)"
                        + "[ \\t]+Step[ \\t]+(-?[\\w.]+)[ \\t]*$",
                "$1for (int $2 = $3; $2 <= $4; $2 += $5) {"));
        rules.add(anyCase(
                "^([ \\t]*)For[ \\t]+(\\w+)(?:[ \\t]+As[ \\t]+\\w+)?[ \\t]*=[ \\t]*(.+?)[ \\t]+To[ \\t]+(.+?)[ \\t]*$",
                "$1for (int $2 = $3; $2 <= $4; $2++) {"));
        rules.add(anyCase("^([ \\t]*)Next\\b.*$", "$1}"));
        rules.add(anyCase("^([ \\t]*)Do[ \\t]+While[ \\t]+(.+?)[ \\t]*$", "$1while ($2) {"));
        rules.add(anyCase("^([ \\t]*)Do[ \\t]+Until[ \\t]+(.+?)[ \\t]*$", "$1while (!($2)) {"));
        rules.add(anyCase("^([ \\t]*)Do[ \\t]*$", "$1do {"));
        rules.add(anyCase("^([ \\t]*)Loop[ \\t]+While[ \\t]+(.+?)[ \\t]*$", "$1} while ($2);"));
        rules.add(anyCase("^([ \\t]*)Loop[ \\t]+Until[ \\t]+(.+?)[ \\t]*$", "$1} while (!($2));"));
        rules.add(anyCase("^([ \\t]*)Loop[ \\t]*$", "$1}"));
        rules.add(anyCase("^([ \\t]*)While[ \\t]+(.+?)[ \\t]*$", "$1while ($2) {"));
        rules.add(anyCase("^([ \\t]*)End[ \\t]+While\\b", "$1}"));

        // 异常处理
        rules.add(anyCase("^([ \\t]*)Try[ \\t]*$", "$1try {"));
        rules.add(anyCase("^([ \\t]*)Catch[ \\t]+(\\w+)[ \\t]+As[ \\t]+([\\w.]+)[ \\t]*$", "$1} catch ($3 $2) {"));
        rules.add(anyCase("^([ \\t]*)Catch[ \\t]*$", "$1} catch {"));
        rules.add(anyCase("^([ \\t]*)Finally[ \\t]*$", "$1} finally {"));
        rules.add(anyCase("^([ \\t]*)End[ \\t]+Try\\b", "$1}"));

        // 运算符和字面量
        rules.add(anyCase("[ \\t]+&=[ \\t]+", " += "));
        rules.add(anyCase("[ \\t]+&[ \\t]+", " + "));
        rules.add(word("AndAlso\\b", "&&"));
        rules.add(word("OrElse\\b", "||"));
        rules.add(word("And\\b", "&&"));
        rules.add(word("Or\\b", "||"));
        rules.add(word("Mod\\b", "%"));
        rules.add(word("IsNot[ \\t]+Nothing\\b", "!= null"));
        rules.add(word("Is[ \\t]+Nothing\\b", "== null"));
        rules.add(word("IsNot\\b", "!="));
        rules.add(word("Is\\b", "=="));
        rules.add(word("Nothing\\b", "null"));
        rules.add(anyCase("<>", "!="));
        // if/while 条件中的单个 = 是比较运算
        rules.add(anyCase(
                "=(?![=>])(?<=^[ \\t]{0,64}(?:\\}[ \\t]?(?:else )?)?(?:if|while) \\([^\\r\\n]{0,400}[^=!<>+\\-*/]=)", "=="));
        rules.add(word("Not[ \\t]+", "!"));
        rules.add(word("Me\\.", "this."));
        rules.add(word("Me\\b", "this"));
        rules.add(word("True\\b", "true"));
        rules.add(word("False\\b", "false"));
        rules.add(word("New\\b", "new"));

        // 修饰符和类型名
        rules.add(word("Overloads[ \\t]+", ""));
        rules.add(word("Shadows\\b", "new"));
        MODIFIERS.forEach((vb, cs) -> rules.add(word(vb + "\\b", cs)));
        rules.add(anyCase("\\(Of[ \\t]+([^)\\r\\n]*)\\)", "<$1>"));
        TYPES.forEach((vb, cs) -> rules.add(anyCase(
                "\\b" + vb + "\\b(?=[ \\t]+\\w+[ \\t]*(?:[({,)=;]|in\\b)|[ \\t]*[>,])", cs)));

        // 调用、赋值和自增行的语句结束符
        rules.add(anyCase(
                "^([ \\t]*)(?![^\\r\\n]*//)((?!(?:" + STATEMENT_KEYWORDS + ")\\b)[A-Za-z_][\\w.]*(?:\\[[^\\]\\r\\n]*\\])?"
                        + "[ \\t]*(?:\\(|[+\\-*/%]?=|\\+\\+|--)(?:[^\\r\\n]*[^;{}\\s])?)[ \\t]*$",
                "$1$2;"));
        rules.add(anyCase("^([ \\t]*if \\([^\\r\\n]*\\) )(?!\\{)([A-Za-z_][^\\r\\n]*[^;{}\\s])[ \\t]*$", "$1$2;"));
        return List.copyOf(rules);
    }

    static RewritePipeline pipeline() {
        return new RewritePipeline(
                DialectPair.of(Dialect.VBNET, Dialect.CSHARP),
                List.of(new RuleListStage("VB.NET -> C# rules", rules()), BlockClosingPass.braces()),
                WARNING);
    }

    /** 忽略大小写的关键字规则，不改动 "//" 注释中的文本。 */
    private static RewriteRule word(String regex, String replacement) {
        return anyCase("\\b" + regex + UNCOMMENTED, replacement);
    }

    private static Map<String, String> orderedMap(String... pairs) {
        var map = new LinkedHashMap<String, String>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
