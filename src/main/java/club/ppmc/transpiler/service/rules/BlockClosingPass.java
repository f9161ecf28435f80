/**
 * BlockClosingPass.java
 *
 * 在扁平规则列表之后执行的结构化逐行处理。块的起始行连同其缩进被压入一个显式栈，
 * 块的结束行将其弹出。
 *
 * <ul>
 *   <li>BRACES（输出为 C#）：以 "{" 结尾的行开启一个块，以 "}" 开头的行关闭一个块。
 *       输入结束时仍未关闭的块会追加一个 "}"。</li>
 *   <li>END_KEYWORDS（输出为 VB.NET）：由 C# 遗留的大括号决定块的起止，
 *       拥有 "{" 的那一行决定结束关键字（Class 对应 End Class，For 对应 Next 等）。
 *       大括号会被移除，右大括号变为最内层打开块的结束关键字；
 *       没有 VB 对应结构的块则直接去掉。Else、ElseIf、Catch 和 Finally 延续当前块而不是关闭它。
 *       缺失的结束关键字追加在输入末尾。</li>
 * </ul>
 *
 * 这是尽力而为的启发式处理，而不是括号配对器：它只看行的形状，
 * 因此与代码同行的大括号，或者写在同一缩进层级上的多个并列条件，
 * 都可能导致嵌套错误。
 */
package club.ppmc.transpiler.service.rules;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

public final class BlockClosingPass implements RewriteStage {

    public enum Mode {
        BRACES,
        END_KEYWORDS
    }

    private static final String VB_MODIFIERS =
            "(?:(?:Public|Private|Protected|Friend|Shared|Overrides|Overridable|MustInherit"
                    + "|NotInheritable|Overloads|Shadows|ReadOnly|Partial)\\s+)*+";

    /** VB.NET 块起始行的形状及其结束关键字，按顺序检查。 */
    private static final List<Opener> VB_OPENERS =
            List.of(
                    new Opener("^Namespace\\b", "End Namespace"),
                    new Opener("^" + VB_MODIFIERS + "Class\\b", "End Class"),
                    new Opener("^" + VB_MODIFIERS + "Module\\b", "End Module"),
                    new Opener("^" + VB_MODIFIERS + "Structure\\b", "End Structure"),
                    new Opener("^" + VB_MODIFIERS + "Interface\\b", "End Interface"),
                    new Opener("^" + VB_MODIFIERS + "Sub\\b", "End Sub"),
                    new Opener("^" + VB_MODIFIERS + "Function\\b", "End Function"),
                    new Opener("^" + VB_MODIFIERS + "Property\\b", "End Property"),
                    new Opener("^If\\b.*\\bThen$", "End If"),
                    new Opener("^For\\b", "Next"),
                    new Opener("^While\\b", "End While"),
                    new Opener("^Do\\b", "Loop"),
                    new Opener("^Select\\s+Case\\b", "End Select"),
                    new Opener("^Using\\b", "End Using"),
                    new Opener("^SyncLock\\b", "End SyncLock"),
                    new Opener("^Try$", "End Try"));

    private static final Pattern INHERITANCE = Pattern.compile("^(?:Inherits|Implements)\\b");

    private static final Pattern CONTINUATION = Pattern.compile("^(?:Else|ElseIf|Catch|Finally)\\b");

    private record Opener(Pattern pattern, String closer) {
        Opener(String regex, String closer) {
            this(Pattern.compile(regex), closer);
        }
    }

    /** 一个打开的块：起始行的缩进以及关闭它的内容（"" 表示无）。 */
    private record Frame(String indent, String closer) {}

    private final Mode mode;

    public BlockClosingPass(Mode mode) {
        this.mode = mode;
    }

    public static BlockClosingPass braces() {
        return new BlockClosingPass(Mode.BRACES);
    }

    public static BlockClosingPass endKeywords() {
        return new BlockClosingPass(Mode.END_KEYWORDS);
    }

    public Mode mode() {
        return mode;
    }

    @Override
    public String name() {
        return mode == Mode.BRACES ? "brace closing pass" : "End keyword pass";
    }

    @Override
    public String apply(String text) {
        String newline = text.contains("\r\n") ? "\r\n" : "\n";
        String[] lines = text.split("\r?\n", -1);
        Walk walk = new Walk(lines);
        for (int i = 0; i < lines.length; i++) {
            if (mode == Mode.BRACES) {
                walk.braceLine(lines[i]);
            } else {
                walk.keywordLine(i);
            }
        }
        // 关闭所有仍然打开的块，从最内层开始
        while (!walk.stack.isEmpty()) {
            Frame frame = walk.stack.pop();
            String closer = mode == Mode.BRACES ? "}" : frame.closer();
            if (!closer.isEmpty()) {
                walk.emit(frame.indent() + closer);
            }
        }
        return String.join(newline, walk.out);
    }

    static boolean isContinuation(String stripped) {
        return CONTINUATION.matcher(stripped).find();
    }

    static String closerFor(String stripped) {
        for (Opener opener : VB_OPENERS) {
            if (opener.pattern().matcher(stripped).find()) {
                return opener.closer();
            }
        }
        return null;
    }

    private static String indentOf(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    /** 一次处理的状态。 */
    private static final class Walk {

        private final String[] lines;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final List<String> out = new ArrayList<>();

        /** 最近一个没有大括号的块头；单独一行的 Allman 风格 "{" 归属于它。 */
        private String pendingLine;
        private String pendingIndent;

        Walk(String[] lines) {
            this.lines = lines;
        }

        void emit(String line) {
            out.add(line);
        }

        void braceLine(String line) {
            String stripped = line.strip();
            if (stripped.startsWith("}") && !stack.isEmpty()) {
                stack.pop();
            }
            if (stripped.endsWith("{")) {
                stack.push(new Frame(indentOf(line), "}"));
            }
            emit(line);
        }

        void keywordLine(int index) {
            String line = lines[index];
            String indent = indentOf(line);
            String rest = line.strip();

            if (rest.isEmpty()) {
                emit(line);
                return;
            }

            // 行首的右大括号，可能有多个
            while (rest.startsWith("}")) {
                rest = rest.substring(1).strip();
                if (isContinuation(rest) || (rest.isEmpty() && continuationFollows(index))) {
                    break;
                }
                if (!stack.isEmpty()) {
                    Frame frame = stack.pop();
                    if (!frame.closer().isEmpty()) {
                        emit(frame.indent() + frame.closer());
                    }
                }
            }
            if (rest.isEmpty()) {
                pendingLine = null;
                return;
            }

            if (rest.equals("{")) {
                openAllman(indent);
                return;
            }
            if (rest.endsWith("{")) {
                String content = rest.substring(0, rest.length() - 1).stripTrailing();
                if (!isContinuation(content)) {
                    String closer = closerFor(content);
                    stack.push(new Frame(indent, closer == null ? "" : closer));
                }
                pendingLine = null;
                emit(indent + content);
                return;
            }
            if (closerFor(rest) != null || isContinuation(rest)) {
                pendingLine = rest;
                pendingIndent = indent;
            } else if (!INHERITANCE.matcher(rest).find()) {
                pendingLine = null;
            }
            emit(indent + rest);
        }

        private void openAllman(String braceIndent) {
            if (pendingLine == null) {
                stack.push(new Frame(braceIndent, ""));
                return;
            }
            String owner = pendingLine;
            pendingLine = null;
            if (isContinuation(owner)) {
                return;
            }
            String closer = closerFor(owner);
            stack.push(new Frame(pendingIndent, closer == null ? "" : closer));
        }

        private boolean continuationFollows(int index) {
            for (int i = index + 1; i < lines.length; i++) {
                String next = lines[i].strip();
                if (!next.isEmpty()) {
                    return isContinuation(next);
                }
            }
            return false;
        }
    }
}
