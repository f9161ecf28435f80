/**
 * ParseOutcome.java
 *
 * 解析适配器的返回值：原生语法树、声明"该方言没有语法"，或者解析失败。
 * 调用方对后两种情况做相同处理。
 */
package club.ppmc.transpiler.model;

public record ParseOutcome(Status status, ParseTreeNode root, String message) {

    public enum Status {
        PARSED,
        GRAMMAR_UNAVAILABLE,
        FAILED
    }

    public static ParseOutcome parsed(ParseTreeNode root) {
        return new ParseOutcome(Status.PARSED, root, null);
    }

    public static ParseOutcome grammarUnavailable(String message) {
        return new ParseOutcome(Status.GRAMMAR_UNAVAILABLE, null, message);
    }

    public static ParseOutcome failed(String message) {
        return new ParseOutcome(Status.FAILED, null, message);
    }

    public boolean isParsed() {
        return status == Status.PARSED && root != null;
    }
}
