/**
 * TextExcerpts.java
 *
 * 将源代码裁剪为有界摘录的小工具。
 */
package club.ppmc.transpiler.util;

public final class TextExcerpts {

    private TextExcerpts() {}

    /** 返回 {@code text} 开头最多 {@code maxLength} 个字符；null 视为 ""。 */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (maxLength <= 0) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        // 不拆分代理对
        int end = maxLength;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    /** {@code text} 按换行分隔的行数；空文本算一行。 */
    public static int lineCount(String text) {
        if (text == null || text.isEmpty()) {
            return 1;
        }
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }
}
