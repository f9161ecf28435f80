/**
 * Dialect.java
 *
 * 转换器支持的方言集合：旧版 Visual Basic 6、其面向对象的继任者 VB.NET，
 * 以及 C 语言家族的 C#。
 * 客户端传入的标签会先经过规范化（转小写，去掉空格和句点），
 * 再与这里声明的别名进行匹配。
 */
package club.ppmc.transpiler.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum Dialect {
    VB("vb", "Visual Basic 6", List.of("vb", "vb6")),
    VBNET("vbnet", "VB.NET", List.of("vbnet")),
    CSHARP("csharp", "C#", List.of("csharp", "c#", "c_sharp"));

    private final String value;
    private final String label;
    private final List<String> aliases;

    Dialect(String value, String label, List<String> aliases) {
        this.value = value;
        this.label = label;
        this.aliases = aliases;
    }

    public String value() {
        return value;
    }

    public String label() {
        return label;
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * 规范化客户端传入的方言标签：转小写，去掉空格和句点。
     * "VB.NET" 变为 "vbnet"，"C #" 变为 "c#"。
     */
    public static String normalizeTag(String tag) {
        if (tag == null) {
            return "";
        }
        return tag.toLowerCase(Locale.ROOT).replace(" ", "").replace(".", "");
    }

    /**
     * 将原始标签解析为方言。未知或空标签返回 empty。
     */
    public static Optional<Dialect> fromTag(String tag) {
        String normalized = normalizeTag(tag);
        return Arrays.stream(values())
                .filter(d -> d.aliases.contains(normalized))
                .findFirst();
    }
}
