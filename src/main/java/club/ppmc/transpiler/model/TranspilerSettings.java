/**
 * TranspilerSettings.java
 *
 * 该文件定义了一个POJO，表示转换器的生效配置。
 * 它在启动时由 SettingsService 根据 application.properties 和可选的JSON覆盖文件组装。
 * 它是一个可变对象，以便Jackson把覆盖文件合并到默认值上；对外只提供副本。
 */
package club.ppmc.transpiler.model;

import lombok.Data;

@Data
public class TranspilerSettings {

    // --- 语法树边界 ---
    /** 规范化语法树的最大深度，根节点深度为 0。 */
    private int maxTreeDepth = 50;

    /** 每个节点最多保留的子节点数量。 */
    private int maxChildren = 20;

    /** 每个节点上保存的文本摘录的最大长度。 */
    private int excerptLength = 100;

    /** 语义摘要中名称片段的最大长度。 */
    private int summaryNameLength = 50;

    // --- 校验 ---
    private int minCodeLength = 10;

    // --- 智能体增强 ---
    private int augmentationTimeoutMillis = 30_000;
    private int checkTimeoutMillis = 10_000;

    /** 请求启用增强但未指定端点时使用的默认端点。 */
    private String defaultServerUrl;

    private String defaultApiKey;

    // --- Web ---
    private String allowedOrigins = "*";

    /**
     * 创建一个字段完全相同的独立副本。
     *
     * @return 新的设置对象，修改它不会影响原对象。
     */
    public TranspilerSettings copy() {
        var copy = new TranspilerSettings();
        copy.setMaxTreeDepth(maxTreeDepth);
        copy.setMaxChildren(maxChildren);
        copy.setExcerptLength(excerptLength);
        copy.setSummaryNameLength(summaryNameLength);
        copy.setMinCodeLength(minCodeLength);
        copy.setAugmentationTimeoutMillis(augmentationTimeoutMillis);
        copy.setCheckTimeoutMillis(checkTimeoutMillis);
        copy.setDefaultServerUrl(defaultServerUrl);
        copy.setDefaultApiKey(defaultApiKey);
        copy.setAllowedOrigins(allowedOrigins);
        return copy;
    }
}
