package club.ppmc.transpiler.model;

/**
 * 外部翻译智能体的连接参数。
 *
 * @param serverUrl 请求 POST 到的端点地址。
 * @param apiKey 可选的 Bearer 凭证。
 */
public record AugmentationConfig(String serverUrl, String apiKey) {}
