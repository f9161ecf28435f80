package club.ppmc.transpiler.model;

/**
 * 检测智能体端点的结果。
 *
 * @param success 端点返回 200 或 201 时为 true。
 * @param statusCode 原始HTTP状态码，没有收到响应时为 null。
 * @param message 便于阅读的结果说明。
 */
public record ConnectionCheckResult(boolean success, Integer statusCode, String message) {}
