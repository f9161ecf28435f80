package club.ppmc.transpiler.model;

import jakarta.validation.constraints.NotBlank;

/** 智能体连通性检测的请求体。 */
public record ConnectionCheckRequest(@NotBlank String serverUrl, String apiKey) {}
