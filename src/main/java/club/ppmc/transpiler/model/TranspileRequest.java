/**
 * TranspileRequest.java
 *
 * 转换接口的请求体。设置 {@code useMcp} 时，服务会先尝试 {@code mcpConfig} 描述的外部智能体
 * （或配置的默认端点），失败后回退到规则引擎。
 */
package club.ppmc.transpiler.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TranspileRequest(
        @NotNull String code,
        @NotBlank String sourceLang,
        @NotBlank String targetLang,
        boolean useMcp,
        AugmentationConfig mcpConfig) {}
