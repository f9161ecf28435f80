package club.ppmc.transpiler.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** 校验接口的请求体。 */
public record ValidateRequest(@NotNull String code, @NotBlank String language) {}
