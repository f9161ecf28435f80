/**
 * ParseRequest.java
 *
 * 解析接口的请求体：一段源代码及其声明的方言。
 */
package club.ppmc.transpiler.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * @param code 要解析的源代码。
 * @param sourceLang 声明的方言标签，例如 "csharp" 或 "vbnet"。
 */
public record ParseRequest(@NotNull String code, @NotBlank String sourceLang) {}
