/**
 * TranslationResult.java
 *
 * 一次转换请求的结果。每个请求创建一次，原样返回给客户端，
 * 不做任何持久化。
 */
package club.ppmc.transpiler.model;

import java.util.List;

/**
 * @param success 没有记录错误时为 true。
 * @param transpiledCode 生成的文本；不支持的组合会原样返回输入，
 *     内部错误时为 null。
 * @param warnings 有序的提示性警告。
 * @param errors 有序的错误。
 * @param method 产生结果的路径。
 */
public record TranslationResult(
        boolean success,
        String transpiledCode,
        List<String> warnings,
        List<String> errors,
        TranslationMethod method) {

    public TranslationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static TranslationResult failure(String error) {
        return new TranslationResult(false, null, List.of(), List.of(error), TranslationMethod.ERROR);
    }
}
