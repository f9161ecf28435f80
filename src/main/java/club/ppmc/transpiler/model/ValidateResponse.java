/**
 * ValidateResponse.java
 *
 * 合理性检查的结果。只有发现至少一个错误时 {@code valid} 才为 false，
 * 警告不影响有效性。
 */
package club.ppmc.transpiler.model;

import java.util.List;

public record ValidateResponse(
        boolean valid, List<ValidationIssue> errors, List<ValidationIssue> warnings) {

    public ValidateResponse {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
