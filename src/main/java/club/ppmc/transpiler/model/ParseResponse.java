package club.ppmc.transpiler.model;

/**
 * 解析接口的响应。失败时 {@code ast} 和 {@code semanticTree} 为 null，
 * {@code error} 给出原因。
 */
public record ParseResponse(
        boolean success, SyntaxNode ast, SemanticSummary semanticTree, String error) {

    public static ParseResponse of(SyntaxNode ast, SemanticSummary summary) {
        return new ParseResponse(true, ast, summary, null);
    }

    public static ParseResponse failure(String error) {
        return new ParseResponse(false, null, null, error);
    }
}
