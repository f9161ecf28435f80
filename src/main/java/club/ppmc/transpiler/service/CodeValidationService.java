/**
 * CodeValidationService.java
 *
 * 按方言检查源代码。有语法时，语法树中的 ERROR 节点和缺失节点记为错误；
 * 没有语法时假定代码有效，并给出一条警告说明。
 * 合理性启发式检查（目前只有最小长度）在任何情况下都会执行，
 * 并且只会添加警告。
 */
package club.ppmc.transpiler.service;

import club.ppmc.transpiler.model.ParseOutcome;
import club.ppmc.transpiler.model.ParseTreeNode;
import club.ppmc.transpiler.model.ValidateResponse;
import club.ppmc.transpiler.model.ValidationIssue;
import club.ppmc.transpiler.util.TextExcerpts;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class CodeValidationService {

    static final String NO_PARSER_WARNING = "Parser not available for this language. Basic validation only.";
    static final String SHORT_CODE_WARNING = "Code is very short";

    private static final String ERROR_NODE_TYPE = "ERROR";
    private static final int MAX_REPORTED_ERRORS = 20;
    private static final int ERROR_EXCERPT_LENGTH = 30;

    private final SourceParserService parserService;
    private final SettingsService settingsService;

    public CodeValidationService(SourceParserService parserService, SettingsService settingsService) {
        this.parserService = parserService;
        this.settingsService = settingsService;
    }

    public ValidateResponse validate(String code, String language) {
        try {
            List<ValidationIssue> errors = new ArrayList<>();
            List<ValidationIssue> warnings = new ArrayList<>();

            ParseOutcome outcome = parserService.parse(code, language);
            if (outcome.isParsed()) {
                errors.addAll(syntaxErrors(outcome.root()));
            } else {
                log.debug("'{}' 没有语法检查: {}", language, outcome.message());
                warnings.add(new ValidationIssue(NO_PARSER_WARNING, 0));
            }

            if (code.strip().length() < settingsService.getSettings().getMinCodeLength()) {
                warnings.add(new ValidationIssue(SHORT_CODE_WARNING, 0));
            }
            return new ValidateResponse(errors.isEmpty(), errors, warnings);
        } catch (RuntimeException e) {
            log.error("校验 '{}' 代码失败", language, e);
            return new ValidateResponse(false, List.of(new ValidationIssue(String.valueOf(e.getMessage()), 0)), List.of());
        }
    }

    /**
     * 按文档顺序收集最外层的 ERROR 节点和所有缺失节点。
     * ERROR 节点的内容不再继续搜索。
     */
    List<ValidationIssue> syntaxErrors(ParseTreeNode root) {
        List<ValidationIssue> issues = new ArrayList<>();
        Deque<ParseTreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty() && issues.size() < MAX_REPORTED_ERRORS) {
            ParseTreeNode node = stack.pop();
            if (ERROR_NODE_TYPE.equals(node.type())) {
                String near = TextExcerpts.truncate(node.text().strip(), ERROR_EXCERPT_LENGTH);
                issues.add(new ValidationIssue("Syntax error near '" + near + "'", node.startLine()));
                continue;
            }
            if (node.isMissing()) {
                issues.add(new ValidationIssue("Missing " + node.type(), node.startLine()));
                continue;
            }
            for (int i = node.childCount() - 1; i >= 0; i--) {
                stack.push(node.child(i));
            }
        }
        return issues;
    }
}
