/**
 * TranspilerService.java
 *
 * 入站操作的入口。它把解析器、语法树规范化、摘要、智能体网关和规则引擎组合在一起，
 * 也是所有意外故障的边界：故障在这里被转换为不成功的结果，
 * 因此单个错误输入永远不会表现为服务器错误。
 *
 * 当请求要求且端点已知时，翻译会先尝试外部智能体。智能体失败不算错误，
 * 请求会继续交给规则引擎处理，失败原因作为警告报告。
 */
package club.ppmc.transpiler.service;

import club.ppmc.transpiler.exception.RewriteException;
import club.ppmc.transpiler.model.AugmentationConfig;
import club.ppmc.transpiler.model.AugmentationOutcome;
import club.ppmc.transpiler.model.Dialect;
import club.ppmc.transpiler.model.DialectInfo;
import club.ppmc.transpiler.model.ParseOutcome;
import club.ppmc.transpiler.model.ParseResponse;
import club.ppmc.transpiler.model.SemanticSummary;
import club.ppmc.transpiler.model.SyntaxNode;
import club.ppmc.transpiler.model.TranslationMethod;
import club.ppmc.transpiler.model.TranslationResult;
import club.ppmc.transpiler.model.TranspileRequest;
import club.ppmc.transpiler.model.TranspilerSettings;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class TranspilerService {

    static final String AGENT_WARNING = "Transpiled using MCP agent";

    private final SourceParserService parserService;
    private final SyntaxTreeService treeService;
    private final SemanticSummaryService summaryService;
    private final RewriteRuleEngine ruleEngine;
    private final AugmentationGateway augmentationGateway;
    private final SettingsService settingsService;

    public TranspilerService(
            SourceParserService parserService,
            SyntaxTreeService treeService,
            SemanticSummaryService summaryService,
            RewriteRuleEngine ruleEngine,
            AugmentationGateway augmentationGateway,
            SettingsService settingsService) {
        this.parserService = parserService;
        this.treeService = treeService;
        this.summaryService = summaryService;
        this.ruleEngine = ruleEngine;
        this.augmentationGateway = augmentationGateway;
        this.settingsService = settingsService;
    }

    /** 返回 {@code code} 的有界语法树和语义摘要。 */
    public ParseResponse parse(String code, String sourceLang) {
        try {
            SyntaxNode tree = treeService.buildTree(parserService.parse(code, sourceLang), code);
            SemanticSummary summary = summaryService.summarize(tree);
            return ParseResponse.of(tree, summary);
        } catch (RuntimeException e) {
            log.error("解析 '{}' 输入出错", sourceLang, e);
            return ParseResponse.failure(String.valueOf(e.getMessage()));
        }
    }

    public TranslationResult transpile(TranspileRequest request) {
        try {
            String agentFailure = null;
            if (request.useMcp()) {
                AugmentationConfig endpoint = resolveEndpoint(request.mcpConfig());
                if (endpoint == null) {
                    agentFailure = "no agent endpoint configured";
                } else {
                    AugmentationOutcome outcome = augment(request, endpoint);
                    if (outcome.success()) {
                        return new TranslationResult(
                                true,
                                outcome.translatedText(),
                                List.of(AGENT_WARNING),
                                List.of(),
                                TranslationMethod.AGENT_AUGMENTED);
                    }
                    agentFailure = outcome.error();
                }
            }

            TranslationResult result = ruleEngine.translate(request.code(), request.sourceLang(), request.targetLang());
            // 不支持的组合只报告其错误，不附加智能体警告
            if (agentFailure == null || result.method() == TranslationMethod.ERROR) {
                return result;
            }
            log.info("回退到基于规则的翻译: {}", agentFailure);
            List<String> warnings = new ArrayList<>();
            warnings.add("Agent augmentation failed (" + agentFailure + "); used rule-based translation");
            warnings.addAll(result.warnings());
            return new TranslationResult(
                    result.success(), result.transpiledCode(), warnings, result.errors(), result.method());
        } catch (RewriteException e) {
            log.error("改写失败: {}", e.toErrorData(), e);
            return TranslationResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("转换出错 {} -> {}", request.sourceLang(), request.targetLang(), e);
            return TranslationResult.failure(String.valueOf(e.getMessage()));
        }
    }

    public List<DialectInfo> dialects() {
        return Arrays.stream(Dialect.values())
                .map(d -> new DialectInfo(d.value(), d.label(), d.aliases(), parserService.hasGrammar(d)))
                .toList();
    }

    private AugmentationOutcome augment(TranspileRequest request, AugmentationConfig endpoint) {
        ParseOutcome parsed = parserService.parse(request.code(), request.sourceLang());
        SyntaxNode tree = treeService.buildTree(parsed, request.code());
        return augmentationGateway.translate(
                endpoint.serverUrl(),
                endpoint.apiKey(),
                tree,
                request.code(),
                request.sourceLang(),
                request.targetLang());
    }

    /** 请求自带的端点；没有则使用配置的默认端点；都没有时返回 null。 */
    private AugmentationConfig resolveEndpoint(AugmentationConfig requested) {
        if (requested != null && StringUtils.hasText(requested.serverUrl())) {
            return requested;
        }
        TranspilerSettings settings = settingsService.getSettings();
        if (StringUtils.hasText(settings.getDefaultServerUrl())) {
            return new AugmentationConfig(settings.getDefaultServerUrl(), settings.getDefaultApiKey());
        }
        return null;
    }
}
