/**
 * RewriteRuleEngine.java
 *
 * 基于规则的方言翻译。在共享的 RewriteRuleSets 中查找转换组合，
 * 然后执行其直接流水线；对于组合路径，则依次执行两段转换。
 * 引擎本身无状态，并发调用只读取不可变的规则表。
 */
package club.ppmc.transpiler.service;

import club.ppmc.transpiler.model.Dialect;
import club.ppmc.transpiler.model.TranslationMethod;
import club.ppmc.transpiler.model.TranslationResult;
import club.ppmc.transpiler.service.rules.DialectPair;
import club.ppmc.transpiler.service.rules.RewritePipeline;
import club.ppmc.transpiler.service.rules.RewriteRuleSets;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class RewriteRuleEngine {

    private final RewriteRuleSets ruleSets;

    public RewriteRuleEngine(RewriteRuleSets ruleSets) {
        this.ruleSets = ruleSets;
    }

    /**
     * 将 {@code code} 从 {@code sourceTag} 翻译为 {@code targetTag}。
     *
     * <p>未知标签、相同方言以及没有规则集的组合会返回不成功的结果，
     * 原样返回输入，并附带一条 "not supported" 错误。
     *
     * @throws club.ppmc.transpiler.exception.RewriteException 某条规则应用失败时抛出。
     */
    public TranslationResult translate(String code, String sourceTag, String targetTag) {
        Optional<Dialect> source = Dialect.fromTag(sourceTag);
        Optional<Dialect> target = Dialect.fromTag(targetTag);
        if (source.isEmpty() || target.isEmpty() || source.get() == target.get()) {
            return unsupported(code, sourceTag, targetTag);
        }

        DialectPair pair = DialectPair.of(source.get(), target.get());
        Optional<RewritePipeline> direct = ruleSets.direct(pair);
        if (direct.isPresent()) {
            RewritePipeline pipeline = direct.get();
            log.debug("基于规则的翻译 {}", pair);
            return new TranslationResult(
                    true,
                    pipeline.apply(code),
                    List.of(pipeline.advisoryWarning()),
                    List.of(),
                    TranslationMethod.RULE_BASED);
        }

        Optional<RewriteRuleSets.ComposedPath> composed = ruleSets.composed(pair);
        if (composed.isPresent()) {
            RewriteRuleSets.ComposedPath path = composed.get();
            // 两段都存在：RewriteRuleSets 不接受缺少某一段的组合路径
            RewritePipeline first = ruleSets.direct(DialectPair.of(pair.source(), path.via())).orElseThrow();
            RewritePipeline second = ruleSets.direct(DialectPair.of(path.via(), pair.target())).orElseThrow();
            log.debug("组合翻译 {}，经由 {}", pair, path.via().label());
            String intermediate = first.apply(code);
            return new TranslationResult(
                    true,
                    second.apply(intermediate),
                    List.of(path.advisoryWarning(), first.advisoryWarning(), second.advisoryWarning()),
                    List.of(),
                    TranslationMethod.RULE_BASED_COMPOSED);
        }

        return unsupported(code, sourceTag, targetTag);
    }

    private static TranslationResult unsupported(String code, String sourceTag, String targetTag) {
        log.info("请求了不支持的转换: {} -> {}", sourceTag, targetTag);
        return new TranslationResult(
                false,
                code,
                List.of(),
                List.of("Conversion from " + sourceTag + " to " + targetTag + " not supported"),
                TranslationMethod.ERROR);
    }
}
