/**
 * RewriteRuleSets.java
 *
 * 所有受支持翻译路径的不可变注册表：直接流水线（每个有规则表的方言组合一条），
 * 以及经由中间方言串联两条流水线的组合路径。
 * 启动时构建一次，所有请求线程只读共享。
 */
package club.ppmc.transpiler.service.rules;

import club.ppmc.transpiler.model.Dialect;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class RewriteRuleSets {

    static final String COMPOSED_WARNING = "Two-step conversion (VB -> VB.NET -> C#). Extensive testing required.";

    /** 先执行源方言到中间方言的流水线，再执行中间方言到目标方言的流水线得到的翻译。 */
    public record ComposedPath(DialectPair pair, Dialect via, String advisoryWarning) {}

    private final Map<DialectPair, RewritePipeline> direct;
    private final Map<DialectPair, ComposedPath> composed;

    public RewriteRuleSets(List<RewritePipeline> pipelines, List<ComposedPath> paths) {
        Map<DialectPair, RewritePipeline> directMap = new LinkedHashMap<>();
        for (RewritePipeline pipeline : pipelines) {
            if (directMap.put(pipeline.pair(), pipeline) != null) {
                throw new IllegalArgumentException("Duplicate rule set for " + pipeline.pair());
            }
        }
        Map<DialectPair, ComposedPath> composedMap = new LinkedHashMap<>();
        for (ComposedPath path : paths) {
            DialectPair pair = path.pair();
            if (directMap.containsKey(pair)) {
                throw new IllegalArgumentException("Composed path shadows direct rule set for " + pair);
            }
            if (!directMap.containsKey(DialectPair.of(pair.source(), path.via()))
                    || !directMap.containsKey(DialectPair.of(path.via(), pair.target()))) {
                throw new IllegalArgumentException("Composed path " + pair + " has a missing hop via " + path.via().label());
            }
            composedMap.put(pair, path);
        }
        this.direct = Collections.unmodifiableMap(directMap);
        this.composed = Collections.unmodifiableMap(composedMap);
    }

    /** 内置的规则表。 */
    public static RewriteRuleSets defaults() {
        return new RewriteRuleSets(
                List.of(
                        VbToVbNetRules.pipeline(),
                        VbNetToCSharpRules.pipeline(),
                        CSharpToVbNetRules.pipeline()),
                List.of(new ComposedPath(
                        DialectPair.of(Dialect.VB, Dialect.CSHARP), Dialect.VBNET, COMPOSED_WARNING)));
    }

    public Optional<RewritePipeline> direct(DialectPair pair) {
        return Optional.ofNullable(direct.get(pair));
    }

    public Optional<ComposedPath> composed(DialectPair pair) {
        return Optional.ofNullable(composed.get(pair));
    }

    public Map<DialectPair, RewritePipeline> directPipelines() {
        return direct;
    }

    public Map<DialectPair, ComposedPath> composedPaths() {
        return composed;
    }
}
