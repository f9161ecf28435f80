package club.ppmc.transpiler.service.rules;

import java.util.List;

/**
 * 一个方言组合的完整改写：按顺序排列的各个阶段，
 * 以及该组合每次翻译都会附带的提示性警告。
 */
public record RewritePipeline(DialectPair pair, List<RewriteStage> stages, String advisoryWarning) {

    public RewritePipeline {
        stages = List.copyOf(stages);
    }

    public String apply(String text) {
        String result = text;
        for (RewriteStage stage : stages) {
            result = stage.apply(result);
        }
        return result;
    }
}
