package club.ppmc.transpiler.service.rules;

/**
 * 改写流水线中的一个步骤。各阶段都是纯函数：相同输入总是产生相同输出，
 * 阶段之间不保存任何状态。
 */
public interface RewriteStage {

    String name();

    String apply(String text);
}
