package club.ppmc.transpiler.model;

/**
 * 与外部智能体一次交互的结果：要么是翻译后的文本，要么是交互失败的原因。
 * 失败以值的形式返回，从不抛出异常，由调用方决定下一步。
 */
public record AugmentationOutcome(boolean success, String translatedText, String error) {

    public static AugmentationOutcome translated(String text) {
        return new AugmentationOutcome(true, text, null);
    }

    public static AugmentationOutcome failed(String error) {
        return new AugmentationOutcome(false, null, error);
    }
}
