package club.ppmc.transpiler.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.transpiler.model.TranslationMethod;
import club.ppmc.transpiler.model.TranslationResult;
import club.ppmc.transpiler.service.rules.RewriteRuleSets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RewriteRuleEngineTest {

    private RewriteRuleEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RewriteRuleEngine(RewriteRuleSets.defaults());
    }

    @Test
    void directPairUsesItsPipelineAndWarning() {
        TranslationResult result = engine.translate("Public Class Calculator\nEnd Class", "vbnet", "csharp");

        assertThat(result.success()).isTrue();
        assertThat(result.method()).isEqualTo(TranslationMethod.RULE_BASED);
        assertThat(result.transpiledCode()).isEqualTo("public class Calculator {\n}");
        assertThat(result.warnings()).containsExactly("Converted VB.NET to C#. Review Option Strict and type conversions.");
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void sameDialectIsNotSupportedAndEchoesInput() {
        String code = "Dim x As Integer";

        TranslationResult result = engine.translate(code, "vbnet", "vbnet");

        assertThat(result.success()).isFalse();
        assertThat(result.method()).isEqualTo(TranslationMethod.ERROR);
        assertThat(result.transpiledCode()).isEqualTo(code);
        assertThat(result.warnings()).isEmpty();
        assertThat(result.errors()).singleElement().asString().contains("not supported");
    }

    @Test
    void unknownDialectIsNotSupported() {
        TranslationResult result = engine.translate("print(1)", "python", "csharp");

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).containsExactly("Conversion from python to csharp not supported");
    }

    @Test
    void pairWithoutRuleSetIsNotSupported() {
        TranslationResult result = engine.translate("int x;", "csharp", "vb");

        assertThat(result.success()).isFalse();
        assertThat(result.method()).isEqualTo(TranslationMethod.ERROR);
    }

    @Test
    void vbToCSharpIsComposedThroughVbNet() {
        TranslationResult result = engine.translate("Dim x As Integer", "vb", "csharp");

        assertThat(result.success()).isTrue();
        assertThat(result.method()).isEqualTo(TranslationMethod.RULE_BASED_COMPOSED);
        assertThat(result.transpiledCode()).isEqualTo("int x;");
        assertThat(result.warnings()).hasSize(3);
        assertThat(result.warnings().get(0)).isEqualTo("Two-step conversion (VB -> VB.NET -> C#). Extensive testing required.");
        assertThat(result.warnings().get(1)).startsWith("Manual review recommended");
        assertThat(result.warnings().get(2)).startsWith("Converted VB.NET to C#");
    }

    @Test
    void tagsAreNormalized() {
        TranslationResult result = engine.translate("Public Class A\nEnd Class", "VB.NET", "C#");

        assertThat(result.success()).isTrue();
        assertThat(result.transpiledCode()).isEqualTo("public class A {\n}");
    }

    @Test
    void translationIsDeterministic() {
        String code = "Public Function Add(ByVal a As Integer, ByVal b As Integer) As Integer\n    Return a + b\nEnd Function";

        TranslationResult first = engine.translate(code, "vbnet", "csharp");
        TranslationResult second = engine.translate(code, "vbnet", "csharp");

        assertThat(second).isEqualTo(first);
    }

    @Test
    void csharpToVbNetEndsBlocksWithKeywords() {
        String code = "public class Calculator {\n"
                + "    public int Add(int a, int b) {\n"
                + "        return a + b;\n"
                + "    }\n"
                + "}";

        TranslationResult result = engine.translate(code, "csharp", "vbnet");

        assertThat(result.success()).isTrue();
        assertThat(result.warnings()).containsExactly("Converted C# to VB.NET. Review semicolons and brackets.");
        assertThat(result.transpiledCode()).isEqualTo("Public Class Calculator\n"
                + "    Public Function Add(ByVal a As Integer, ByVal b As Integer) As Integer\n"
                + "        Return a + b\n"
                + "    End Function\n"
                + "End Class");
    }
}
