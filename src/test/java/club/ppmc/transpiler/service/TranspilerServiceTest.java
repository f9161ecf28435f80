package club.ppmc.transpiler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import club.ppmc.transpiler.exception.RewriteException;
import club.ppmc.transpiler.model.AugmentationConfig;
import club.ppmc.transpiler.model.AugmentationOutcome;
import club.ppmc.transpiler.model.Dialect;
import club.ppmc.transpiler.model.DialectInfo;
import club.ppmc.transpiler.model.ParseOutcome;
import club.ppmc.transpiler.model.ParseResponse;
import club.ppmc.transpiler.model.SemanticEntry;
import club.ppmc.transpiler.model.SyntaxNode;
import club.ppmc.transpiler.model.TranslationMethod;
import club.ppmc.transpiler.model.TranslationResult;
import club.ppmc.transpiler.model.TranspileRequest;
import club.ppmc.transpiler.service.rules.RewriteRuleSets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TranspilerServiceTest {

    private static final String VBNET_CLASS = "Public Class Calculator\nEnd Class";

    private SourceParserService parserService;
    private AugmentationGateway gateway;
    private TranspilerService service;

    @BeforeEach
    void setUp() {
        parserService = mock(SourceParserService.class);
        gateway = mock(AugmentationGateway.class);
        when(parserService.parse(anyString(), anyString())).thenReturn(ParseOutcome.grammarUnavailable("none"));
        service = newService(SettingsFixtures.defaults(), new RewriteRuleEngine(RewriteRuleSets.defaults()));
    }

    @Test
    void agentFailureFallsBackToRules() {
        when(gateway.translate(anyString(), any(), any(), anyString(), anyString(), anyString()))
                .thenReturn(AugmentationOutcome.failed("MCP server returned 500"));
        var request = new TranspileRequest(
                VBNET_CLASS, "vbnet", "csharp", true, new AugmentationConfig("http://agent.local", "k"));

        TranslationResult result = service.transpile(request);

        assertThat(result.success()).isTrue();
        assertThat(result.method()).isEqualTo(TranslationMethod.RULE_BASED);
        assertThat(result.transpiledCode()).isEqualTo("public class Calculator {\n}");
        assertThat(result.warnings()).hasSize(2);
        assertThat(result.warnings().get(0))
                .isEqualTo("Agent augmentation failed (MCP server returned 500); used rule-based translation");
        assertThat(result.warnings().get(1)).startsWith("Converted VB.NET to C#");
    }

    @Test
    void agentSuccessIsReturnedAsIs() {
        when(gateway.translate(anyString(), any(), any(), anyString(), anyString(), anyString()))
                .thenReturn(AugmentationOutcome.translated("public class Calculator { }"));
        var request = new TranspileRequest(
                VBNET_CLASS, "vbnet", "csharp", true, new AugmentationConfig("http://agent.local", null));

        TranslationResult result = service.transpile(request);

        assertThat(result.method()).isEqualTo(TranslationMethod.AGENT_AUGMENTED);
        assertThat(result.transpiledCode()).isEqualTo("public class Calculator { }");
        assertThat(result.warnings()).containsExactly(TranspilerService.AGENT_WARNING);
    }

    @Test
    void agentReceivesPlaceholderTreeForVb() {
        when(gateway.translate(anyString(), any(), any(), anyString(), anyString(), anyString()))
                .thenReturn(AugmentationOutcome.translated("int x;"));
        var request = new TranspileRequest("Dim x As Integer", "vb", "csharp", true,
                new AugmentationConfig("http://agent.local", "k"));

        service.transpile(request);

        verify(gateway).translate(
                eq("http://agent.local"),
                eq("k"),
                argThat((SyntaxNode tree) -> "root".equals(tree.id())),
                eq("Dim x As Integer"),
                eq("vb"),
                eq("csharp"));
    }

    @Test
    void missingEndpointIsReportedAsWarning() {
        var request = new TranspileRequest(VBNET_CLASS, "vbnet", "csharp", true, null);

        TranslationResult result = service.transpile(request);

        verifyNoInteractions(gateway);
        assertThat(result.success()).isTrue();
        assertThat(result.warnings().get(0)).contains("no agent endpoint configured");
    }

    @Test
    void configuredDefaultEndpointIsUsed() {
        service = newService(
                SettingsFixtures.withDefaultEndpoint("http://default.local", "default-key"),
                new RewriteRuleEngine(RewriteRuleSets.defaults()));
        when(gateway.translate(anyString(), any(), any(), anyString(), anyString(), anyString()))
                .thenReturn(AugmentationOutcome.translated("ok"));

        service.transpile(new TranspileRequest(VBNET_CLASS, "vbnet", "csharp", true, new AugmentationConfig("", null)));

        verify(gateway).translate(eq("http://default.local"), eq("default-key"), any(), anyString(), anyString(), anyString());
    }

    @Test
    void agentIsNotCalledWhenDisabled() {
        TranslationResult result = service.transpile(
                new TranspileRequest(VBNET_CLASS, "vbnet", "csharp", false, new AugmentationConfig("http://agent.local", null)));

        verify(gateway, never()).translate(anyString(), any(), any(), anyString(), anyString(), anyString());
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void rewriteFailureBecomesUnsuccessfulResult() {
        RewriteRuleEngine engine = mock(RewriteRuleEngine.class);
        when(engine.translate(anyString(), anyString(), anyString())).thenThrow(
                new RewriteException("VB.NET -> C# rules", 3, "/x/ -> '$9'", new IndexOutOfBoundsException("No group 9")));
        service = newService(SettingsFixtures.defaults(), engine);

        TranslationResult result = service.transpile(new TranspileRequest("x", "vbnet", "csharp", false, null));

        assertThat(result.success()).isFalse();
        assertThat(result.method()).isEqualTo(TranslationMethod.ERROR);
        assertThat(result.transpiledCode()).isNull();
        assertThat(result.errors()).singleElement().asString().startsWith("Rule #3 of 'VB.NET -> C# rules' failed");
    }

    @Test
    void unsupportedPairCarriesNoAgentWarning() {
        when(gateway.translate(anyString(), any(), any(), anyString(), anyString(), anyString()))
                .thenReturn(AugmentationOutcome.failed("Connection refused"));
        var request = new TranspileRequest(
                VBNET_CLASS, "vbnet", "vbnet", true, new AugmentationConfig("http://127.0.0.1:1", null));

        TranslationResult result = service.transpile(request);

        assertThat(result.success()).isFalse();
        assertThat(result.method()).isEqualTo(TranslationMethod.ERROR);
        assertThat(result.warnings()).isEmpty();
        assertThat(result.errors()).containsExactly("Conversion from vbnet to vbnet not supported");
    }

    @Test
    void veryLongLinesTranslateInBothDirections() {
        String vb = "x = " + "a + ".repeat(3000) + "b";
        String cs = "x = " + "a / ".repeat(3000) + "b;";

        TranslationResult toCSharp = service.transpile(new TranspileRequest(vb, "vbnet", "csharp", false, null));
        TranslationResult toVbNet = service.transpile(new TranspileRequest(cs, "csharp", "vbnet", false, null));

        assertThat(toCSharp.success()).isTrue();
        assertThat(toCSharp.transpiledCode()).isEqualTo(vb + ";");
        assertThat(toVbNet.success()).isTrue();
        assertThat(toVbNet.transpiledCode()).isEqualTo(cs.substring(0, cs.length() - 1));
    }

    @Test
    void parseUsesPlaceholderForVb() {
        ParseResponse response = service.parse("Dim x As Integer", "vb");

        assertThat(response.success()).isTrue();
        assertThat(response.ast().id()).isEqualTo("root");
        assertThat(response.semanticTree().classes())
                .containsExactly(new SemanticEntry("Parsed structure", 0));
    }

    @Test
    void parseFailureIsReported() {
        when(parserService.parse(anyString(), eq("csharp"))).thenThrow(new IllegalStateException("boom"));

        ParseResponse response = service.parse("class A {}", "csharp");

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("boom");
        assertThat(response.ast()).isNull();
    }

    @Test
    void dialectsReportGrammarAvailability() {
        when(parserService.hasGrammar(Dialect.CSHARP)).thenReturn(true);

        List<DialectInfo> dialects = service.dialects();

        assertThat(dialects).extracting(DialectInfo::value).containsExactly("vb", "vbnet", "csharp");
        assertThat(dialects).extracting(DialectInfo::grammarAvailable).containsExactly(false, false, true);
    }

    private TranspilerService newService(SettingsService settings, RewriteRuleEngine engine) {
        return new TranspilerService(
                parserService,
                new SyntaxTreeService(settings),
                new SemanticSummaryService(settings),
                engine,
                gateway,
                settings);
    }
}
