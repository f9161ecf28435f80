package club.ppmc.transpiler.controller;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.transpiler.model.DialectInfo;
import club.ppmc.transpiler.model.ParseResponse;
import club.ppmc.transpiler.model.SemanticSummary;
import club.ppmc.transpiler.model.SyntaxNode;
import club.ppmc.transpiler.model.TranslationMethod;
import club.ppmc.transpiler.model.TranslationResult;
import club.ppmc.transpiler.model.TranspileRequest;
import club.ppmc.transpiler.model.ValidateResponse;
import club.ppmc.transpiler.model.ValidationIssue;
import club.ppmc.transpiler.service.CodeValidationService;
import club.ppmc.transpiler.service.SettingsService;
import club.ppmc.transpiler.service.TranspilerService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TranspilerController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(SettingsService.class)
class TranspilerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TranspilerService transpilerService;

    @MockBean
    private CodeValidationService validationService;

    @Test
    void rootReturnsBanner() throws Exception {
        mockMvc.perform(get("/api/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("VB/C# Transpiler API v1.0"));
    }

    @Test
    void transpileReadsAndWritesSnakeCase() throws Exception {
        when(transpilerService.transpile(any(TranspileRequest.class)))
                .thenReturn(new TranslationResult(true, "int x;", List.of("w"), List.of(), TranslationMethod.RULE_BASED_COMPOSED));

        mockMvc.perform(post("/api/transpile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"code": "Dim x As Integer", "source_lang": "vb", "target_lang": "csharp", "use_mcp": false}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.transpiled_code").value("int x;"))
                .andExpect(jsonPath("$.method").value("rule-based-composed"))
                .andExpect(jsonPath("$.warnings[0]").value("w"));
    }

    @Test
    void unsupportedPairIsStillOk() throws Exception {
        when(transpilerService.transpile(any(TranspileRequest.class)))
                .thenReturn(new TranslationResult(
                        false, "x", List.of(), List.of("Conversion from vb to vb not supported"), TranslationMethod.ERROR));

        mockMvc.perform(post("/api/transpile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"x\", \"source_lang\": \"vb\", \"target_lang\": \"vb\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.method").value("error"))
                .andExpect(jsonPath("$.errors[0]").value("Conversion from vb to vb not supported"));
    }

    @Test
    void missingFieldIsRejected() throws Exception {
        mockMvc.perform(post("/api/transpile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"x\", \"source_lang\": \"vb\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(startsWith("Invalid request")));

        verifyNoInteractions(transpilerService);
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        mockMvc.perform(post("/api/parse").contentType(MediaType.APPLICATION_JSON).content("{\"code\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed JSON request body"));
    }

    @Test
    void parseReturnsTreeAndSummary() throws Exception {
        var tree = new SyntaxNode("root", "compilation_unit", "Dim x", 0, 3, List.of());
        when(transpilerService.parse(eq("Dim x"), eq("vb"))).thenReturn(ParseResponse.of(tree, SemanticSummary.empty()));

        mockMvc.perform(post("/api/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"Dim x\", \"source_lang\": \"vb\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.ast.end_line").value(3))
                .andExpect(jsonPath("$.semantic_tree.classes").isEmpty());
    }

    @Test
    void validateReturnsIssues() throws Exception {
        when(validationService.validate("x", "csharp")).thenReturn(new ValidateResponse(
                true, List.of(), List.of(new ValidationIssue("Code is very short", 0))));

        mockMvc.perform(post("/api/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"x\", \"language\": \"csharp\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.warnings[0].message").value("Code is very short"))
                .andExpect(jsonPath("$.warnings[0].line").value(0));
    }

    @Test
    void dialectsAreListed() throws Exception {
        when(transpilerService.dialects())
                .thenReturn(List.of(new DialectInfo("csharp", "C#", List.of("csharp", "c#"), true)));

        mockMvc.perform(get("/api/dialects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].value").value("csharp"))
                .andExpect(jsonPath("$[0].grammar_available").value(true));
    }
}
