/**
 * TranspilerController.java
 *
 * 转换器的REST接口：代码解析、翻译、校验以及支持的方言列表。
 * 核心操作总是返回 200 并附带 success 标志，只有格式错误的请求体才会被拒绝（见 ApiExceptionHandler）。
 */
package club.ppmc.transpiler.controller;

import club.ppmc.transpiler.model.DialectInfo;
import club.ppmc.transpiler.model.ParseRequest;
import club.ppmc.transpiler.model.ParseResponse;
import club.ppmc.transpiler.model.TranslationResult;
import club.ppmc.transpiler.model.TranspileRequest;
import club.ppmc.transpiler.model.ValidateRequest;
import club.ppmc.transpiler.model.ValidateResponse;
import club.ppmc.transpiler.service.CodeValidationService;
import club.ppmc.transpiler.service.TranspilerService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@Slf4j
public class TranspilerController {

    static final String BANNER = "VB/C# Transpiler API v1.0";

    private final TranspilerService transpilerService;
    private final CodeValidationService validationService;

    public TranspilerController(TranspilerService transpilerService, CodeValidationService validationService) {
        this.transpilerService = transpilerService;
        this.validationService = validationService;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", BANNER));
    }

    @GetMapping("/dialects")
    public ResponseEntity<List<DialectInfo>> dialects() {
        return ResponseEntity.ok(transpilerService.dialects());
    }

    /**
     * 返回代码的有界语法树和语义摘要。没有语法的方言返回占位树。
     */
    @PostMapping("/parse")
    public ResponseEntity<ParseResponse> parse(@Valid @RequestBody ParseRequest request) {
        log.debug("解析请求: {} 个字符, 语言 {}", request.code().length(), request.sourceLang());
        return ResponseEntity.ok(transpilerService.parse(request.code(), request.sourceLang()));
    }

    @PostMapping("/transpile")
    public ResponseEntity<TranslationResult> transpile(@Valid @RequestBody TranspileRequest request) {
        log.debug(
                "转换请求: {} 个字符, {} -> {}, agent={}",
                request.code().length(),
                request.sourceLang(),
                request.targetLang(),
                request.useMcp());
        return ResponseEntity.ok(transpilerService.transpile(request));
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidateResponse> validate(@Valid @RequestBody ValidateRequest request) {
        return ResponseEntity.ok(validationService.validate(request.code(), request.language()));
    }
}
