/**
 * AugmentationGateway.java
 *
 * 可选的外部翻译智能体的客户端。每次调用发送一个请求，不重试：
 * 规范化语法树、原始代码和两个方言标签连同一条指令作为上下文发出，
 * 翻译结果从 "result"（或 "transpiled_code"）字段返回。
 * 传输错误、超时、非 200 响应和格式错误的响应体都会作为失败的 AugmentationOutcome 返回；
 * 不会向调用方抛出异常，调用方随后回退到规则引擎。
 *
 * 与智能体交换的JSON使用 Gson 构建和读取，
 * 这样它的格式不受HTTP层 Jackson 配置的影响。
 */
package club.ppmc.transpiler.service;

import club.ppmc.transpiler.model.AugmentationOutcome;
import club.ppmc.transpiler.model.ConnectionCheckResult;
import club.ppmc.transpiler.model.SyntaxNode;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

@Service
@Slf4j
public class AugmentationGateway {

    /** 可能携带翻译结果的响应字段，按优先级排列。 */
    private static final List<String> RESULT_FIELDS = List.of("result", "transpiled_code");

    private final RestTemplate restTemplate;
    private final RestTemplate checkRestTemplate;
    private final Gson gson;

    public AugmentationGateway(
            @Qualifier("augmentationRestTemplate") RestTemplate restTemplate,
            @Qualifier("checkRestTemplate") RestTemplate checkRestTemplate,
            Gson gson) {
        this.restTemplate = restTemplate;
        this.checkRestTemplate = checkRestTemplate;
        this.gson = gson;
    }

    /**
     * 请求 {@code serverUrl} 处的智能体翻译 {@code sourceCode}。
     *
     * @param apiKey 可选的 Bearer 凭证；为空时不发送 Authorization 头。
     */
    public AugmentationOutcome translate(
            String serverUrl,
            String apiKey,
            SyntaxNode tree,
            String sourceCode,
            String sourceLang,
            String targetLang) {
        if (!StringUtils.hasText(serverUrl)) {
            return AugmentationOutcome.failed("No agent endpoint configured");
        }

        String payload = gson.toJson(buildPayload(tree, sourceCode, sourceLang, targetLang));
        var entity = new HttpEntity<>(payload, headers(apiKey));
        try {
            ResponseEntity<String> response =
                    restTemplate.exchange(serverUrl, HttpMethod.POST, entity, String.class);
            int status = response.getStatusCode().value();
            if (status != 200) {
                log.warn("智能体 {} 返回状态码 {}", serverUrl, status);
                return AugmentationOutcome.failed("MCP server returned " + status);
            }
            return readTranslation(response.getBody());
        } catch (HttpStatusCodeException e) {
            log.warn("智能体 {} 返回状态码 {}", serverUrl, e.getStatusCode().value());
            return AugmentationOutcome.failed("MCP server returned " + e.getStatusCode().value());
        } catch (Exception e) {
            log.warn("调用智能体 {} 失败: {}", serverUrl, e.getMessage());
            return AugmentationOutcome.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    /** 检查端点对普通 GET 请求是否返回 200 或 201。 */
    public ConnectionCheckResult checkConnection(String serverUrl, String apiKey) {
        var entity = new HttpEntity<Void>(headers(apiKey));
        try {
            ResponseEntity<String> response =
                    checkRestTemplate.exchange(serverUrl, HttpMethod.GET, entity, String.class);
            int status = response.getStatusCode().value();
            boolean reachable = status == 200 || status == 201;
            return new ConnectionCheckResult(reachable, status, reachable ? "Connection successful" : "Connection failed");
        } catch (HttpStatusCodeException e) {
            return new ConnectionCheckResult(false, e.getStatusCode().value(), "Connection failed");
        } catch (Exception e) {
            log.debug("检测端点 {} 失败", serverUrl, e);
            return new ConnectionCheckResult(false, null, "Error: " + e.getMessage());
        }
    }

    JsonObject buildPayload(SyntaxNode tree, String sourceCode, String sourceLang, String targetLang) {
        var context = new JsonObject();
        context.add("ast", gson.toJsonTree(tree));
        context.addProperty("source_code", sourceCode);
        context.addProperty("source_language", sourceLang);
        context.addProperty("target_language", targetLang);

        var payload = new JsonObject();
        payload.add("context", context);
        payload.addProperty(
                "task",
                "Transpile the provided " + sourceLang + " code to " + targetLang + ". Use the AST context provided.");
        return payload;
    }

    private AugmentationOutcome readTranslation(String body) {
        if (!StringUtils.hasText(body)) {
            return AugmentationOutcome.failed("Malformed agent response: empty body");
        }
        JsonElement root;
        try {
            root = JsonParser.parseString(body);
        } catch (JsonParseException e) {
            return AugmentationOutcome.failed("Malformed agent response: " + e.getMessage());
        }
        if (!root.isJsonObject()) {
            return AugmentationOutcome.failed("Malformed agent response: not a JSON object");
        }
        JsonObject object = root.getAsJsonObject();
        for (String field : RESULT_FIELDS) {
            JsonElement value = object.get(field);
            if (value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
                String text = value.getAsString();
                if (StringUtils.hasText(text)) {
                    return AugmentationOutcome.translated(text);
                }
            }
        }
        return AugmentationOutcome.failed("Malformed agent response: no translation in " + RESULT_FIELDS);
    }

    private static HttpHeaders headers(String apiKey) {
        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.hasText(apiKey)) {
            headers.setBearerAuth(apiKey);
        }
        return headers;
    }
}
