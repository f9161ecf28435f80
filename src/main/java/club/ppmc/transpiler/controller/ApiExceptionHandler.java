/**
 * ApiExceptionHandler.java
 *
 * 将格式错误的请求体转换为 400 响应，响应体与控制器处理错误请求时相同，即 {"message": ...}。
 */
package club.ppmc.transpiler.controller;

import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(MethodArgumentNotValidException e) {
        String fields = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.debug("请求校验未通过: {}", fields);
        return ResponseEntity.badRequest().body(Map.of("message", "Invalid request: " + fields));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("无法解析请求体。", e);
        return ResponseEntity.badRequest().body(Map.of("message", "Malformed JSON request body"));
    }
}
