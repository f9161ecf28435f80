/**
 * AugmentationController.java
 *
 * 该控制器让前端在启用智能体增强之前检测端点是否可用。
 */
package club.ppmc.transpiler.controller;

import club.ppmc.transpiler.model.ConnectionCheckRequest;
import club.ppmc.transpiler.model.ConnectionCheckResult;
import club.ppmc.transpiler.service.AugmentationGateway;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/mcp")
public class AugmentationController {

    private final AugmentationGateway augmentationGateway;

    public AugmentationController(AugmentationGateway augmentationGateway) {
        this.augmentationGateway = augmentationGateway;
    }

    @PostMapping("/test")
    public ResponseEntity<ConnectionCheckResult> testConnection(@Valid @RequestBody ConnectionCheckRequest request) {
        return ResponseEntity.ok(augmentationGateway.checkConnection(request.serverUrl(), request.apiKey()));
    }
}
