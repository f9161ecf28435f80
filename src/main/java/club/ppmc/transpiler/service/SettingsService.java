/**
 * SettingsService.java
 *
 * 该服务是转换器的配置中心。默认值来自 application.properties，
 * 可选的JSON文件 (transpiler.settings-file) 可以覆盖其中任意一项。
 * 配置只在启动时加载一次，之后只读，所有请求线程看到的值都相同。
 * 其他服务都应依赖此服务，而不是直接使用 @Value 注解。
 */
package club.ppmc.transpiler.service;

import club.ppmc.transpiler.model.TranspilerSettings;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);

    private final ObjectMapper objectMapper;
    private final String settingsFile;
    private final TranspilerSettings currentSettings;

    public SettingsService(
            @Value("${transpiler.tree.max-depth:50}") int maxTreeDepth,
            @Value("${transpiler.tree.max-children:20}") int maxChildren,
            @Value("${transpiler.tree.excerpt-length:100}") int excerptLength,
            @Value("${transpiler.summary.name-length:50}") int summaryNameLength,
            @Value("${transpiler.validation.min-length:10}") int minCodeLength,
            @Value("${transpiler.augmentation.timeout-millis:30000}") int augmentationTimeoutMillis,
            @Value("${transpiler.augmentation.check-timeout-millis:10000}") int checkTimeoutMillis,
            @Value("${transpiler.augmentation.default-server-url:}") String defaultServerUrl,
            @Value("${transpiler.augmentation.default-api-key:}") String defaultApiKey,
            @Value("${transpiler.cors.allowed-origins:*}") String allowedOrigins,
            @Value("${transpiler.settings-file:}") String settingsFile) {

        this.objectMapper =
                new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.settingsFile = settingsFile;

        var defaults = new TranspilerSettings();
        defaults.setMaxTreeDepth(maxTreeDepth);
        defaults.setMaxChildren(maxChildren);
        defaults.setExcerptLength(excerptLength);
        defaults.setSummaryNameLength(summaryNameLength);
        defaults.setMinCodeLength(minCodeLength);
        defaults.setAugmentationTimeoutMillis(augmentationTimeoutMillis);
        defaults.setCheckTimeoutMillis(checkTimeoutMillis);
        if (StringUtils.hasText(defaultServerUrl)) {
            defaults.setDefaultServerUrl(defaultServerUrl.trim());
        }
        if (StringUtils.hasText(defaultApiKey)) {
            defaults.setDefaultApiKey(defaultApiKey.trim());
        }
        defaults.setAllowedOrigins(allowedOrigins);

        this.currentSettings = applyOverlay(defaults);
        LOGGER.info(
                "转换器设置: maxDepth={}, maxChildren={}, excerptLength={}, agentTimeout={}ms",
                currentSettings.getMaxTreeDepth(),
                currentSettings.getMaxChildren(),
                currentSettings.getExcerptLength(),
                currentSettings.getAugmentationTimeoutMillis());
    }

    /**
     * 获取当前生效的设置。
     *
     * @return 设置的副本，调用方对它的修改不会影响其他请求。
     */
    public TranspilerSettings getSettings() {
        return currentSettings.copy();
    }

    private TranspilerSettings applyOverlay(TranspilerSettings defaults) {
        if (!StringUtils.hasText(settingsFile)) {
            return defaults;
        }
        Path path = Paths.get(settingsFile).toAbsolutePath().normalize();
        if (Files.notExists(path)) {
            LOGGER.warn("设置文件 {} 不存在，将使用 application.properties 中的默认值。", path);
            return defaults;
        }
        try {
            byte[] jsonData = Files.readAllBytes(path);
            // 合并到副本上，读取中途失败时默认值保持完整
            TranspilerSettings merged = objectMapper.readerForUpdating(defaults.copy()).readValue(jsonData);
            LOGGER.info("已从 {} 加载覆盖设置。", path);
            return merged;
        } catch (IOException e) {
            LOGGER.error("读取设置文件 {} 失败，将使用 application.properties 中的默认值。", path, e);
            return defaults;
        }
    }
}
