/**
 * WebConfig.java
 *
 * 该文件定义了全局的Spring Web MVC配置。
 * 它为浏览器前端开放CORS，来源模式取自 transpiler.cors.allowed-origins（逗号分隔，默认 "*"）。
 * 因为允许携带凭证，这里使用 allowedOriginPatterns 而不是 allowedOrigins。
 */
package club.ppmc.transpiler.config;

import club.ppmc.transpiler.service.SettingsService;
import java.util.Arrays;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final SettingsService settingsService;

    public WebConfig(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = Arrays.stream(settingsService.getSettings().getAllowedOrigins().split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toArray(String[]::new);
        registry.addMapping("/**")
                .allowedOriginPatterns(origins.length == 0 ? new String[] {"*"} : origins)
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
