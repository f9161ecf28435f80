/**
 * AppConfig.java
 *
 * 该文件定义应用级别的Bean：访问外部智能体所用的HTTP客户端、
 * 负责与智能体交换JSON的Gson实例，以及共享的改写规则表。
 */
package club.ppmc.transpiler.config;

import club.ppmc.transpiler.service.SettingsService;
import club.ppmc.transpiler.service.rules.RewriteRuleSets;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AppConfig {

    /**
     * 用于翻译请求的 RestTemplate。连接和读取时间都受增强超时限制，
     * 超时会表现为传输失败。
     */
    @Bean
    public RestTemplate augmentationRestTemplate(SettingsService settingsService) {
        return restTemplate(settingsService.getSettings().getAugmentationTimeoutMillis());
    }

    /** 用于检测端点可达性的 RestTemplate，使用较短的检测超时。 */
    @Bean
    public RestTemplate checkRestTemplate(SettingsService settingsService) {
        return restTemplate(settingsService.getSettings().getCheckTimeoutMillis());
    }

    /**
     * 与智能体交换数据使用的 Gson。字段名采用 snake_case，与其余API保持一致。
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .disableHtmlEscaping()
                .create();
    }

    /** 改写规则表，只构建一次，所有请求只读共享。 */
    @Bean
    public RewriteRuleSets rewriteRuleSets() {
        return RewriteRuleSets.defaults();
    }

    private static RestTemplate restTemplate(int timeoutMillis) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMillis);
        factory.setReadTimeout(timeoutMillis);
        return new RestTemplate(factory);
    }
}
