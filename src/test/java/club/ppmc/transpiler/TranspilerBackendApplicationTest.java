package club.ppmc.transpiler;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.transpiler.controller.TranspilerController;
import club.ppmc.transpiler.service.rules.RewriteRuleSets;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class TranspilerBackendApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(TranspilerController.class)).isNotNull();
        assertThat(context.getBean(RewriteRuleSets.class).directPipelines()).hasSize(3);
    }
}
