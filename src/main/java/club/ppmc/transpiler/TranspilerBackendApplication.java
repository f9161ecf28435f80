/**
 * TranspilerBackendApplication.java
 *
 * VB / VB.NET / C# 代码转换服务的主启动类。
 */
package club.ppmc.transpiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TranspilerBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TranspilerBackendApplication.class, args);
    }
}
