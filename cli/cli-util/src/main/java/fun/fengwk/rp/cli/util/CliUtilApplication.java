package fun.fengwk.rp.cli.util;

import fun.fengwk.rp.core.mcp.PlainContentMcp;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.rp")
public class CliUtilApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliUtilApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "spring.ai.mcp.server", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ToolCallbackProvider plainContentTools(PlainContentMcp plainContentMcp) {
        return MethodToolCallbackProvider.builder()
            .toolObjects(plainContentMcp)
            .build();
    }

}
