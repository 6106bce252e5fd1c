package net.kairo.app.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** API docs: UI at {@code /api}, JSON at {@code /api-docs}. */
@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Bean
    public OpenAPI kairoOpenApi() {
        return new OpenAPI().info(new Info()
                .title("Kairo Scheduler")
                .description("API for cron job scheduling")
                .version("1.0"));
    }
}
