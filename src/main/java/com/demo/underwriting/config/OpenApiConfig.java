package com.demo.underwriting.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI underwritingOpenAPI() {
        return new OpenAPI().info(new Info()
                .title("Underwriting Risk Pipeline API")
                .description("Risk assessment, compliance findings and profile evidence for mortgage applications")
                .version("v1"));
    }
}
