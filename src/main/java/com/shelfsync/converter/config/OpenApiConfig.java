package com.shelfsync.converter.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    static final String TRIGGER_TOKEN = "triggerToken";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme bearer = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer");

        return new OpenAPI()
                .info(new Info()
                        .title("ShelfSync Converter API")
                        .version("0.1.0")
                        .description("Receiver-to-catalog sync daemon: health, task queue and trigger endpoints."))
                .components(new Components().addSecuritySchemes(TRIGGER_TOKEN, bearer));
    }

    @Bean
    public OpenApiCustomizer triggerSecurityCustomizer() {
        return openAPI -> {
            if (openAPI.getPaths() == null) return;
            SecurityRequirement requirement = new SecurityRequirement().addList(TRIGGER_TOKEN);
            openAPI.getPaths().forEach((path, item) -> {
                if (path.startsWith("/trigger") || path.startsWith("/enqueue")) {
                    Operation post = item.getPost();
                    if (post != null) post.addSecurityItem(requirement);
                }
            });
        };
    }
}
