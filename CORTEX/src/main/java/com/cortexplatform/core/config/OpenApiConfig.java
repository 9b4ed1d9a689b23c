package com.cortexplatform.core.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for Cortex Core.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cortexCoreOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Cortex Core API")
                        .description("""
                                Cortex Core - event routing and service orchestration.

                                ## Endpoints
                                - **Input**: submit user input for a conversation
                                - **Output stream**: follow a conversation's replies as Server-Sent Events
                                - **Services**: registered services with their tools and resources

                                ## Identity
                                Callers are identified by the `X-User-Id` header, set by the upstream gateway.
                                """)
                        .version("0.1.0"))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8080").description("Local development")
                ));
    }
}
