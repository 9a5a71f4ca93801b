package com.z254.swarm.hive.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for HIVE.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI hiveOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HIVE API")
                        .description("""
                                HIVE - agent message bus and activation engine of SWARM.

                                ## Features
                                - **Agents**: create, remove, inspect caches, trigger, explore and seek
                                - **Connections**: keyword-tagged routing links between agents
                                - **Messages**: producer entry point into the bus
                                - **Checkpoints**: save and restore the whole system
                                """)
                        .version("0.1.0"))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
