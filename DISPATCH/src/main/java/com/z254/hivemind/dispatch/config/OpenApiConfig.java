package com.z254.hivemind.dispatch.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI dispatchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("DISPATCH API")
                        .description("""
                                DISPATCH - capability-based task routing for the HIVEMIND agent pool.

                                ## Features
                                - **Registry**: agents with per-capability proficiency and concurrency limits
                                - **Routing**: load-aware scoring with deadline and age based priority escalation
                                - **Messaging**: durable per-agent inboxes plus live broadcast
                                - **Learning**: success and failure patterns mined from outcomes
                                - **Improvements**: ranked proposals generated from the learned patterns
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
