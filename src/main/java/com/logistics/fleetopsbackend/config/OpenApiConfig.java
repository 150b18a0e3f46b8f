package com.logistics.fleetopsbackend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI fleetOpsOpenAPI() {
        final String securitySchemeName = "basicAuth";

        return new OpenAPI()
                .info(new Info()
                        .title("Fleet Operations Backend API")
                        .description("""
                                Driver reassignment API of the fleet operations platform.

                                When a driver on active routes becomes unavailable, these endpoints:
                                - **Locate** the driver's outstanding stops per route/vehicle
                                - **Rank** replacement drivers and quantify the impact of each
                                - **Execute** the chosen reassignment atomically
                                - **Audit** past reassignments and regenerate route sheets

                                Every call is scoped to the company given in the `X-Company-Id` header.

                                **Real-time Updates**: executed reassignments are broadcast on the STOMP topic `/topic/reassignments`.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Fleet Operations Team")
                                .email("fleet-ops@logistics.example")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement()
                        .addList(securitySchemeName))
                .components(new Components()
                        .addSecuritySchemes(securitySchemeName,
                                new SecurityScheme()
                                        .name(securitySchemeName)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("basic")));
    }
}
