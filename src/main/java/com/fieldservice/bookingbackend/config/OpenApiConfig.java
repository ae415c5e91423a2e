package com.fieldservice.bookingbackend.config;

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
    public OpenAPI bookingBackendOpenAPI() {
        final String securitySchemeName = "bearerAuth";

        return new OpenAPI()
                .info(new Info()
                        .title("Field Service Booking Backend API")
                        .description("""
                                Location tracking and proximity matching for on-demand vehicle cleaning professionals.

                                This API provides endpoints for:
                                - **Tracking**: Position, status, tracking toggle and tracking settings (professionals)
                                - **Lookup**: Current location and location history of a professional
                                - **Nearby**: Available professionals around a point, sorted by distance
                                - **Subscriptions**: Follow a professional's live position

                                **Real-time Updates**: Live positions are broadcast over STOMP at `/ws`,
                                topic `/topic/locations/{professionalId}`.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Platform Team")
                                .email("platform@fieldservice.example")))
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
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("JWT issued by the auth service.")));
    }
}
