package com.municipality.wastecollection.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
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
    public OpenAPI wasteCollectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Waste Collection Coordinator API")
                        .description("""
                                Coordination API for municipal waste collection.

                                - **Bins**: registration, fill level reports, proximity and urgency queries
                                - **Trucks / Drivers**: fleet registry, duty state and live location ingestion
                                - **Routes**: optimization runs and the route execution lifecycle

                                State changes are also pushed over STOMP (`/ws`) on the `/topic/**` destinations.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Municipality IT Team")
                                .email("support@municipality.com")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")));
    }
}
