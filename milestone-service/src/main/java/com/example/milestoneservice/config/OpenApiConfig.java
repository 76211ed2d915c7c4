package com.example.milestoneservice.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI milestoneOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Milestone Service API")
                        .version("1.0.0")
                        .description("""
                                Updates timeline milestones and keeps each timeline consistent.
                                
                                ## Behaviour
                                - Changing `order` shifts the displaced siblings by one slot
                                - Changing `duration` or `completionDate` reschedules every later milestone
                                - `startDate` and `endDate` are derived and cannot be set
                                - One `milestone.updated` Kafka event per successful update
                                
                                ## Authentication
                                All `/api/**` endpoints require a JWT Bearer token.
                                """))
                .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")));
    }
}
