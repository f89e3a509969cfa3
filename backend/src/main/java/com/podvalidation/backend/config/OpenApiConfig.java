package com.podvalidation.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI podValidationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("POD Validation API")
                        .description("Proof-of-delivery document classification and client checklist validation")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("POD Validation Team")
                                .email("pod-validation@example.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development Server")));
    }
}
