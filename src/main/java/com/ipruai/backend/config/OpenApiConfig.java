package com.ipruai.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI emailParserOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("IPRU AI Email Parser API")
                        .description("Extracts statement requests (identifiers, period, statement types) from client emails.")
                        .version("v2")
                        .contact(new Contact()
                                .name("IPRU AI")
                                .email("support@ipruai.local")
                        )
                );
    }
}
