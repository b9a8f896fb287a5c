package com.lynkvertx.lcce.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI (Swagger) Configuration
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("LCCE API")
                .description("Logistics Cost Calculation Engine API Documentation")
                .version("0.1.0")
                .contact(new Contact()
                    .name("LCCE Team")
                    .email("logistics-cost@lynkvertx.com"))
                .license(new License()
                    .name("Proprietary")));
    }
}
