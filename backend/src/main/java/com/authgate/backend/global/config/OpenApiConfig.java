package com.authgate.backend.global.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    public static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI authGateOpenApi() {
        SecurityScheme bearerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .description("JWT access token, or an opaque access token on /auth/me-opaque");
        return new OpenAPI()
                .info(new Info()
                        .title("AuthGate API")
                        .description("Registration, login and token lifecycle in JWT and opaque modes")
                        .version("0.1.0"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, bearerScheme));
    }
}
