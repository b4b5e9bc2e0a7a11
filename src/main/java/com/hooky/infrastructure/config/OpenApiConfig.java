package com.hooky.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(AppProperties appProperties) {
        OpenAPI openAPI = new OpenAPI()
                .info(new Info()
                        .title("Hooky API")
                        .version("1.0")
                        .description("Temporary webhook receivers with request history and live streaming"));
        String publicBaseUrl = appProperties.getPublicBaseUrl();
        if (publicBaseUrl != null && !publicBaseUrl.isBlank()) {
            openAPI.servers(List.of(new Server().url(publicBaseUrl.trim())));
        }
        return openAPI;
    }
}
