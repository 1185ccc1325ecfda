package com.example.musictracker.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI musicTrackerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Music Tracker API")
                        .description("Directory tracking, import and maintenance of the music catalog")
                        .version("v1")
                        .contact(new Contact().name("music-tracker")));
    }
}
