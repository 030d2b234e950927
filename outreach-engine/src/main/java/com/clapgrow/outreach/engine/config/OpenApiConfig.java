package com.clapgrow.outreach.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI outreachEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Outreach Engine API")
                        .description("Campaign management and delivery engine. " +
                                "Creates campaigns, accepts targets, runs rate-limited bulk sends " +
                                "and exposes live run progress with pause and retry controls.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("ClapGrow")
                                .email("support@clapgrow.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8085").description("Local Development Server")
                ));
    }
}
