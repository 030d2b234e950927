package com.clapgrow.outreach.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Value("${outreach.delivery.base-url:http://localhost:8090/api}")
    private String deliveryBaseUrl;

    @Bean
    public WebClient deliveryWebClient() {
        return WebClient.builder()
            .baseUrl(deliveryBaseUrl)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(1024 * 1024))
            .build();
    }
}
