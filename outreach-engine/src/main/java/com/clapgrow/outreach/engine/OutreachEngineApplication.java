package com.clapgrow.outreach.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.web.reactive.WebFluxAutoConfiguration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(exclude = {
    WebFluxAutoConfiguration.class  // WebClient only; the API itself is served by Spring MVC
})
@EnableKafka
@EnableScheduling
public class OutreachEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(OutreachEngineApplication.class, args);
    }
}
