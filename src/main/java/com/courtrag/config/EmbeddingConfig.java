package com.courtrag.config;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@Getter
public class EmbeddingConfig {

    @Value("${court-rag.embedding.dimension:0}")
    private Integer dimension;

    @Value("${court-rag.embedding.timeout-seconds:10}")
    private Integer timeoutSeconds;

    @Value("${court-rag.embedding.base-url:http://localhost:8000}")
    private String baseUrl;

    @Bean
    public WebClient embeddingWebClient() {
        log.info("==============================================");
        log.info("EMBEDDING SERVICE CONFIGURATION");
        log.info("==============================================");
        log.info("  Base URL  : {}", baseUrl);
        log.info("  Dimension : {}", dimension > 0 ? dimension : "any");
        log.info("  Timeout   : {}s", timeoutSeconds);
        log.info("==============================================");

        return WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(
                HttpClient.create().responseTimeout(Duration.ofSeconds(timeoutSeconds))))
            .build();
    }
}
