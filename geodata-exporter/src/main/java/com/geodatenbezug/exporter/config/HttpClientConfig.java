package com.geodatenbezug.exporter.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate used for all geodienste.ch exchanges.
 * Stateless and shared by concurrent topic exports.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, GeodiensteProperties properties) {
        return builder
                .setConnectTimeout(properties.getApi().getConnectTimeout())
                .setReadTimeout(properties.getApi().getReadTimeout())
                .build();
    }
}
