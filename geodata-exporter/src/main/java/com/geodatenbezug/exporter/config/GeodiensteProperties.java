package com.geodatenbezug.exporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Component
@ConfigurationProperties(prefix = "geodienste")
@Data
public class GeodiensteProperties {

    private Api api = new Api();
    private Export export = new Export();
    private Download download = new Download();
    private Report report = new Report();

    /**
     * Access tokens per canton code, e.g. geodienste.tokens.ZG.
     * Usually supplied through environment variables (GEODIENSTE_TOKENS_ZG).
     */
    private Map<String, String> tokens = new HashMap<>();

    /** Token for a canton; keys bound from environment variables arrive lower-cased */
    public Optional<String> tokenFor(String canton) {
        return tokens.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(canton))
                .map(Map.Entry::getValue)
                .filter(token -> token != null && !token.isBlank())
                .findFirst();
    }

    @Data
    public static class Api {
        private String baseUrl = "https://geodienste.ch";
        private String language = "de";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Export {
        /** Flat delay between conflict / status retries; the service asks for one minute */
        private Duration retryInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Download {
        private String dataDir = "/data/geodienste";
        private String username;
        private String password;

        public boolean hasCredentials() {
            return username != null && !username.isBlank() && password != null;
        }
    }

    @Data
    public static class Report {
        private String outputDir = "/data/reports";
        private boolean includeHeader = true;
    }
}
