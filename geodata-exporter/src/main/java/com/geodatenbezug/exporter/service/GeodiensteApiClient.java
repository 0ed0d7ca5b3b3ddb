package com.geodatenbezug.exporter.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geodatenbezug.exporter.config.GeodiensteProperties;
import com.geodatenbezug.exporter.exception.GeodiensteApiException;
import com.geodatenbezug.exporter.model.BaseTopic;
import com.geodatenbezug.exporter.model.Canton;
import com.geodatenbezug.exporter.model.ExportStatus;
import com.geodatenbezug.exporter.model.GeodiensteExportError;
import com.geodatenbezug.exporter.model.GeodiensteExportSuccess;
import com.geodatenbezug.exporter.model.GeodiensteInfoData;
import com.geodatenbezug.exporter.model.GeodiensteStatusSuccess;
import com.geodatenbezug.exporter.model.Topic;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Client for the geodienste.ch info and download API.
 *
 * The export endpoints are eventually consistent: only one export may run per
 * account (a second start answers 404 with a "pending" error), and a started
 * export goes through queued and working before it ends in success or error.
 * {@link #startExport} and {@link #checkExportStatus} absorb both shapes with a
 * bounded retry and always hand back the last HTTP response, never a
 * retry-specific exception. Unrelated error responses are returned untouched;
 * transport failures propagate.
 *
 * The attempt counter is a method-local value, so one instance can drive
 * exports for several topics concurrently.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GeodiensteApiClient {

    /** Attempts per exchange, 0-indexed: retries happen for attempts 0..8 */
    public static final int MAX_ATTEMPTS = 10;

    static final String EXPORT_PENDING_ERROR =
            "Cannot start data export because there is another data export pending";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final GeodiensteProperties properties;
    private final ExportWaitStrategy waitStrategy;

    // ── Topic info ───────────────────────────────────────────────────────────

    /**
     * Fetch the catalog entries of all known topics for all cantons.
     *
     * @return topics listed by geodienste.ch; empty if the request fails for any reason
     */
    public List<Topic> requestTopicInfo() {
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/info/services.json")
                .queryParam("base_topics", join(BaseTopic.values(), BaseTopic::getId))
                .queryParam("topics", join(BaseTopic.values(), BaseTopic::getTopicName))
                .queryParam("cantons", join(Canton.values(), Canton::name))
                .queryParam("language", properties.getApi().getLanguage())
                .toUriString();

        log.info("Requesting topic info: {}", url);
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(URI.create(url), String.class);
            GeodiensteInfoData data = objectMapper.readValue(response.getBody(), GeodiensteInfoData.class);
            return data.getServices() == null ? Collections.emptyList() : data.getServices();
        } catch (Exception e) {
            // No topics this run; the caller carries on with an empty catalog
            log.error("Failed to request topic info from geodienste.ch: {}", e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    // ── Export start ─────────────────────────────────────────────────────────

    public ResponseEntity<String> startExport(Topic topic, String token) throws InterruptedException {
        return startExport(topic, token, 0);
    }

    /**
     * Start the export of a topic, retrying while another export of the account is pending.
     *
     * @param attempt attempt to start counting from; the start is logged only for attempt 0
     * @return the first response that is not a pending conflict, or the last conflict
     *         once {@link #MAX_ATTEMPTS} is reached
     */
    public ResponseEntity<String> startExport(Topic topic, String token, int attempt) throws InterruptedException {
        checkAttempt(attempt);
        String url = exportEndpoint(topic, token, "export.json");
        if (attempt == 0) {
            log.info("Starting data export for {} ({}) with {}...", topic.getTopicTitle(), topic.getCanton(), url);
        }

        for (int current = attempt; ; current++) {
            ResponseEntity<String> response = send(url);
            if (!isExportPending(response)) {
                return response;
            }
            if (current >= MAX_ATTEMPTS - 1) {
                log.error("Another export is still running. Attempt limit exceeded.");
                return response;
            }

            Duration wait = waitStrategy.getWaitDuration();
            log.info("Another export is already running. Retrying in {}.", describe(wait));
            sleep(wait);
        }
    }

    // ── Export status ────────────────────────────────────────────────────────

    public ResponseEntity<String> checkExportStatus(Topic topic, String token) throws InterruptedException {
        return checkExportStatus(topic, token, 0);
    }

    /**
     * Poll the export status of a topic until it is success or error.
     *
     * @param attempt attempt to start counting from; the check is logged only for attempt 0
     * @return the first non-2xx or terminal response, or the last queued / working
     *         response once {@link #MAX_ATTEMPTS} is reached
     * @throws GeodiensteApiException if a 2xx body is not a valid status payload
     */
    public ResponseEntity<String> checkExportStatus(Topic topic, String token, int attempt) throws InterruptedException {
        checkAttempt(attempt);
        String url = exportEndpoint(topic, token, "status.json");
        if (attempt == 0) {
            log.info("Checking export status for {} ({}) with {}...", topic.getTopicTitle(), topic.getCanton(), url);
        }

        for (int current = attempt; ; current++) {
            ResponseEntity<String> response = send(url);
            if (!response.getStatusCode().is2xxSuccessful()) {
                return response;
            }

            ExportStatus status = readStatus(response).getStatus();
            if (status.isTerminal()) {
                return response;
            }
            if (current >= MAX_ATTEMPTS - 1) {
                log.error("Attempt limit exceeded. Export status is still {}.", status.name().toLowerCase(Locale.ROOT));
                return response;
            }

            Duration wait = waitStrategy.getWaitDuration();
            if (status == ExportStatus.QUEUED) {
                log.info("Export is queued. Retrying in {}.", describe(wait));
            } else {
                log.info("Export is in progress. Retrying in {}.", describe(wait));
            }
            sleep(wait);
        }
    }

    // ── Response helpers ─────────────────────────────────────────────────────

    /**
     * Parse the body of a 2xx status.json response.
     */
    public GeodiensteStatusSuccess readStatus(ResponseEntity<String> response) {
        try {
            return objectMapper.readValue(response.getBody(), GeodiensteStatusSuccess.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new GeodiensteApiException("Unreadable export status payload: " + e.getMessage(), e);
        }
    }

    /**
     * The "info" text of a started export, or null if the body has none.
     */
    public String readExportInfo(ResponseEntity<String> response) {
        try {
            return objectMapper.readValue(response.getBody(), GeodiensteExportSuccess.class).getInfo();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Export start response carries no info: {}", e.getMessage());
            return null;
        }
    }

    /**
     * The "error" text of a failed export / status response, or the raw body if it has none.
     */
    public String readError(ResponseEntity<String> response) {
        GeodiensteExportError error = readQuietly(response.getBody());
        if (error != null && error.getError() != null) {
            return error.getError();
        }
        return response.getBody() == null || response.getBody().isBlank()
                ? response.getStatusCode().toString()
                : response.getBody();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ResponseEntity<String> send(String url) {
        try {
            return restTemplate.getForEntity(URI.create(url), String.class);
        } catch (HttpStatusCodeException e) {
            return ResponseEntity.status(e.getStatusCode())
                    .headers(e.getResponseHeaders())
                    .body(e.getResponseBodyAsString());
        }
    }

    private boolean isExportPending(ResponseEntity<String> response) {
        if (response.getStatusCode().value() != HttpStatus.NOT_FOUND.value()) {
            return false;
        }
        GeodiensteExportError error = readQuietly(response.getBody());
        return error != null && EXPORT_PENDING_ERROR.equals(error.getError());
    }

    private GeodiensteExportError readQuietly(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, GeodiensteExportError.class);
        } catch (JsonProcessingException e) {
            log.debug("Response body is not an error payload: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String exportEndpoint(Topic topic, String token, String file) {
        return UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl())
                .pathSegment("downloads", topic.getBaseTopic().getId(), token, file)
                .toUriString();
    }

    private void sleep(Duration wait) throws InterruptedException {
        if (!wait.isNegative() && !wait.isZero()) {
            Thread.sleep(wait.toMillis());
        }
    }

    private static void checkAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative: " + attempt);
        }
    }

    private static <T> String join(T[] values, Function<T, String> id) {
        return Arrays.stream(values).map(id).collect(Collectors.joining(","));
    }

    private static String describe(Duration wait) {
        long seconds = wait.getSeconds();
        if (seconds > 0 && seconds % 60 == 0) {
            long minutes = seconds / 60;
            return minutes == 1 ? "1 minute" : minutes + " minutes";
        }
        return seconds == 1 ? "1 second" : seconds + " seconds";
    }
}
