package com.geodatenbezug.exporter.service;

import com.geodatenbezug.exporter.config.GeodiensteProperties;
import com.geodatenbezug.exporter.exception.GeodiensteApiException;
import com.geodatenbezug.exporter.model.ExportStatus;
import com.geodatenbezug.exporter.model.GeodiensteStatusSuccess;
import com.geodatenbezug.exporter.model.ProcessingResult;
import com.geodatenbezug.exporter.model.Topic;
import com.geodatenbezug.exporter.output.ProcessingReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Runs the export cycle for a single topic: start the export, wait for it to
 * finish, download the archive and record the outcome.
 *
 * Failures of any step end up in a failed {@link ProcessingResult}; nothing is thrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TopicExportService {

    private final GeodiensteApiClient apiClient;
    private final ExportDownloader downloader;
    private final ProcessingReportWriter reportWriter;
    private final GeodiensteProperties properties;

    public ProcessingResult exportTopic(Topic topic) {
        ProcessingResult result = ProcessingResult.builder()
                .topicTitle(topic.getTopicTitle())
                .baseTopic(topic.getBaseTopic())
                .canton(topic.getCanton())
                .startedAt(LocalDateTime.now())
                .build();

        try {
            String token = resolveToken(topic);
            String downloadUrl = awaitDownloadUrl(topic, token);

            Path destination = Paths.get(properties.getDownload().getDataDir(),
                    topic.getBaseTopic().getId() + "_" + topic.getCanton());
            List<Path> files = downloader.download(downloadUrl, destination);

            log.info("Export of {} ({}) complete: {} files", topic.getTopicTitle(), topic.getCanton(), files.size());
            result.setCode(200);
            result.setInfo(downloadUrl);
            result.setDataPath(destination.toString());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Export of {} ({}) interrupted", topic.getTopicTitle(), topic.getCanton());
            result.setCode(500);
            result.setReason("Interrupted");
        } catch (GeodiensteApiException e) {
            log.error("Export of {} ({}) failed: {}", topic.getTopicTitle(), topic.getCanton(), e.getMessage());
            result.setCode(e.getStatusCode());
            result.setReason(e.getMessage());
        } catch (Exception e) {
            log.error("Export of {} ({}) failed: {}", topic.getTopicTitle(), topic.getCanton(), e.getMessage(), e);
            result.setCode(500);
            result.setReason(e.getMessage());
        } finally {
            result.setCompletedAt(LocalDateTime.now());
            reportWriter.write(result);
        }
        return result;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String resolveToken(Topic topic) {
        return properties.tokenFor(topic.getCanton().name())
                .orElseThrow(() -> new GeodiensteApiException(
                        "No access token configured for canton " + topic.getCanton(), 401));
    }

    private String awaitDownloadUrl(Topic topic, String token) throws InterruptedException {
        ResponseEntity<String> exportResponse = apiClient.startExport(topic, token);
        if (!exportResponse.getStatusCode().is2xxSuccessful()) {
            throw new GeodiensteApiException("Export could not be started: " + apiClient.readError(exportResponse),
                    exportResponse.getStatusCode().value());
        }
        log.info("Export of {} ({}) started: {}", topic.getTopicTitle(), topic.getCanton(),
                apiClient.readExportInfo(exportResponse));

        ResponseEntity<String> statusResponse = apiClient.checkExportStatus(topic, token);
        if (!statusResponse.getStatusCode().is2xxSuccessful()) {
            throw new GeodiensteApiException("Export status unavailable: " + apiClient.readError(statusResponse),
                    statusResponse.getStatusCode().value());
        }

        GeodiensteStatusSuccess status = apiClient.readStatus(statusResponse);
        if (status.getStatus() == ExportStatus.ERROR) {
            throw new GeodiensteApiException("Export failed: " + status.getInfo());
        }
        if (status.getStatus() != ExportStatus.SUCCESS) {
            throw new GeodiensteApiException("Export timed out, status is still "
                    + status.getStatus().name().toLowerCase(Locale.ROOT), 504);
        }
        return status.getDownloadUrl();
    }
}
