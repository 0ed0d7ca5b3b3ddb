package com.geodatenbezug.exporter.config;

import com.geodatenbezug.exporter.model.BaseTopic;
import com.geodatenbezug.exporter.model.Canton;
import com.geodatenbezug.exporter.model.Topic;
import com.geodatenbezug.exporter.service.GeodiensteApiClient;
import com.geodatenbezug.exporter.service.TopicExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ExportController {

    private final GeodiensteApiClient apiClient;
    private final TopicExportService exportService;

    // ── Topic catalog ─────────────────────────────────────────────────────────

    @GetMapping("/topics")
    public ResponseEntity<List<Topic>> topics() {
        return ResponseEntity.ok(apiClient.requestTopicInfo());
    }

    // ── Export triggers ───────────────────────────────────────────────────────

    /**
     * Export one topic of one canton in the background.
     *
     * POST /exports/lwb_rebbaukataster/ZG
     */
    @PostMapping("/exports/{baseTopic}/{canton}")
    public ResponseEntity<Map<String, String>> triggerExport(@PathVariable String baseTopic,
                                                             @PathVariable String canton) {
        BaseTopic base;
        Canton cantonCode;
        try {
            base = BaseTopic.fromId(baseTopic);
            cantonCode = Canton.valueOf(canton.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown topic or canton: " + baseTopic + "/" + canton));
        }

        Optional<Topic> topic = apiClient.requestTopicInfo().stream()
                .filter(t -> t.getBaseTopic() == base && t.getCanton() == cantonCode)
                .findFirst();
        if (topic.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Topic " + base.getId() + " is not available for " + cantonCode));
        }

        log.info("Manual export triggered for {} ({})", topic.get().getTopicTitle(), cantonCode);
        new Thread(() -> exportService.exportTopic(topic.get()), "manual-export-" + base.getId() + "-" + cantonCode).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "topic", base.getId(), "canton", cantonCode.name()));
    }

    @GetMapping("/exports/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "geodata-exporter",
                "version", "1.0.0",
                "dataSource", "geodienste.ch",
                "baseTopics", List.of(BaseTopic.values())
        ));
    }
}
