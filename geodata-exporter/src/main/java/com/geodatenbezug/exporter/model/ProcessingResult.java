package com.geodatenbezug.exporter.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Outcome of exporting and downloading one topic.
 * Written to the daily processing report.
 */
@Data
@Builder
public class ProcessingResult {

    private String topicTitle;
    private BaseTopic baseTopic;
    private Canton canton;
    private int code;               // 200 on success, service status or 500 otherwise
    private String reason;          // null on success
    private String info;
    private String dataPath;        // directory the export was extracted into
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public boolean isSuccess() {
        return code >= 200 && code < 300;
    }
}
