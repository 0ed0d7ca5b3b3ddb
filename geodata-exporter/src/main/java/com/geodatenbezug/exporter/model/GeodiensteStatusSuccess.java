package com.geodatenbezug.exporter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Body of a 2xx response from downloads/{baseTopic}/{token}/status.json.
 *
 * downloadUrl and exportedAt are set if and only if the status is SUCCESS;
 * payloads breaking that rule are rejected.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeodiensteStatusSuccess {

    ExportStatus status;

    String info;

    @JsonProperty("download_url")
    String downloadUrl;

    @JsonProperty("exported_at")
    LocalDateTime exportedAt;

    @Builder
    @JsonCreator
    public GeodiensteStatusSuccess(@JsonProperty("status") ExportStatus status,
                                   @JsonProperty("info") String info,
                                   @JsonProperty("download_url") String downloadUrl,
                                   @JsonProperty("exported_at") LocalDateTime exportedAt) {
        Objects.requireNonNull(status, "status");
        boolean success = status == ExportStatus.SUCCESS;
        if (success != (downloadUrl != null) || success != (exportedAt != null)) {
            throw new IllegalArgumentException(
                    "download_url and exported_at must be present exactly when status is success, got status " + status);
        }
        this.status = status;
        this.info = info;
        this.downloadUrl = downloadUrl;
        this.exportedAt = exportedAt;
    }
}
