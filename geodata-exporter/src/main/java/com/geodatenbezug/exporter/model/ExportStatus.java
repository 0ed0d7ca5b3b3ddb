package com.geodatenbezug.exporter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Export job state reported by status.json.
 * Progresses queued → working → success | error.
 */
public enum ExportStatus {

    @JsonProperty("queued")
    QUEUED,

    @JsonProperty("working")
    WORKING,

    @JsonProperty("success")
    SUCCESS,

    @JsonProperty("error")
    ERROR;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR;
    }
}
