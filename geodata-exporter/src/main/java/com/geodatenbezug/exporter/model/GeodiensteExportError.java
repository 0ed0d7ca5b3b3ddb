package com.geodatenbezug.exporter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Error body returned by the download endpoints, e.g. the pending-export conflict.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeodiensteExportError {

    private String error;
}
