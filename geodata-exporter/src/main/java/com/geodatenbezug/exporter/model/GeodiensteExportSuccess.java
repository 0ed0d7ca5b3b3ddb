package com.geodatenbezug.exporter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Body of a 2xx response from downloads/{baseTopic}/{token}/export.json.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeodiensteExportSuccess {

    private String info;
}
