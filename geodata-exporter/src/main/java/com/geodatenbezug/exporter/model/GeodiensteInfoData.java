package com.geodatenbezug.exporter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Response body of /info/services.json.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeodiensteInfoData {

    private List<Topic> services = new ArrayList<>();
}
