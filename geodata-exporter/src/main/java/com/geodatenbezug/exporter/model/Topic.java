package com.geodatenbezug.exporter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One exportable geodata product for one canton, as listed by /info/services.json.
 * Identified by (baseTopic, canton).
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Topic {

    @JsonProperty("base_topic")
    BaseTopic baseTopic;

    /** Versioned dataset identifier, e.g. lwb_rebbaukataster_v2_0 */
    @JsonProperty("topic")
    String topicName;

    @JsonProperty("topic_title")
    String topicTitle;

    Canton canton;

    /** Null when geodienste.ch has no update timestamp for this canton */
    @JsonProperty("updated_at")
    Instant updatedAt;
}
