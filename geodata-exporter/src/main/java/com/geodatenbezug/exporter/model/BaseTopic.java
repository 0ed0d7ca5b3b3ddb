package com.geodatenbezug.exporter.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Dataset families offered by geodienste.ch that this exporter knows about.
 * The JSON id doubles as the path segment of the download endpoints.
 */
@Getter
@RequiredArgsConstructor
public enum BaseTopic {

    @JsonProperty("lwb_perimeter_ln_sf")
    LWB_PERIMETER_LN_SF("lwb_perimeter_ln_sf", "Perimeter LN- und Sömmerungsflächen"),

    @JsonProperty("lwb_rebbaukataster")
    LWB_REBBAUKATASTER("lwb_rebbaukataster", "Rebbaukataster"),

    @JsonProperty("lwb_perimeter_terrassenreben")
    LWB_PERIMETER_TERRASSENREBEN("lwb_perimeter_terrassenreben", "Perimeter Terrassenreben"),

    @JsonProperty("lwb_biodiversitaetsfoerderflaechen")
    LWB_BIODIVERSITAETSFOERDERFLAECHEN("lwb_biodiversitaetsfoerderflaechen",
            "Biodiversitätsförderflächen, Qualität II und Vernetzung"),

    @JsonProperty("lwb_bewirtschaftungseinheit")
    LWB_BEWIRTSCHAFTUNGSEINHEIT("lwb_bewirtschaftungseinheit", "Bewirtschaftungseinheit"),

    @JsonProperty("lwb_nutzungsflaechen")
    LWB_NUTZUNGSFLAECHEN("lwb_nutzungsflaechen", "Nutzungsflächen");

    private static final String TOPIC_VERSION_SUFFIX = "_v2_0";

    private final String id;
    private final String title;

    /** Versioned topic name, e.g. lwb_rebbaukataster_v2_0 */
    public String getTopicName() {
        return id + TOPIC_VERSION_SUFFIX;
    }

    public static BaseTopic fromId(String id) {
        return Arrays.stream(values())
                .filter(b -> b.id.equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown base topic: " + id));
    }

    @Override
    public String toString() {
        return id;
    }
}
