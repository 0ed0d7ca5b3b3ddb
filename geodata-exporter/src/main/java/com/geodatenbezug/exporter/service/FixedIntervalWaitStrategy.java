package com.geodatenbezug.exporter.service;

import com.geodatenbezug.exporter.config.GeodiensteProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Flat retry interval taken from geodienste.export.retry-interval (one minute by default).
 */
@Component
@RequiredArgsConstructor
public class FixedIntervalWaitStrategy implements ExportWaitStrategy {

    private final GeodiensteProperties properties;

    @Override
    public Duration getWaitDuration() {
        return properties.getExport().getRetryInterval();
    }
}
