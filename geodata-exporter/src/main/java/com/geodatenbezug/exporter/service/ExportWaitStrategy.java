package com.geodatenbezug.exporter.service;

import java.time.Duration;

/**
 * Supplies the delay between two attempts of a retried export exchange.
 */
@FunctionalInterface
public interface ExportWaitStrategy {

    Duration getWaitDuration();
}
