package com.geodatenbezug.exporter.exception;

/**
 * Thrown when a geodienste.ch exchange cannot be completed, e.g. an unreadable
 * status payload or an export that did not end in success.
 */
public class GeodiensteApiException extends RuntimeException {

    private final int statusCode;

    public GeodiensteApiException(String message) {
        this(message, 500);
    }

    public GeodiensteApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GeodiensteApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 500;
    }

    /** HTTP status to report for the failed topic */
    public int getStatusCode() {
        return statusCode;
    }
}
