package com.filingsync.ingestion.config;

/**
 * Raised at startup when the ingestion settings cannot be used. No run is started.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
