package com.purchasingpower.docindex.exception;

/**
 * The target index could not be verified or created. Indexing cannot proceed.
 */
public class IndexConfigurationException extends RuntimeException {

    public IndexConfigurationException(String message) {
        super(message);
    }

    public IndexConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
