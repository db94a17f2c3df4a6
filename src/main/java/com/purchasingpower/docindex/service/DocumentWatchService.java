package com.purchasingpower.docindex.service;

/**
 * Keeps the index in sync with files created or modified under the document root.
 */
public interface DocumentWatchService {

    /**
     * Subscribes to the document tree and handles events on a background thread.
     * Returns immediately.
     */
    void start();

    /**
     * Stops accepting events, waits for the file in progress, then releases the subscription.
     */
    void stop();

    boolean isRunning();
}
