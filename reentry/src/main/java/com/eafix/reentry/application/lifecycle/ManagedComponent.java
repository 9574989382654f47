package com.eafix.reentry.application.lifecycle;

/**
 * Lifecycle capability for components owned by the re-entry context.
 *
 * The owner calls {@link #initialize()} then {@link #start()} in dependency order and
 * {@link #stop()} in reverse. {@link #healthCheck()} may be called at any time and
 * must not throw.
 */
public interface ManagedComponent {

    /**
     * Short stable name for logs and health reports.
     */
    String componentName();

    /**
     * Load configuration and data. Fails fast on invalid input.
     */
    void initialize();

    /**
     * Begin accepting work.
     */
    void start();

    /**
     * Stop accepting work and release resources. Idempotent.
     */
    void stop();

    ComponentHealth healthCheck();
}
