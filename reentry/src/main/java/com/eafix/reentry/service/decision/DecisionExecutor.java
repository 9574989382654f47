package com.eafix.reentry.service.decision;

import com.eafix.reentry.application.lifecycle.ComponentHealth;
import com.eafix.reentry.application.lifecycle.ManagedComponent;
import com.eafix.reentry.domain.decision.DecisionContext;
import com.eafix.reentry.domain.decision.DecisionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DecisionExecutor - Runs decisions on a fixed worker pool.
 *
 * Cancelling a returned future only stops the caller from waiting; a decision that has
 * started always runs to completion, including its ledger write. {@link #stop()} lets
 * queued and running decisions finish.
 */
public final class DecisionExecutor implements ManagedComponent {
    private static final Logger log = LoggerFactory.getLogger(DecisionExecutor.class);
    private static final String COMPONENT = "decision-executor";
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final DecisionProcessor processor;
    private final int threads;
    private ExecutorService pool;

    public DecisionExecutor(DecisionProcessor processor, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        this.processor = processor;
        this.threads = threads;
    }

    @Override
    public String componentName() {
        return COMPONENT;
    }

    @Override
    public void initialize() {
        if (pool != null && !pool.isShutdown()) {
            return;
        }
        AtomicInteger counter = new AtomicInteger();
        pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "reentry-decision-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void start() {
        log.info("[Executor] Started with {} worker threads", threads);
    }

    /**
     * Submit one decision.
     *
     * @return future completing with the response, or exceptionally with the processor's exception
     */
    public CompletableFuture<DecisionResponse> submit(DecisionContext context) {
        if (pool == null || pool.isShutdown()) {
            throw new IllegalStateException("Decision executor is not running");
        }
        return CompletableFuture.supplyAsync(() -> processor.process(context), pool);
    }

    @Override
    public void stop() {
        if (pool == null || pool.isShutdown()) {
            return;
        }
        log.info("Stopping DecisionExecutor...");
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                // Running decisions are not interrupted; they may be mid ledger write
                log.warn("[Executor] Decisions still running after {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
            log.info("DecisionExecutor stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ComponentHealth healthCheck() {
        if (pool == null || pool.isShutdown()) {
            return ComponentHealth.unhealthy(COMPONENT, "not running");
        }
        return ComponentHealth.healthy(COMPONENT, Map.of("threads", threads));
    }
}
