package com.eafix.reentry.service.decision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * SymbolActivityTracker - Per-symbol cooldown and daily re-entry attempt counts.
 *
 * Each symbol has its own lock; {@link #withSymbolLock} serializes everything done for
 * one symbol between reading and updating its state. Daily counts reset when the UTC
 * date changes.
 */
public final class SymbolActivityTracker {
    private static final Logger log = LoggerFactory.getLogger(SymbolActivityTracker.class);

    private final Clock clock;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, SymbolActivity> activity = new ConcurrentHashMap<>();

    public SymbolActivityTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Run {@code work} while holding the symbol's lock.
     */
    public <T> T withSymbolLock(String symbol, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(symbol, k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * True while less than {@code cooldown} has passed since the last decision for the symbol.
     */
    public boolean inCooldown(String symbol, Duration cooldown) {
        SymbolActivity current = activity.get(symbol);
        if (current == null || current.lastDecisionAt() == null) {
            return false;
        }
        return clock.instant().isBefore(current.lastDecisionAt().plus(cooldown));
    }

    /**
     * Re-entry attempts recorded today (UTC).
     */
    public int attemptsToday(String symbol) {
        SymbolActivity current = activity.get(symbol);
        if (current == null || !current.day().equals(today())) {
            return 0;
        }
        return current.attempts();
    }

    /**
     * Record an accepted decision: restarts the cooldown and, for a re-entry, counts an attempt.
     */
    public void recordDecision(String symbol, boolean reentry) {
        Instant now = clock.instant();
        LocalDate day = LocalDate.ofInstant(now, ZoneOffset.UTC);
        activity.compute(symbol, (k, previous) -> {
            int attempts = previous != null && previous.day().equals(day) ? previous.attempts() : 0;
            if (reentry) {
                attempts++;
            }
            return new SymbolActivity(now, day, attempts);
        });
        log.debug("Recorded decision for {}: reentry={} attemptsToday={}", symbol, reentry, attemptsToday(symbol));
    }

    public Optional<Instant> lastDecisionAt(String symbol) {
        SymbolActivity current = activity.get(symbol);
        return current == null ? Optional.empty() : Optional.ofNullable(current.lastDecisionAt());
    }

    public int trackedSymbols() {
        return activity.size();
    }

    /**
     * Clear history for a symbol.
     */
    public void clear(String symbol) {
        activity.remove(symbol);
        log.info("Cleared re-entry activity for {}", symbol);
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private record SymbolActivity(Instant lastDecisionAt, LocalDate day, int attempts) {}
}
