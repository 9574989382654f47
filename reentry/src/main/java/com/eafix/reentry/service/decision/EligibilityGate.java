package com.eafix.reentry.service.decision;

import com.eafix.reentry.config.ReentrySettings.EligibilitySettings;
import com.eafix.reentry.domain.decision.DecisionContext;
import com.eafix.reentry.domain.decision.SkipReason;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether a structurally valid context is processed at all.
 *
 * Checks run in a fixed order and the first failing one names the skip reason.
 * Callers hold the symbol's lock so the tracker state cannot change underneath.
 */
public final class EligibilityGate {
    private final EligibilitySettings settings;
    private final SymbolActivityTracker tracker;

    public EligibilityGate(EligibilitySettings settings, SymbolActivityTracker tracker) {
        this.settings = settings;
        this.tracker = tracker;
    }

    public Optional<SkipReason> check(DecisionContext context) {
        if (settings.onlyCompletedTrades() && !context.isClosed()) {
            return Optional.of(SkipReason.TRADE_NOT_COMPLETED);
        }
        if (context.durationMinutes() < settings.minTradeDurationMinutes()) {
            return Optional.of(SkipReason.DURATION_TOO_SHORT);
        }
        if (settings.excludeManualCloses() && context.isManualClose()) {
            return Optional.of(SkipReason.MANUAL_CLOSE_EXCLUDED);
        }
        if (tracker.inCooldown(context.symbol(), Duration.ofMinutes(settings.cooldownMinutes()))) {
            return Optional.of(SkipReason.COOLDOWN_PERIOD_ACTIVE);
        }
        if (tracker.attemptsToday(context.symbol()) >= settings.maxAttemptsPerDay()) {
            return Optional.of(SkipReason.DAILY_LIMIT_EXCEEDED);
        }
        return Optional.empty();
    }
}
