package com.eafix.reentry.service.decision;

import com.eafix.reentry.config.ReentrySettings.ClassificationSettings;
import com.eafix.reentry.domain.decision.DurationClass;
import com.eafix.reentry.domain.decision.OutcomeClass;

/**
 * Maps realized pips and trade duration onto outcome and duration classes.
 */
public final class TradeClassifier {
    private final ClassificationSettings settings;

    public TradeClassifier(ClassificationSettings settings) {
        this.settings = settings;
    }

    /**
     * WIN at or above the profit threshold, LOSS at or below the loss threshold, else BREAKEVEN.
     */
    public OutcomeClass classifyOutcome(double profitLossPips) {
        if (profitLossPips >= settings.profitThresholdPips()) {
            return OutcomeClass.WIN;
        }
        if (profitLossPips <= settings.lossThresholdPips()) {
            return OutcomeClass.LOSS;
        }
        return OutcomeClass.BREAKEVEN;
    }

    /**
     * Upper bounds are inclusive: exactly 5 minutes is FLASH.
     */
    public DurationClass classifyDuration(double durationMinutes) {
        if (durationMinutes <= settings.flashMaxMinutes()) {
            return DurationClass.FLASH;
        }
        if (durationMinutes <= settings.quickMaxMinutes()) {
            return DurationClass.QUICK;
        }
        if (durationMinutes <= settings.longMaxMinutes()) {
            return DurationClass.LONG;
        }
        return DurationClass.EXTENDED;
    }
}
