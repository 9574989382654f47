package com.eafix.reentry.service.decision;

import com.eafix.reentry.config.ReentrySettings.SizingSettings;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Re-entry lot size: current lots times the multiplier, rounded half-up to the
 * symbol's lot step and never below one step.
 */
public final class LotSizer {
    private final BigDecimal defaultStep;
    private final Map<String, BigDecimal> stepsBySymbol;

    public LotSizer(SizingSettings settings) {
        this.defaultStep = settings.defaultLotStep();
        this.stepsBySymbol = settings.lotSteps();
    }

    public BigDecimal size(String symbol, BigDecimal currentLots, double multiplier) {
        BigDecimal step = stepFor(symbol);
        BigDecimal raw = currentLots.multiply(BigDecimal.valueOf(multiplier));
        BigDecimal steps = raw.divide(step, 0, RoundingMode.HALF_UP);
        if (steps.signum() <= 0) {
            steps = BigDecimal.ONE;
        }
        return steps.multiply(step).setScale(step.scale(), RoundingMode.UNNECESSARY);
    }

    public BigDecimal stepFor(String symbol) {
        return stepsBySymbol.getOrDefault(symbol, defaultStep);
    }
}
