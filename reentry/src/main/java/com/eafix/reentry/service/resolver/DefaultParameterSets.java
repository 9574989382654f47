package com.eafix.reentry.service.resolver;

import com.eafix.reentry.domain.decision.OutcomeClass;
import com.eafix.reentry.domain.resolver.ParameterSet;
import com.eafix.reentry.domain.resolver.Tier;

import java.util.List;

/**
 * Parameter sets installed when no parameter file exists.
 */
public final class DefaultParameterSets {

    private DefaultParameterSets() {}

    public static List<ParameterSet> builtIn() {
        return List.of(
            ParameterSet.builder("global_default", Tier.GLOBAL)
                .name("Global Default Parameters")
                .reentryEnabled(true)
                .maxGeneration(3)
                .lotSizeMultiplier(1.0)
                .stopLossPips(20.0)
                .takeProfitPips(40.0)
                .confidenceThreshold(0.6)
                .build(),

            // High-impact calendar events
            ParameterSet.builder("cal8_high_impact", Tier.TIER1)
                .name("CAL8 High Impact Events")
                .calendarPattern("CAL8_*")
                .lotSizeMultiplier(0.8)
                .stopLossPips(15.0)
                .takeProfitPips(30.0)
                .confidenceThreshold(0.7)
                .build(),

            ParameterSet.builder("win_outcomes", Tier.TIER2)
                .name("Win Outcome Re-entries")
                .outcomeClass(OutcomeClass.WIN)
                .lotSizeMultiplier(1.2)
                .stopLossPips(25.0)
                .takeProfitPips(50.0)
                .confidenceThreshold(0.5)
                .build(),

            ParameterSet.builder("loss_outcomes", Tier.TIER2)
                .name("Loss Outcome Re-entries")
                .outcomeClass(OutcomeClass.LOSS)
                .lotSizeMultiplier(0.7)
                .stopLossPips(15.0)
                .takeProfitPips(30.0)
                .confidenceThreshold(0.8)
                .build(),

            ParameterSet.builder("flash_no_reentry", Tier.TIER3)
                .name("Flash Duration - No Re-entry")
                .durationClass("FLASH")
                .reentryEnabled(false)
                .confidenceThreshold(1.0)
                .build()
        );
    }
}
