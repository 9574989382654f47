package com.eafix.reentry.domain.resolver;

import java.util.List;

/**
 * Parameter set priority buckets. Earlier tiers always outrank later ones.
 *
 * EMERGENCY is never loaded from configuration; it only labels the fallback result.
 */
public enum Tier {
    EXACT,
    TIER1,
    TIER2,
    TIER3,
    GLOBAL,
    EMERGENCY;

    public static List<Tier> defaultHierarchy() {
        return List.of(EXACT, TIER1, TIER2, TIER3, GLOBAL);
    }
}
