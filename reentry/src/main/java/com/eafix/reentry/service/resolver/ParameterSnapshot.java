package com.eafix.reentry.service.resolver;

import com.eafix.reentry.domain.resolver.ParameterSet;
import com.eafix.reentry.domain.resolver.Tier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of the loaded parameter sets, grouped by tier and sorted by id
 * within each tier. Replaced wholesale on reload.
 */
final class ParameterSnapshot {
    static final ParameterSnapshot EMPTY = new ParameterSnapshot(List.of(), null, "none");

    private final List<ParameterSet> all;
    private final Map<Tier, List<ParameterSet>> byTier;
    private final Instant loadedAt;
    private final String source;

    ParameterSnapshot(List<ParameterSet> sets, Instant loadedAt, String source) {
        this.all = List.copyOf(sets);
        this.loadedAt = loadedAt;
        this.source = source;

        Map<Tier, List<ParameterSet>> grouped = new EnumMap<>(Tier.class);
        for (ParameterSet set : sets) {
            grouped.computeIfAbsent(set.tier(), t -> new ArrayList<>()).add(set);
        }
        grouped.replaceAll((tier, list) -> {
            list.sort(Comparator.comparing(ParameterSet::id));
            return List.copyOf(list);
        });
        this.byTier = Collections.unmodifiableMap(grouped);
    }

    List<ParameterSet> all() {
        return all;
    }

    List<ParameterSet> forTier(Tier tier) {
        return byTier.getOrDefault(tier, List.of());
    }

    Instant loadedAt() {
        return loadedAt;
    }

    String source() {
        return source;
    }
}
