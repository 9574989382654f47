package com.eafix.reentry.domain.hybrid;

import java.util.Optional;

/**
 * Human-readable label for a generation.
 */
public enum ChainPosition {
    O(1),
    R1(2),
    R2(3);

    private final int generation;

    ChainPosition(int generation) {
        this.generation = generation;
    }

    public int generation() {
        return generation;
    }

    public static Optional<ChainPosition> forGeneration(int generation) {
        for (ChainPosition position : values()) {
            if (position.generation == generation) {
                return Optional.of(position);
            }
        }
        return Optional.empty();
    }
}
