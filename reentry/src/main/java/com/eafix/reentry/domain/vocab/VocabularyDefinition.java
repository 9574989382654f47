package com.eafix.reentry.domain.vocab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk shape of {@code reentry_vocab.json}.
 *
 * The file is shared with the MQL4 side, so keys stay snake_case and unknown keys
 * are ignored rather than rejected.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VocabularyDefinition(
    @JsonProperty("duration_buckets")
    List<DurationBucket> durationBuckets,

    @JsonProperty("proximity_buckets")
    List<ProximityBucket> proximityBuckets,

    @JsonProperty("outcome_buckets")
    List<OutcomeBucket> outcomeBuckets,

    @JsonProperty("direction_enum")
    List<String> directionEnum,

    @JsonProperty("generation_range")
    IntRange generationRange,

    @JsonProperty("strength_range")
    DecimalRange strengthRange,

    @JsonProperty("calendar_patterns")
    List<String> calendarPatterns,

    @JsonProperty("calendar_min_length")
    Integer calendarMinLength
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DurationBucket(
        @JsonProperty("token") String token,
        @JsonProperty("max_minutes") Integer maxMinutes,   // null = unbounded
        @JsonProperty("iso_limit") String isoLimit,
        @JsonProperty("desc") String desc
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProximityBucket(
        @JsonProperty("token") String token,
        @JsonProperty("window_minutes") List<Integer> windowMinutes,
        @JsonProperty("desc") String desc
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutcomeBucket(
        @JsonProperty("token") String token,
        @JsonProperty("rank") int rank,
        @JsonProperty("desc") String desc
    ) {}

    public record IntRange(
        @JsonProperty("min") int min,
        @JsonProperty("max") int max
    ) {}

    public record DecimalRange(
        @JsonProperty("min") double min,
        @JsonProperty("max") double max
    ) {}

    /**
     * Built-in vocabulary, used when no override file is configured or it cannot be read.
     */
    public static VocabularyDefinition defaults() {
        return new VocabularyDefinition(
            List.of(
                new DurationBucket("FLASH", 5, "PT5M", "Very short burst; <= 5 minutes"),
                new DurationBucket("QUICK", 30, "PT30M", "Short move; <= 30 minutes"),
                new DurationBucket("LONG", 240, "PT4H", "Sustained move; <= 4 hours"),
                new DurationBucket("EXTENDED", null, null, "Prolonged; > 4 hours")
            ),
            List.of(
                new ProximityBucket("PRE_1H", List.of(-60, 0), "Pre-event window"),
                new ProximityBucket("AT_EVENT", List.of(0, 5), "At event window"),
                new ProximityBucket("POST_30M", List.of(1, 30), "Post-event window")
            ),
            List.of(
                new OutcomeBucket("W2", 2, "Strong win"),
                new OutcomeBucket("W1", 1, "Win"),
                new OutcomeBucket("BE", 0, "Break-even"),
                new OutcomeBucket("L1", -1, "Loss"),
                new OutcomeBucket("L2", -2, "Strong loss")
            ),
            List.of("LONG", "SHORT", "ANY"),
            new IntRange(1, 3),
            new DecimalRange(0.0, 1.0),
            List.of("CAL8_*", "CAL5_*"),
            8
        );
    }
}
