package com.eafix.reentry.domain.vocab;

import com.eafix.reentry.domain.common.InvalidConfigurationException;
import com.eafix.reentry.domain.common.ValidationOutcome;
import com.eafix.reentry.domain.hybrid.HybridId;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Registry of legal tokens for every decision dimension.
 *
 * Built once at startup from {@link VocabularyDefinition} and immutable afterwards,
 * so it can be shared freely between threads.
 */
public final class ReentryVocabulary {
    private static final Logger log = LoggerFactory.getLogger(ReentryVocabulary.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String CALENDAR_NONE = "NONE";

    /**
     * Inclusive generation bounds.
     */
    public record GenerationRange(int min, int max) {
        public boolean contains(int generation) {
            return generation >= min && generation <= max;
        }
    }

    private final VocabularyDefinition definition;
    private final Map<Dimension, Set<String>> tokens;
    private final Map<String, Integer> outcomeRanks;
    private final Map<String, Integer> durationLimits;
    private final List<String> calendarPatterns;
    private final int calendarMinLength;
    private final GenerationRange generationRange;

    public ReentryVocabulary(VocabularyDefinition definition) {
        List<String> problems = checkDefinition(definition);
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException("Invalid vocabulary definition", problems);
        }
        this.definition = definition;
        this.generationRange = new GenerationRange(
            definition.generationRange().min(), definition.generationRange().max());
        this.calendarPatterns = List.copyOf(definition.calendarPatterns());
        this.calendarMinLength = definition.calendarMinLength() != null ? definition.calendarMinLength() : 0;

        Map<String, Integer> ranks = new LinkedHashMap<>();
        definition.outcomeBuckets().forEach(b -> ranks.put(b.token(), b.rank()));
        this.outcomeRanks = Collections.unmodifiableMap(ranks);

        Map<String, Integer> limits = new LinkedHashMap<>();
        definition.durationBuckets().forEach(b -> limits.put(b.token(), b.maxMinutes()));
        this.durationLimits = Collections.unmodifiableMap(limits);

        Map<Dimension, Set<String>> byDimension = new EnumMap<>(Dimension.class);
        byDimension.put(Dimension.OUTCOME, ordered(ranks.keySet()));
        byDimension.put(Dimension.DURATION, ordered(limits.keySet()));
        byDimension.put(Dimension.PROXIMITY, ordered(
            definition.proximityBuckets().stream().map(VocabularyDefinition.ProximityBucket::token).toList()));
        List<String> calendar = new ArrayList<>();
        calendar.add(CALENDAR_NONE);
        calendar.addAll(calendarPatterns);
        byDimension.put(Dimension.CALENDAR, ordered(calendar));
        byDimension.put(Dimension.DIRECTION, ordered(definition.directionEnum()));
        List<String> generations = new ArrayList<>();
        for (int g = generationRange.min(); g <= generationRange.max(); g++) {
            generations.add(Integer.toString(g));
        }
        byDimension.put(Dimension.GENERATION, ordered(generations));
        this.tokens = Collections.unmodifiableMap(byDimension);
    }

    public static ReentryVocabulary defaults() {
        return new ReentryVocabulary(VocabularyDefinition.defaults());
    }

    /**
     * Load an override file, falling back to the built-in vocabulary when the file is
     * absent, unreadable or invalid.
     *
     * @param file Vocabulary file, may be null
     * @return Vocabulary, never null
     */
    public static ReentryVocabulary load(Path file) {
        if (file == null) {
            log.info("No vocabulary file configured, using built-in vocabulary");
            return defaults();
        }
        if (!Files.isRegularFile(file)) {
            log.warn("Vocabulary file {} not found, using built-in vocabulary", file);
            return defaults();
        }
        try {
            VocabularyDefinition definition = MAPPER.readValue(file.toFile(), VocabularyDefinition.class);
            ReentryVocabulary vocabulary = new ReentryVocabulary(definition);
            log.info("✅ Loaded vocabulary from {}", file);
            return vocabulary;
        } catch (IOException | InvalidConfigurationException e) {
            log.warn("Vocabulary file {} unusable, using built-in vocabulary: {}", file, e.getMessage());
            return defaults();
        }
    }

    public Set<String> legalTokens(Dimension dimension) {
        return tokens.get(dimension);
    }

    public GenerationRange generationRange() {
        return generationRange;
    }

    public boolean isValidOutcome(String token) {
        return token != null && outcomeRanks.containsKey(token);
    }

    public boolean isValidDuration(String token) {
        return token != null && durationLimits.containsKey(token);
    }

    public boolean isValidProximity(String token) {
        return token != null && tokens.get(Dimension.PROXIMITY).contains(token);
    }

    public boolean isValidDirection(String token) {
        return token != null && tokens.get(Dimension.DIRECTION).contains(token);
    }

    public boolean isValidGeneration(int generation) {
        return generationRange.contains(generation);
    }

    /**
     * A calendar id is legal if it is {@code NONE}, or it matches one of the calendar
     * patterns and is at least the minimum length.
     */
    public boolean isValidCalendar(String calendarId) {
        if (calendarId == null || calendarId.isBlank()) {
            return false;
        }
        if (CALENDAR_NONE.equals(calendarId)) {
            return true;
        }
        if (calendarId.length() < calendarMinLength || calendarId.chars().anyMatch(Character::isWhitespace)) {
            return false;
        }
        // an empty segment would not survive a parse of the composed identifier
        if (calendarId.startsWith(HybridId.DELIMITER) || calendarId.endsWith(HybridId.DELIMITER)
            || calendarId.contains(HybridId.DELIMITER + HybridId.DELIMITER)) {
            return false;
        }
        for (String pattern : calendarPatterns) {
            if (TokenPattern.matches(calendarId, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check all six dimensions. Never throws; one reason per bad dimension.
     */
    public ValidationOutcome isValidContext(String outcome, String duration, String proximity,
                                            String calendar, String direction, int generation) {
        return new ValidationOutcome.Builder()
            .check(isValidOutcome(outcome), invalid("outcome", outcome, Dimension.OUTCOME))
            .check(isValidDuration(duration), invalid("duration", duration, Dimension.DURATION))
            .check(isValidProximity(proximity), invalid("proximity", proximity, Dimension.PROXIMITY))
            .check(isValidCalendar(calendar), "Invalid calendar '" + calendar + "': expected "
                + CALENDAR_NONE + " or a token matching " + calendarPatterns
                + " of at least " + calendarMinLength + " characters without empty segments")
            .check(isValidDirection(direction), invalid("direction", direction, Dimension.DIRECTION))
            .check(isValidGeneration(generation), "Invalid generation " + generation + ": expected "
                + generationRange.min() + ".." + generationRange.max())
            .build();
    }

    /**
     * @return the generation after {@code current}, or empty if {@code current} is the last one
     */
    public Optional<Integer> nextGeneration(int current) {
        int next = current + 1;
        return generationRange.contains(current) && generationRange.contains(next)
            ? Optional.of(next)
            : Optional.empty();
    }

    public OptionalInt outcomeRank(String token) {
        Integer rank = outcomeRanks.get(token);
        return rank != null ? OptionalInt.of(rank) : OptionalInt.empty();
    }

    /**
     * Upper bound of a duration bucket in minutes; empty for unbounded or unknown buckets.
     */
    public OptionalInt durationMaxMinutes(String token) {
        Integer limit = durationLimits.get(token);
        return limit != null ? OptionalInt.of(limit) : OptionalInt.empty();
    }

    public VocabularyDefinition definition() {
        return definition;
    }

    /**
     * Markdown overview for operators.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("# Re-entry Vocabulary\n\n");
        sb.append("## Duration\n\n| Token | Max minutes | Description |\n|---|---|---|\n");
        for (VocabularyDefinition.DurationBucket b : definition.durationBuckets()) {
            sb.append("| ").append(b.token()).append(" | ")
                .append(b.maxMinutes() != null ? b.maxMinutes() : "unbounded").append(" | ")
                .append(nullToEmpty(b.desc())).append(" |\n");
        }
        sb.append("\n## Proximity\n\n| Token | Window (minutes) | Description |\n|---|---|---|\n");
        for (VocabularyDefinition.ProximityBucket b : definition.proximityBuckets()) {
            sb.append("| ").append(b.token()).append(" | ")
                .append(b.windowMinutes() != null ? b.windowMinutes() : "-").append(" | ")
                .append(nullToEmpty(b.desc())).append(" |\n");
        }
        sb.append("\n## Outcome\n\n| Token | Rank | Description |\n|---|---|---|\n");
        for (VocabularyDefinition.OutcomeBucket b : definition.outcomeBuckets()) {
            sb.append("| ").append(b.token()).append(" | ").append(b.rank()).append(" | ")
                .append(nullToEmpty(b.desc())).append(" |\n");
        }
        sb.append("\n## Other\n\n");
        sb.append("- Calendar: ").append(tokens.get(Dimension.CALENDAR)).append('\n');
        sb.append("- Direction: ").append(tokens.get(Dimension.DIRECTION)).append('\n');
        sb.append("- Generation: ").append(generationRange.min()).append("..").append(generationRange.max()).append('\n');
        return sb.toString();
    }

    private String invalid(String name, String value, Dimension dimension) {
        return "Invalid " + name + " '" + value + "': expected one of " + tokens.get(dimension);
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private static Set<String> ordered(Collection<String> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private static List<String> checkDefinition(VocabularyDefinition d) {
        List<String> problems = new ArrayList<>();
        if (d == null) {
            problems.add("vocabulary definition is missing");
            return problems;
        }
        if (d.outcomeBuckets() == null || d.outcomeBuckets().isEmpty()) {
            problems.add("outcome_buckets must not be empty");
        }
        if (d.durationBuckets() == null || d.durationBuckets().isEmpty()) {
            problems.add("duration_buckets must not be empty");
        }
        if (d.proximityBuckets() == null || d.proximityBuckets().isEmpty()) {
            problems.add("proximity_buckets must not be empty");
        }
        if (d.directionEnum() == null || d.directionEnum().isEmpty()) {
            problems.add("direction_enum must not be empty");
        }
        if (d.generationRange() == null) {
            problems.add("generation_range is required");
        } else if (d.generationRange().min() < 1 || d.generationRange().max() < d.generationRange().min()) {
            problems.add("generation_range must satisfy 1 <= min <= max");
        }
        if (d.calendarPatterns() == null) {
            problems.add("calendar_patterns is required");
        } else {
            for (String pattern : d.calendarPatterns()) {
                if (!TokenPattern.isValid(pattern)) {
                    problems.add("calendar pattern '" + pattern + "' is not a valid wildcard pattern");
                }
            }
        }
        return problems;
    }
}
