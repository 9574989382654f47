package com.eafix.reentry.service.resolver;

import com.eafix.reentry.domain.resolver.ParameterSet;
import com.eafix.reentry.domain.resolver.ParameterSetFile;
import com.eafix.reentry.domain.resolver.ParameterSetLoadException;
import com.eafix.reentry.domain.resolver.Tier;
import com.eafix.reentry.domain.vocab.Dimension;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import com.eafix.reentry.domain.vocab.TokenPattern;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads, validates and writes {@code parameter_sets.json}.
 *
 * Validation is all-or-nothing: every problem in the file is collected and reported in
 * one {@link ParameterSetLoadException}.
 */
public final class ParameterSetLoader {
    private static final Logger log = LoggerFactory.getLogger(ParameterSetLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final String FILE_VERSION = "1.0";

    private final ReentryVocabulary vocabulary;
    private final List<Tier> hierarchy;

    public ParameterSetLoader(ReentryVocabulary vocabulary, List<Tier> hierarchy) {
        this.vocabulary = vocabulary;
        this.hierarchy = List.copyOf(hierarchy);
    }

    /**
     * Read and validate a parameter file.
     *
     * @throws ParameterSetLoadException if the file is unreadable or any entry is invalid
     */
    public List<ParameterSet> read(Path file) {
        ParameterSetFile content;
        try {
            content = MAPPER.readValue(Files.readString(file), ParameterSetFile.class);
        } catch (IOException e) {
            throw new ParameterSetLoadException(file.toString(), "unreadable: " + e.getMessage(), e);
        }
        List<ParameterSet> sets = content.parameterSets() != null ? content.parameterSets() : List.of();
        List<String> problems = validate(sets);
        if (!problems.isEmpty()) {
            throw new ParameterSetLoadException(file.toString(), problems);
        }
        log.debug("Read {} parameter sets from {}", sets.size(), file);
        return sets;
    }

    /**
     * Check every set. Returns all problems found; empty means valid.
     */
    public List<String> validate(List<ParameterSet> sets) {
        List<String> problems = new ArrayList<>();
        if (sets.isEmpty()) {
            problems.add("no parameter sets defined");
            return problems;
        }
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < sets.size(); i++) {
            ParameterSet set = sets.get(i);
            String label = "parameter_sets[" + i + "]";
            if (set == null) {
                problems.add(label + ": entry is null");
                continue;
            }
            if (set.id() == null || set.id().isBlank()) {
                problems.add(label + ": id is required");
            } else {
                label = label + " (" + set.id() + ")";
                if (!ids.add(set.id())) {
                    problems.add(label + ": duplicate id");
                }
            }
            if (set.name() == null || set.name().isBlank()) {
                problems.add(label + ": name is required");
            }
            if (set.tier() == null) {
                problems.add(label + ": tier is required");
            } else if (set.tier() == Tier.EMERGENCY) {
                problems.add(label + ": tier EMERGENCY is reserved for the fallback");
            } else if (!hierarchy.contains(set.tier())) {
                problems.add(label + ": tier " + set.tier() + " is not in the hierarchy " + hierarchy);
            }
            validatePredicates(set, label, problems);
            validateValues(set, label, problems);
        }
        return problems;
    }

    /**
     * Persist sets in the shared file format, pretty-printed.
     */
    public void write(Path file, List<ParameterSet> sets) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ParameterSetFile content = new ParameterSetFile(sets, Instant.now(), FILE_VERSION);
        Files.writeString(file, MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(content));
        log.info("✅ Parameter sets saved to: {}", file);
    }

    private void validatePredicates(ParameterSet set, String label, List<String> problems) {
        if (set.durationClass() != null && !vocabulary.isValidDuration(set.durationClass())) {
            problems.add(label + ": duration_class '" + set.durationClass() + "' not in "
                + vocabulary.legalTokens(Dimension.DURATION));
        }
        if (set.proximityState() != null && !vocabulary.isValidProximity(set.proximityState())) {
            problems.add(label + ": proximity_state '" + set.proximityState() + "' not in "
                + vocabulary.legalTokens(Dimension.PROXIMITY));
        }
        if (set.calendarPattern() != null && !TokenPattern.isValid(set.calendarPattern())) {
            problems.add(label + ": calendar_pattern '" + set.calendarPattern() + "' is not a valid pattern");
        }
        if (set.symbolPattern() != null && !TokenPattern.isValid(set.symbolPattern())) {
            problems.add(label + ": symbol_pattern '" + set.symbolPattern() + "' is not a valid pattern");
        }
    }

    private void validateValues(ParameterSet set, String label, List<String> problems) {
        if (!vocabulary.isValidGeneration(set.maxGeneration())) {
            ReentryVocabulary.GenerationRange range = vocabulary.generationRange();
            problems.add(label + ": max_generation " + set.maxGeneration()
                + " outside " + range.min() + ".." + range.max());
        }
        if (set.lotSizeMultiplier() <= 0) {
            problems.add(label + ": lot_size_multiplier must be > 0");
        }
        if (set.stopLossPips() <= 0) {
            problems.add(label + ": stop_loss_pips must be > 0");
        }
        if (set.takeProfitPips() <= 0) {
            problems.add(label + ": take_profit_pips must be > 0");
        }
        if (set.confidenceThreshold() < 0 || set.confidenceThreshold() > 1) {
            problems.add(label + ": confidence_threshold must be within [0, 1]");
        }
        if (set.minWaitMinutes() < 0) {
            problems.add(label + ": min_wait_minutes must be >= 0");
        }
        if (set.maxWaitMinutes() < set.minWaitMinutes()) {
            problems.add(label + ": max_wait_minutes must be >= min_wait_minutes");
        }
    }
}
