package com.eafix.reentry.service.codec;

import com.eafix.reentry.domain.common.ErrorCode;
import com.eafix.reentry.domain.common.ReentryException;
import com.eafix.reentry.domain.common.ValidationOutcome;
import com.eafix.reentry.domain.hybrid.ChainPosition;
import com.eafix.reentry.domain.hybrid.HybridId;
import com.eafix.reentry.domain.hybrid.InvalidComponentException;
import com.eafix.reentry.domain.hybrid.InvalidGenerationException;
import com.eafix.reentry.domain.hybrid.InvalidSuffixException;
import com.eafix.reentry.domain.hybrid.MalformedIdentifierException;
import com.eafix.reentry.domain.vocab.Dimension;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import com.eafix.reentry.infrastructure.metrics.ReentryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Composes, parses and validates hybrid IDs and derives their comment hash.
 *
 * Identifier layout:
 * <pre>
 *   OUTCOME_DURATION_PROXIMITY_CALENDAR_DIRECTION_GENERATION[_suffix]
 *   W1_QUICK_AT_EVENT_CAL8_USD_NFP_H_LONG_1
 * </pre>
 *
 * Proximity and calendar tokens contain the delimiter, so parsing is vocabulary-aware:
 * - Outcome, duration and proximity are matched against their legal tokens, longest first
 * - Generation is the last segment (scanning from the end) that is a canonical integer in range
 * - Direction precedes generation, calendar is everything in between
 * - At most one suffix segment may follow generation
 *
 * {@link #commentHash(String)} must stay byte-identical to the MQL4 implementation.
 * Stateless apart from the immutable vocabulary; thread-safe.
 */
public final class HybridIdCodec {
    private static final Logger log = LoggerFactory.getLogger(HybridIdCodec.class);

    private static final Pattern SUFFIX_PATTERN = Pattern.compile("^[a-z0-9]{6}$");
    private static final Pattern CANONICAL_INT = Pattern.compile("^(0|[1-9][0-9]{0,8})$");

    public static final int HASH_LENGTH = 6;
    public static final int COMMENT_MAX_LENGTH = 31;
    private static final int MIN_SEGMENTS = 6;

    private final ReentryVocabulary vocabulary;
    private final ReentryMetrics metrics;

    public HybridIdCodec(ReentryVocabulary vocabulary) {
        this(vocabulary, ReentryMetrics.noop());
    }

    public HybridIdCodec(ReentryVocabulary vocabulary, ReentryMetrics metrics) {
        this.vocabulary = vocabulary;
        this.metrics = metrics;
    }

    /**
     * Compose an identifier from its components.
     *
     * @param suffix Optional suffix, null for none
     * @throws InvalidComponentException if any component is not legal in the vocabulary
     * @throws InvalidSuffixException if the suffix is not 6 characters of [a-z0-9]
     */
    public HybridId compose(String outcome, String duration, String proximity, String calendar,
                            String direction, int generation, String suffix) {
        ValidationOutcome check = vocabulary.isValidContext(outcome, duration, proximity, calendar, direction, generation);
        if (!check.valid()) {
            throw reject(new InvalidComponentException(check.reasons()));
        }
        if (suffix != null && !SUFFIX_PATTERN.matcher(suffix).matches()) {
            throw reject(new InvalidSuffixException(suffix));
        }
        return new HybridId(outcome, duration, proximity, calendar, direction, generation, suffix);
    }

    public HybridId compose(String outcome, String duration, String proximity, String calendar,
                            String direction, int generation) {
        return compose(outcome, duration, proximity, calendar, direction, generation, null);
    }

    /**
     * Parse identifier text. Checks structure only; use {@link #validate(String)} to also
     * check vocabulary legality.
     *
     * @throws MalformedIdentifierException if the text cannot be segmented
     */
    public HybridId parse(String text) {
        if (text == null || text.isBlank()) {
            throw reject(new MalformedIdentifierException(String.valueOf(text), "empty identifier"));
        }
        String[] segments = text.split(HybridId.DELIMITER, -1);
        if (segments.length < MIN_SEGMENTS) {
            throw reject(new MalformedIdentifierException(text,
                "expected at least " + MIN_SEGMENTS + " segments, found " + segments.length));
        }
        if (Arrays.stream(segments).anyMatch(String::isEmpty)) {
            throw reject(new MalformedIdentifierException(text, "empty segment"));
        }

        int cursor = 0;
        int outcomeEnd = leadingTokenEnd(segments, cursor, Dimension.OUTCOME);
        String outcome = join(segments, cursor, outcomeEnd);
        cursor = outcomeEnd;
        int durationEnd = leadingTokenEnd(segments, cursor, Dimension.DURATION);
        String duration = join(segments, cursor, durationEnd);
        cursor = durationEnd;
        int proximityEnd = leadingTokenEnd(segments, cursor, Dimension.PROXIMITY);
        String proximity = join(segments, cursor, proximityEnd);
        cursor = proximityEnd;

        // Leave at least one segment for calendar and one for direction
        int generationIndex = -1;
        for (int i = segments.length - 1; i >= cursor + 2; i--) {
            if (isGenerationSegment(segments[i])) {
                generationIndex = i;
                break;
            }
        }
        if (generationIndex < 0) {
            throw reject(new MalformedIdentifierException(text, "no valid generation segment"));
        }

        int trailing = segments.length - generationIndex - 1;
        String suffix = null;
        if (trailing > 1) {
            throw reject(new MalformedIdentifierException(text, "unexpected segments after generation"));
        }
        if (trailing == 1) {
            suffix = segments[generationIndex + 1];
            if (!SUFFIX_PATTERN.matcher(suffix).matches()) {
                throw reject(new MalformedIdentifierException(text, "invalid suffix '" + suffix + "'"));
            }
        }

        int directionStart = trailingTokenStart(segments, cursor + 1, generationIndex, Dimension.DIRECTION);
        String direction = join(segments, directionStart, generationIndex);
        String calendar = join(segments, cursor, directionStart);
        int generation = Integer.parseInt(segments[generationIndex]);

        return new HybridId(outcome, duration, proximity, calendar, direction, generation, suffix);
    }

    /**
     * Parse and check vocabulary legality. Never throws.
     */
    public boolean validate(String text) {
        try {
            HybridId id = parse(text);
            ValidationOutcome check = vocabulary.isValidContext(id.outcome(), id.duration(), id.proximity(),
                id.calendar(), id.direction(), id.generation());
            if (!check.valid()) {
                log.debug("Hybrid ID {} failed vocabulary check: {}", text, check.describe());
                metrics.recordCodecRejection(ErrorCode.INVALID_COMPONENT.reason());
            }
            return check.valid();
        } catch (ReentryException e) {
            log.debug("Hybrid ID {} is malformed: {}", text, e.getMessage());
            return false;
        }
    }

    /**
     * Deterministic 6 character display hash.
     *
     * SHA-256 over the UTF-8 bytes of the identifier; keep [0-9a-z] characters of the hex
     * digest left to right until 6 are collected, re-hashing the hex digest itself when
     * exhausted.
     */
    public String commentHash(String identifier) {
        StringBuilder out = new StringBuilder(HASH_LENGTH);
        String digest = sha256Hex(identifier);
        while (true) {
            for (int i = 0; i < digest.length() && out.length() < HASH_LENGTH; i++) {
                char c = digest.charAt(i);
                if ((c >= '0' && c <= '9') || (c >= 'a' && c <= 'z')) {
                    out.append(c);
                }
            }
            if (out.length() == HASH_LENGTH) {
                return out.toString();
            }
            digest = sha256Hex(digest);
        }
    }

    public String commentHash(HybridId id) {
        return commentHash(id.value());
    }

    /**
     * Compare our hash with one produced elsewhere (e.g. by the EA).
     */
    public boolean verifySuffixParity(String identifier, String expectedSuffix) {
        return commentHash(identifier).equals(expectedSuffix);
    }

    /**
     * @throws InvalidGenerationException for generations outside 1..3
     */
    public ChainPosition chainPosition(int generation) {
        return ChainPosition.forGeneration(generation)
            .orElseThrow(() -> reject(new InvalidGenerationException(generation)));
    }

    /**
     * Abbreviated form for MT4 order comments (31 characters max).
     *
     * {@code OUTCOME_DUR4_PR_GEN_hash}, or {@code OUTCOME_GEN_hash} when that is still too long.
     * An identifier that does not parse is reduced to its comment hash.
     */
    public String commentForm(String identifier) {
        String hash = commentHash(identifier);
        HybridId id;
        try {
            id = parse(identifier);
        } catch (MalformedIdentifierException e) {
            log.debug("[Codec] Comment form falls back to hash for '{}': {}", identifier, e.getMessage());
            return hash;
        }
        String shortForm = String.join(HybridId.DELIMITER,
            id.outcome(),
            truncate(id.duration(), 4),
            truncate(id.proximity(), 2),
            Integer.toString(id.generation()),
            hash);
        if (shortForm.length() > COMMENT_MAX_LENGTH) {
            shortForm = String.join(HybridId.DELIMITER, id.outcome(), Integer.toString(id.generation()), hash);
        }
        return shortForm;
    }

    public ReentryVocabulary vocabulary() {
        return vocabulary;
    }

    private boolean isGenerationSegment(String segment) {
        return CANONICAL_INT.matcher(segment).matches()
            && vocabulary.isValidGeneration(Integer.parseInt(segment));
    }

    /**
     * End index (exclusive) of the longest legal token starting at {@code start};
     * a single segment when nothing matches.
     */
    private int leadingTokenEnd(String[] segments, int start, Dimension dimension) {
        for (String token : longestFirst(dimension)) {
            String[] parts = token.split(HybridId.DELIMITER, -1);
            if (start + parts.length <= segments.length
                && Arrays.equals(parts, Arrays.copyOfRange(segments, start, start + parts.length))) {
                return start + parts.length;
            }
        }
        return Math.min(start + 1, segments.length);
    }

    /**
     * Start index of the longest legal token ending at {@code end} (exclusive) that begins
     * no earlier than {@code floor}; {@code end - 1} when nothing matches.
     */
    private int trailingTokenStart(String[] segments, int floor, int end, Dimension dimension) {
        for (String token : longestFirst(dimension)) {
            String[] parts = token.split(HybridId.DELIMITER, -1);
            int start = end - parts.length;
            if (start >= floor && Arrays.equals(parts, Arrays.copyOfRange(segments, start, end))) {
                return start;
            }
        }
        return end - 1;
    }

    private List<String> longestFirst(Dimension dimension) {
        return vocabulary.legalTokens(dimension).stream()
            .sorted(Comparator.comparingInt((String t) -> t.split(HybridId.DELIMITER, -1).length).reversed()
                .thenComparing(Comparator.comparingInt(String::length).reversed()))
            .toList();
    }

    private ReentryException reject(ReentryException e) {
        metrics.recordCodecRejection(e.reason());
        return e;
    }

    private static String join(String[] segments, int from, int to) {
        return String.join(HybridId.DELIMITER, Arrays.copyOfRange(segments, from, to));
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
