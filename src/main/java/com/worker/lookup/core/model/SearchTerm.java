package com.worker.lookup.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A validated, normalized search query.
 *
 * <p>Normalization lower-cases, turns whitespace runs into single spaces, strips
 * every character outside {@code [a-z0-9@.\- ]} and trims. Email and phone
 * punctuation survives so those fields stay searchable.</p>
 *
 * @param raw        the input as typed, trimmed
 * @param normalized the normalized form used for cache keys, store lookups and ranking
 */
public record SearchTerm(String raw, String normalized) {

    public static final int DEFAULT_MIN_LENGTH = 3;
    public static final int DEFAULT_MAX_LENGTH = 100;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9@.\\- ]");
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d{3,}");
    private static final Pattern LETTERS_AND_SPACES = Pattern.compile("^[a-z ]+$");

    /**
     * Normalizes arbitrary text the same way search terms are normalized.
     * Applied to candidate texts before comparison. Returns "" for {@code null}.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String result = text.toLowerCase(Locale.ROOT);
        result = WHITESPACE.matcher(result).replaceAll(" ");
        result = DISALLOWED.matcher(result).replaceAll("");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.trim();
    }

    /**
     * Validates raw input with the default 3..100 bounds.
     */
    public static Validation validate(String raw) {
        return validate(raw, DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH);
    }

    /**
     * Validates raw input. Length bounds apply to the trimmed input; the
     * normalized form must also keep at least {@code minLength} characters.
     */
    public static Validation validate(String raw, int minLength, int maxLength) {
        if (raw == null) {
            return Validation.invalid("Search term must be a string");
        }
        String trimmed = raw.trim();
        if (trimmed.length() < minLength) {
            return Validation.invalid("Search term must be at least " + minLength + " characters");
        }
        if (trimmed.length() > maxLength) {
            return Validation.invalid("Search term must be less than " + maxLength + " characters");
        }
        String normalized = normalize(trimmed);
        if (normalized.length() < minLength) {
            return Validation.invalid("Search term must contain at least " + minLength + " searchable characters");
        }
        return Validation.valid(new SearchTerm(trimmed, normalized));
    }

    /**
     * Parses raw input with default bounds, returning empty when it is not searchable.
     */
    public static Optional<SearchTerm> parse(String raw) {
        return Optional.ofNullable(validate(raw).term());
    }

    /**
     * Strict variant of {@link #parse(String)}.
     *
     * @throws InvalidSearchTermException when the input is not searchable
     */
    public static SearchTerm of(String raw) {
        Validation validation = validate(raw);
        if (!validation.isValid()) {
            throw new InvalidSearchTermException(validation.error());
        }
        return validation.term();
    }

    /**
     * Hints shown under the search box describing what the term looks like.
     */
    public List<String> suggestions() {
        List<String> suggestions = new ArrayList<>();
        if (normalized.contains("@")) {
            suggestions.add("Search by email address");
        }
        if (DIGIT_RUN.matcher(normalized).find()) {
            suggestions.add("Search by phone number");
        }
        if (LETTERS_AND_SPACES.matcher(normalized).matches() && normalized.contains(" ")) {
            suggestions.add("Search by full name");
        }
        return suggestions;
    }

    /**
     * Outcome of validating raw input: either a term or an error message.
     */
    public record Validation(SearchTerm term, String error) {

        static Validation valid(SearchTerm term) {
            return new Validation(term, null);
        }

        static Validation invalid(String error) {
            return new Validation(null, error);
        }

        public boolean isValid() {
            return term != null;
        }
    }
}
