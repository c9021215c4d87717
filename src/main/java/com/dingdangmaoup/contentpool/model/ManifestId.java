package com.dingdangmaoup.contentpool.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Validated identifier of a manifest within the pool.
 * Equality is case-insensitive; {@link #value()} keeps the original spelling.
 */
public final class ManifestId implements Comparable<ManifestId> {

    private static final String ILLEGAL_CHARACTERS = "<>:\"/\\|?*";

    private final String value;
    private final String normalized;

    private ManifestId(String value) {
        this.value = value;
        this.normalized = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Create an id from a raw string
     *
     * @throws IllegalArgumentException if the value is empty, contains ".." or an illegal path character
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ManifestId of(String value) {
        String problem = findProblem(value);
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        return new ManifestId(value.trim());
    }

    public static Optional<ManifestId> tryParse(String value) {
        return findProblem(value) == null ? Optional.of(new ManifestId(value.trim())) : Optional.empty();
    }

    /**
     * Describe why a raw string is not a usable id, or null if it is
     */
    public static String findProblem(String value) {
        if (value == null || value.isBlank()) {
            return "Manifest ID cannot be null or empty";
        }
        if (value.contains("..")) {
            return "Manifest ID contains illegal path traversal: " + value;
        }
        if (value.trim().chars().allMatch(c -> c == '.')) {
            return "Manifest ID cannot consist only of dots: " + value;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isISOControl(c) || ILLEGAL_CHARACTERS.indexOf(c) >= 0) {
                return "Manifest ID contains illegal character '" + c + "': " + value;
            }
        }
        return null;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Lowercase form, used for storage file names
     */
    public String normalized() {
        return normalized;
    }

    public boolean contains(String term) {
        return normalized.contains(term.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ManifestId other)) return false;
        return normalized.equals(other.normalized);
    }

    @Override
    public int hashCode() {
        return normalized.hashCode();
    }

    @Override
    public int compareTo(ManifestId other) {
        return normalized.compareTo(other.normalized);
    }

    @Override
    public String toString() {
        return value;
    }
}
