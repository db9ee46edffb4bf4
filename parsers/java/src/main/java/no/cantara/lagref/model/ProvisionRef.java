package no.cantara.lagref.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Canonical key of a provision inside a statute.
 *
 * <p>Chaptered statutes are keyed {@code "{chapter}:{section}"}, flat statutes by the section
 * alone. A section may carry a letter suffix ({@code "5 a"}) marking an inserted provision; the
 * suffix belongs to the section token.
 */
public sealed interface ProvisionRef permits ProvisionRef.Chaptered, ProvisionRef.Flat {

    String section();

    Optional<String> chapter();

    /** The {@code provision_ref} string used as lookup key. */
    String key();

    record Chaptered(String chapterNumber, String sectionToken) implements ProvisionRef {
        public Chaptered {
            Objects.requireNonNull(chapterNumber, "chapter");
            Objects.requireNonNull(sectionToken, "section");
        }

        @Override public String section() { return sectionToken; }
        @Override public Optional<String> chapter() { return Optional.of(chapterNumber); }
        @Override public String key() { return chapterNumber + ":" + sectionToken; }
        @Override public String toString() { return key(); }
    }

    record Flat(String sectionToken) implements ProvisionRef {
        public Flat {
            Objects.requireNonNull(sectionToken, "section");
        }

        @Override public String section() { return sectionToken; }
        @Override public Optional<String> chapter() { return Optional.empty(); }
        @Override public String key() { return sectionToken; }
        @Override public String toString() { return key(); }
    }

    static ProvisionRef of(String chapter, String section) {
        String normalized = normalizeSection(section);
        if (chapter == null || chapter.isBlank()) {
            return new Flat(normalized);
        }
        return new Chaptered(chapter.trim(), normalized);
    }

    /**
     * Parses a stored key such as {@code "3:5"}, {@code "5 a"} or {@code "2:10 b"}.
     */
    static ProvisionRef parse(String key) {
        Objects.requireNonNull(key, "provision ref");
        if (key.isBlank()) {
            throw new IllegalArgumentException("provision ref must not be blank");
        }
        int colon = key.indexOf(':');
        if (colon < 0) {
            return of(null, key);
        }
        return of(key.substring(0, colon), key.substring(colon + 1));
    }

    /** Collapses internal whitespace: {@code "5  a"} becomes {@code "5 a"}. */
    static String normalizeSection(String section) {
        Objects.requireNonNull(section, "section");
        return section.replaceAll("\\s+", " ").trim();
    }
}
