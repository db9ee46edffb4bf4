package no.cantara.lagref.eu;

import java.util.Locale;

/**
 * Community designation of an EU act, as written in the citation: {@code (EU)}, {@code (EG)},
 * {@code 95/46/EG}, {@code (Euratom)}.
 */
public enum Community {
    EU("EU"),
    EG("EG"),
    EEG("EEG"),
    EURATOM("Euratom");

    private final String label;

    Community(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Reads the designation leniently; anything unrecognised is EU.
     */
    public static Community parse(String text) {
        if (text == null) return EU;
        String normalized = text.toUpperCase(Locale.ROOT).trim();
        if (normalized.contains("EURATOM")) return EURATOM;
        if (normalized.contains("EEG")) return EEG;
        if (normalized.contains("EG")) return EG;
        return EU;
    }
}
