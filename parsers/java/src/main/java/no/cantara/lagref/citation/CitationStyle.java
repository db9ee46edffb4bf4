package no.cantara.lagref.citation;

import java.util.Arrays;
import java.util.Optional;

/**
 * Output styles of {@link CitationFormatter}.
 */
public enum CitationStyle {
    /** {@code SFS 2018:218 3 kap. 5 §} */
    FULL("full"),
    /** {@code 2018:218 3:5} */
    SHORT("short"),
    /** {@code 3 kap. 5 §} */
    PINPOINT("pinpoint");

    private final String id;

    CitationStyle(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<CitationStyle> fromId(String id) {
        return Arrays.stream(values()).filter(s -> s.id.equalsIgnoreCase(id)).findFirst();
    }
}
