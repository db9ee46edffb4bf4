package no.cantara.lagref.eu;

import java.util.Arrays;
import java.util.Optional;

/**
 * How a Swedish provision relates to the EU act it cites.
 */
public enum ReferenceType {
    IMPLEMENTS("implements"),
    SUPPLEMENTS("supplements"),
    APPLIES("applies"),
    REFERENCES("references"),
    COMPLIES_WITH("complies_with"),
    DEROGATES_FROM("derogates_from"),
    CITES_ARTICLE("cites_article");

    private final String id;

    ReferenceType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<ReferenceType> fromId(String id) {
        return Arrays.stream(values()).filter(t -> t.id.equalsIgnoreCase(id)).findFirst();
    }
}
