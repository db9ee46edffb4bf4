package no.cantara.lagref.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of legal documents in the Swedish system.
 */
public enum DocumentType {
    STATUTE("statute"),
    BILL("bill"),
    SOU("sou"),
    DS("ds"),
    CASE_LAW("case_law");

    private final String id;

    DocumentType(String id) {
        this.id = id;
    }

    /** Wire identifier, e.g. {@code case_law}. */
    public String id() {
        return id;
    }

    public static Optional<DocumentType> fromId(String id) {
        return Arrays.stream(values()).filter(t -> t.id.equalsIgnoreCase(id)).findFirst();
    }
}
