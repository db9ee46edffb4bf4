package no.cantara.lagref.eu;

import java.util.Arrays;
import java.util.Optional;

/**
 * EU legislative act types that Swedish statutes cite.
 */
public enum EuActType {
    DIRECTIVE("directive", "direktiv", 'L'),
    REGULATION("regulation", "förordning", 'R');

    private final String id;
    private final String swedishLabel;
    private final char celexCode;

    EuActType(String id, String swedishLabel, char celexCode) {
        this.id = id;
        this.swedishLabel = swedishLabel;
        this.celexCode = celexCode;
    }

    public String id() { return id; }

    public String swedishLabel() { return swedishLabel; }

    /** Document-type letter of a sector 3 CELEX number. */
    public char celexCode() { return celexCode; }

    public static Optional<EuActType> fromId(String id) {
        return Arrays.stream(values()).filter(t -> t.id.equalsIgnoreCase(id)).findFirst();
    }
}
