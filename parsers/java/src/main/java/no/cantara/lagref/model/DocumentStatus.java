package no.cantara.lagref.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle status of a legal document. Documents are never deleted, only re-statused.
 */
public enum DocumentStatus {
    IN_FORCE("in_force"),
    AMENDED("amended"),
    REPEALED("repealed"),
    NOT_YET_IN_FORCE("not_yet_in_force");

    private final String id;

    DocumentStatus(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<DocumentStatus> fromId(String id) {
        return Arrays.stream(values()).filter(s -> s.id.equalsIgnoreCase(id)).findFirst();
    }
}
