package no.cantara.lagref.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Directed edge between documents or provisions. Provision refs are optional for
 * document-level references.
 */
public record CrossReference(
        String sourceDocumentId,
        Optional<String> sourceProvisionRef,
        String targetDocumentId,
        Optional<String> targetProvisionRef,
        Type refType
) {
    public enum Type {
        REFERENCES("references"),
        AMENDED_BY("amended_by"),
        IMPLEMENTS("implements"),
        SEE_ALSO("see_also");

        private final String id;

        Type(String id) { this.id = id; }

        public String id() { return id; }
    }

    public CrossReference {
        Objects.requireNonNull(sourceDocumentId, "sourceDocumentId");
        Objects.requireNonNull(sourceProvisionRef, "sourceProvisionRef");
        Objects.requireNonNull(targetDocumentId, "targetDocumentId");
        Objects.requireNonNull(targetProvisionRef, "targetProvisionRef");
        Objects.requireNonNull(refType, "refType");
    }
}
