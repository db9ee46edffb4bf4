package no.cantara.lagref.corpus;

import no.cantara.lagref.eu.EuReference;

import java.util.Objects;
import java.util.Optional;

/**
 * An EU act reference attached to a document, or to one of its provisions.
 */
public record EuReferenceLink(String documentId, Optional<String> provisionRef, EuReference reference) {

    public EuReferenceLink {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(provisionRef, "provisionRef");
        Objects.requireNonNull(reference, "reference");
    }
}
