package no.cantara.lagref.citation;

import no.cantara.lagref.model.DocumentStatus;

import java.util.Optional;

/**
 * Corpus lookups needed to check that a citation is grounded.
 */
public interface CitationLookup {

    boolean documentExists(String documentId);

    boolean provisionExists(String documentId, String provisionRef);

    Optional<DocumentStatus> getDocumentStatus(String documentId);

    Optional<String> getDocumentTitle(String documentId);
}
