package no.cantara.lagref.corpus;

import no.cantara.lagref.citation.CitationLookup;
import no.cantara.lagref.model.AmendmentRecord;
import no.cantara.lagref.model.CrossReference;
import no.cantara.lagref.model.DocumentStatus;
import no.cantara.lagref.model.LegalDocument;
import no.cantara.lagref.model.Provision;
import no.cantara.lagref.model.ProvisionVersion;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the legal corpus. Implementations must be safe for concurrent readers.
 *
 * <p>Provision references are keys as produced by {@code ProvisionRef#key()}:
 * {@code "3:5"} or {@code "5"}.
 */
public interface LegalCorpus extends CitationLookup {

    Optional<LegalDocument> findDocument(String documentId);

    /** Current wording of a provision. */
    Optional<Provision> findProvision(String documentId, String provisionRef);

    /** Every stored wording of a provision, in insertion order. */
    List<ProvisionVersion> findVersions(String documentId, String provisionRef);

    List<AmendmentRecord> findAmendments(String documentId, String provisionRef);

    /** Outgoing edges from the document or any of its provisions. */
    List<CrossReference> findCrossReferences(String documentId);

    List<EuReferenceLink> findEuReferences(String documentId);

    @Override
    default boolean documentExists(String documentId) {
        return findDocument(documentId).isPresent();
    }

    @Override
    default boolean provisionExists(String documentId, String provisionRef) {
        return findProvision(documentId, provisionRef).isPresent();
    }

    @Override
    default Optional<DocumentStatus> getDocumentStatus(String documentId) {
        return findDocument(documentId).map(LegalDocument::status);
    }

    @Override
    default Optional<String> getDocumentTitle(String documentId) {
        return findDocument(documentId).map(LegalDocument::title);
    }
}
