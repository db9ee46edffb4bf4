package no.cantara.lagref.corpus;

import no.cantara.lagref.eu.EuReference;
import no.cantara.lagref.model.AmendmentRecord;
import no.cantara.lagref.model.CrossReference;
import no.cantara.lagref.model.LegalDocument;
import no.cantara.lagref.model.Provision;
import no.cantara.lagref.model.ProvisionRef;
import no.cantara.lagref.model.ProvisionVersion;
import no.cantara.lagref.model.ValidityInterval;

import java.util.Optional;

/**
 * Write side of the legal corpus. Version history, references and amendments are append-only.
 */
public interface CorpusWriter {

    /** Inserts or replaces document metadata. */
    void saveDocument(LegalDocument document);

    /** Inserts or replaces the current wording of a provision. */
    void saveProvision(String documentId, Provision provision);

    /**
     * Appends a wording to the provision's history.
     *
     * @return the stored row, carrying its assigned sequence id
     */
    ProvisionVersion appendVersion(String documentId, ProvisionRef ref, String title, String content,
                                   ValidityInterval validity);

    void addCrossReference(CrossReference reference);

    void addEuReference(String documentId, Optional<String> provisionRef, EuReference reference);

    void addAmendment(String documentId, String provisionRef, AmendmentRecord amendment);
}
