package no.cantara.lagref.temporal;

import no.cantara.lagref.corpus.LegalCorpus;
import no.cantara.lagref.model.DocumentStatus;
import no.cantara.lagref.model.LegalDocument;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks whether a statute, or one of its provisions, is in force now or at a given date.
 */
public class CurrencyChecker {

    static final String HISTORICAL_NOTE = "Historical lookups use provision validity windows where available; "
            + "some statutes only have current consolidated wording.";

    private final LegalCorpus corpus;

    public CurrencyChecker(LegalCorpus corpus) {
        this.corpus = Objects.requireNonNull(corpus, "corpus");
    }

    /**
     * @param provisionRef provision to check, or {@code null}
     * @param asOf         date to check at, or {@code null} for now
     * @return empty when the document is not in the corpus
     */
    public Optional<CurrencyReport> check(String documentId, String provisionRef, LocalDate asOf) {
        TemporalResolver.requireId(documentId, "documentId");
        Optional<LegalDocument> found = corpus.findDocument(documentId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        LegalDocument doc = found.get();

        List<String> warnings = new ArrayList<>();
        switch (doc.status()) {
            case REPEALED -> warnings.add("This statute has been repealed (upphävd)");
            case AMENDED -> warnings.add("This statute has been amended since last ingestion");
            case NOT_YET_IN_FORCE -> warnings.add("This statute has not yet entered into force");
            case IN_FORCE -> { }
        }

        Optional<DocumentStatus> statusAsOf = Optional.empty();
        if (asOf != null) {
            statusAsOf = Optional.of(statusAt(doc, asOf));
            warnings.add(HISTORICAL_NOTE);
        }

        Optional<Boolean> provisionExists = Optional.empty();
        if (provisionRef != null && !provisionRef.isBlank()) {
            boolean exists = asOf == null
                    ? corpus.provisionExists(documentId, provisionRef)
                    : corpus.findVersions(documentId, provisionRef).stream().anyMatch(v -> v.validity().contains(asOf));
            provisionExists = Optional.of(exists);
            if (!exists) {
                warnings.add("Provision \"" + provisionRef + "\" not found in this document");
            }
        }

        return Optional.of(new CurrencyReport(doc.id(), doc.title(), doc.type(), doc.status(),
                Optional.ofNullable(doc.issuedDate()), doc.inForceDateIfAny(),
                doc.status() == DocumentStatus.IN_FORCE, Optional.ofNullable(asOf), statusAsOf,
                provisionExists, warnings));
    }

    /**
     * Not yet in force before the in-force date (or issue date), repealed on or after the repeal
     * date, otherwise in force.
     */
    static DocumentStatus statusAt(LegalDocument doc, LocalDate asOf) {
        LocalDate start = doc.inForceDate() != null ? doc.inForceDate() : doc.issuedDate();
        if (start != null && asOf.isBefore(start)) {
            return DocumentStatus.NOT_YET_IN_FORCE;
        }
        if (doc.repealedDate() != null && !asOf.isBefore(doc.repealedDate())) {
            return DocumentStatus.REPEALED;
        }
        return DocumentStatus.IN_FORCE;
    }
}
