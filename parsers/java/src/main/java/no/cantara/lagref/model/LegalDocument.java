package no.cantara.lagref.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * A statute, bill, inquiry report or case in the corpus.
 *
 * @param id           jurisdiction-specific number, e.g. {@code 2018:218}
 * @param shortName    abbreviation such as {@code DSL}, or {@code null}
 * @param inForceDate  date of entry into force, or {@code null}
 * @param repealedDate date the document stopped applying, or {@code null}
 */
public record LegalDocument(
        String id,
        DocumentType type,
        String title,
        String shortName,
        DocumentStatus status,
        LocalDate issuedDate,
        LocalDate inForceDate,
        LocalDate repealedDate
) {
    public LegalDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(status, "status");
    }

    public Optional<String> shortNameIfAny() {
        return Optional.ofNullable(shortName);
    }

    public Optional<LocalDate> inForceDateIfAny() {
        return Optional.ofNullable(inForceDate);
    }

    public Optional<LocalDate> repealedDateIfAny() {
        return Optional.ofNullable(repealedDate);
    }

    public LegalDocument withStatus(DocumentStatus newStatus) {
        return new LegalDocument(id, type, title, shortName, newStatus, issuedDate, inForceDate, repealedDate);
    }
}
