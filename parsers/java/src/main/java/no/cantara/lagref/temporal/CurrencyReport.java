package no.cantara.lagref.temporal;

import no.cantara.lagref.model.DocumentStatus;
import no.cantara.lagref.model.DocumentType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Whether a document, and optionally one of its provisions, is in force.
 *
 * @param isCurrent       true when the stored status is {@code in_force}
 * @param statusAsOf      status at {@code asOf}; present only for dated checks
 * @param provisionExists present only when a provision was asked about
 */
public record CurrencyReport(
        String documentId,
        String title,
        DocumentType type,
        DocumentStatus status,
        Optional<LocalDate> issuedDate,
        Optional<LocalDate> inForceDate,
        boolean isCurrent,
        Optional<LocalDate> asOf,
        Optional<DocumentStatus> statusAsOf,
        Optional<Boolean> provisionExists,
        List<String> warnings
) {
    public CurrencyReport {
        warnings = List.copyOf(warnings);
    }

    public Optional<Boolean> isInForceAsOf() {
        return statusAsOf.map(s -> s == DocumentStatus.IN_FORCE);
    }
}
