package no.cantara.lagref.temporal;

import no.cantara.lagref.model.AmendmentRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * A provision's wording at two dates.
 *
 * @param changed    true when the wording (or its availability) differs between the dates
 * @param amendments amendments that took effect after {@code from} and on or before {@code to}
 */
public record ProvisionComparison(
        LocalDate from,
        LocalDate to,
        Resolution before,
        Resolution after,
        boolean changed,
        List<AmendmentRecord> amendments
) {
    public ProvisionComparison {
        amendments = List.copyOf(amendments);
    }
}
