package no.cantara.lagref.model;

import java.time.LocalDate;

/**
 * Amendment of a provision by a later statute.
 *
 * @param amendedBySfs  SFS number of the amending statute
 * @param changeSummary free text, or {@code null}
 */
public record AmendmentRecord(
        String amendedBySfs,
        LocalDate amendmentDate,
        String amendmentType,
        String changeSummary
) {}
