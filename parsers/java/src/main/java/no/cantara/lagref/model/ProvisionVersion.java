package no.cantara.lagref.model;

import java.util.Objects;

/**
 * One row of a provision's append-only wording history.
 *
 * @param sequenceId store-assigned, monotonically increasing id; used as the last tie-break
 */
public record ProvisionVersion(
        long sequenceId,
        String documentId,
        ProvisionRef ref,
        String title,
        String content,
        ValidityInterval validity
) {
    public ProvisionVersion {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(validity, "validity");
    }

    public boolean isCurrent() {
        return validity.isOpenEnded();
    }
}
