package no.cantara.lagref.temporal;

import no.cantara.lagref.model.Provision;
import no.cantara.lagref.model.ProvisionVersion;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of looking up a provision's wording.
 */
public sealed interface Resolution
        permits Resolution.Versioned, Resolution.Current, Resolution.NotInForce, Resolution.NotFound {

    String documentId();

    String provisionRef();

    /** {@code current}, {@code historical}, {@code future}, {@code not_in_force} or {@code not_found}. */
    String status();

    default boolean isFound() {
        return content().isPresent();
    }

    default Optional<String> content() {
        return Optional.empty();
    }

    /** The wording valid at the requested date. */
    record Versioned(ProvisionVersion version) implements Resolution {
        public Versioned {
            Objects.requireNonNull(version, "version");
        }

        @Override public String documentId() { return version.documentId(); }
        @Override public String provisionRef() { return version.ref().key(); }
        @Override public String status() { return version.isCurrent() ? "current" : "historical"; }
        @Override public Optional<String> content() { return Optional.of(version.content()); }
    }

    /** The wording from the current table, returned when no date was requested. */
    record Current(String documentId, Provision provision) implements Resolution {
        public Current {
            Objects.requireNonNull(documentId, "documentId");
            Objects.requireNonNull(provision, "provision");
        }

        @Override public String provisionRef() { return provision.provisionRef(); }
        @Override public String status() { return "current"; }
        @Override public Optional<String> content() { return Optional.of(provision.content()); }
    }

    /**
     * The provision has a history, but no wording was valid at {@code asOf}.
     *
     * @param firstValidFrom earliest start date in the history, if any row has one
     */
    record NotInForce(String documentId, String provisionRef, LocalDate asOf, Optional<LocalDate> firstValidFrom)
            implements Resolution {

        /** True when the date lies before the provision's first wording took effect. */
        public boolean notYetEnacted() {
            return firstValidFrom.map(asOf::isBefore).orElse(false);
        }

        @Override public String status() { return notYetEnacted() ? "future" : "not_in_force"; }
    }

    /** The provision never existed in the corpus. */
    record NotFound(String documentId, String provisionRef) implements Resolution {
        @Override public String status() { return "not_found"; }
    }
}
