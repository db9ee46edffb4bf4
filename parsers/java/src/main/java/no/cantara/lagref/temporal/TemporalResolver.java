package no.cantara.lagref.temporal;

import no.cantara.lagref.corpus.LegalCorpus;
import no.cantara.lagref.model.AmendmentRecord;
import no.cantara.lagref.model.ProvisionVersion;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Answers "what did this provision say on date D".
 *
 * <p>A version qualifies for date {@code d} when {@code (from absent or from <= d)} and
 * {@code (to absent or to > d)}. When several qualify, the one with the latest start date wins,
 * then the one with the highest sequence id.
 */
public class TemporalResolver {

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    static final Comparator<ProvisionVersion> PRECEDENCE = Comparator
            .comparing((ProvisionVersion v) -> v.validity().from().orElse(LocalDate.MIN))
            .thenComparingLong(ProvisionVersion::sequenceId);

    private final LegalCorpus corpus;

    public TemporalResolver(LegalCorpus corpus) {
        this.corpus = Objects.requireNonNull(corpus, "corpus");
    }

    /**
     * Current wording, from the current provisions table.
     */
    public Resolution resolve(String documentId, String provisionRef) {
        return resolve(documentId, provisionRef, null);
    }

    /**
     * @param asOf date to resolve at, or {@code null} for the current wording
     */
    public Resolution resolve(String documentId, String provisionRef, LocalDate asOf) {
        requireId(documentId, "documentId");
        requireId(provisionRef, "provisionRef");

        if (asOf == null) {
            return corpus.findProvision(documentId, provisionRef)
                    .<Resolution>map(p -> new Resolution.Current(documentId, p))
                    .orElseGet(() -> new Resolution.NotFound(documentId, provisionRef));
        }

        List<ProvisionVersion> versions = corpus.findVersions(documentId, provisionRef);
        if (versions.isEmpty()) {
            return new Resolution.NotFound(documentId, provisionRef);
        }

        Optional<ProvisionVersion> winner = versions.stream()
                .filter(v -> v.validity().contains(asOf))
                .max(PRECEDENCE);
        if (winner.isPresent()) {
            return new Resolution.Versioned(winner.get());
        }

        Optional<LocalDate> firstValidFrom = versions.stream()
                .map(v -> v.validity().from())
                .flatMap(Optional::stream)
                .min(Comparator.naturalOrder());
        return new Resolution.NotInForce(documentId, provisionRef, asOf, firstValidFrom);
    }

    /**
     * All stored wordings, oldest first. Versions without a start date sort first.
     */
    public List<ProvisionVersion> history(String documentId, String provisionRef) {
        requireId(documentId, "documentId");
        requireId(provisionRef, "provisionRef");
        return corpus.findVersions(documentId, provisionRef).stream()
                .sorted(PRECEDENCE)
                .collect(Collectors.toList());
    }

    /**
     * Amendments that took effect strictly after {@code after}, by date. Undated amendments are
     * left out.
     */
    public List<AmendmentRecord> amendmentsAfter(String documentId, String provisionRef, LocalDate after) {
        Objects.requireNonNull(after, "after");
        return corpus.findAmendments(documentId, provisionRef).stream()
                .filter(a -> a.amendmentDate() != null && a.amendmentDate().isAfter(after))
                .sorted(Comparator.comparing(AmendmentRecord::amendmentDate))
                .collect(Collectors.toList());
    }

    public ProvisionComparison compare(String documentId, String provisionRef, LocalDate from, LocalDate to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Comparison date " + to + " is before " + from);
        }

        Resolution before = resolve(documentId, provisionRef, from);
        Resolution after = resolve(documentId, provisionRef, to);
        boolean changed = !before.content().equals(after.content());
        List<AmendmentRecord> between = amendmentsAfter(documentId, provisionRef, from).stream()
                .filter(a -> !a.amendmentDate().isAfter(to))
                .collect(Collectors.toList());
        return new ProvisionComparison(from, to, before, after, changed, between);
    }

    /**
     * Strict {@code YYYY-MM-DD} parsing with the error message callers surface to users.
     */
    public static LocalDate parseIsoDate(String text) {
        Objects.requireNonNull(text, "date");
        if (!ISO_DATE.matcher(text).matches()) {
            throw new IllegalArgumentException("Invalid date format: " + text + ". Expected YYYY-MM-DD.");
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date: " + text, e);
        }
    }

    static void requireId(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
