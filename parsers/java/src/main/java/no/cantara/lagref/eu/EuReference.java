package no.cantara.lagref.eu;

import java.util.Objects;
import java.util.Optional;

/**
 * A directive or regulation cited in Swedish legal text.
 *
 * @param id        {@code "{year}/{number}"}, e.g. {@code 2016/679}
 * @param article   comma-joined normalised article pinpoints, e.g. {@code 9.2.h,9.3}
 * @param fullText  the citation as found
 * @param context   whitespace-collapsed window of up to 100 characters either side
 */
public record EuReference(
        EuActType type,
        String id,
        int year,
        int number,
        Optional<Community> community,
        Optional<String> issuingBody,
        Optional<String> article,
        String fullText,
        String context,
        Optional<ReferenceType> referenceType,
        Optional<String> implementationKeyword
) {
    public EuReference {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(community, "community");
        Objects.requireNonNull(issuingBody, "issuingBody");
        Objects.requireNonNull(article, "article");
        Objects.requireNonNull(referenceType, "referenceType");
        Objects.requireNonNull(implementationKeyword, "implementationKeyword");
    }

    static EuReference found(EuActType type, int year, int number, Community community, String issuingBody,
                             String fullText, String context) {
        return new EuReference(type, year + "/" + number, year, number, Optional.ofNullable(community),
                Optional.ofNullable(issuingBody), Optional.empty(), fullText, context,
                Optional.empty(), Optional.empty());
    }

    /** Lookup key in the EU document table, e.g. {@code regulation:2016/679}. */
    public String lookupKey() {
        return type.id() + ":" + id;
    }

    /**
     * CELEX-style identifier {@code 3{year}{L|R}{number}} with the number padded to four digits.
     * Synthesised for display and export, not checked against EUR-Lex.
     */
    public String celexNumber() {
        return "3" + year + type.celexCode() + String.format("%04d", number);
    }

    String dedupeKey() {
        return id + ":" + community.map(Community::label).orElse("");
    }

    EuReference withClassification(Optional<String> newArticle, Optional<ReferenceType> newType,
                                   Optional<String> keyword) {
        return new EuReference(type, id, year, number, community, issuingBody, newArticle, fullText, context,
                newType, keyword);
    }
}
