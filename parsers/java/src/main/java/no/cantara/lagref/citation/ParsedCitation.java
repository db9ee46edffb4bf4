package no.cantara.lagref.citation;

import no.cantara.lagref.model.DocumentType;
import no.cantara.lagref.model.ProvisionRef;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of parsing a citation string. Never persisted.
 *
 * @param raw        the input exactly as given
 * @param type       detected document type; {@link DocumentType#STATUTE} when parsing failed
 * @param documentId SFS number, bill number, or {@code "{court} {year}"} for case law; empty when invalid
 * @param page       page or reference number of a case law citation
 * @param error      diagnostic when {@code valid} is false
 */
public record ParsedCitation(
        String raw,
        DocumentType type,
        String documentId,
        Optional<String> chapter,
        Optional<String> section,
        Optional<String> page,
        boolean valid,
        Optional<String> error
) {
    public ParsedCitation {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(chapter, "chapter");
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(page, "page");
        Objects.requireNonNull(error, "error");
    }

    static ParsedCitation invalid(String raw, String error) {
        return new ParsedCitation(raw, DocumentType.STATUTE, "", Optional.empty(), Optional.empty(),
                Optional.empty(), false, Optional.of(error));
    }

    static ParsedCitation statute(String raw, String documentId, String chapter, String section) {
        return new ParsedCitation(raw, DocumentType.STATUTE, documentId, Optional.ofNullable(chapter),
                Optional.ofNullable(section), Optional.empty(), true, Optional.empty());
    }

    static ParsedCitation document(String raw, DocumentType type, String documentId) {
        return new ParsedCitation(raw, type, documentId, Optional.empty(), Optional.empty(),
                Optional.empty(), true, Optional.empty());
    }

    static ParsedCitation caseLaw(String raw, String documentId, String page) {
        return new ParsedCitation(raw, DocumentType.CASE_LAW, documentId, Optional.empty(), Optional.empty(),
                Optional.ofNullable(page), true, Optional.empty());
    }

    /**
     * The cited provision, present when a section was given.
     */
    public Optional<ProvisionRef> provisionRef() {
        return section.map(s -> ProvisionRef.of(chapter.orElse(null), s));
    }

    /**
     * Same citation target, ignoring the raw text: type, document, chapter, section and page.
     */
    public boolean sameTargetAs(ParsedCitation other) {
        return other != null
                && type == other.type
                && documentId.equals(other.documentId)
                && chapter.equals(other.chapter)
                && section.equals(other.section)
                && page.equals(other.page);
    }
}
