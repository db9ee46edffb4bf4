package no.cantara.lagref.citation;

import no.cantara.lagref.model.DocumentType;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Swedish legal citation strings.
 *
 * <p>Supported formats:
 * <pre>
 *   SFS 2018:218
 *   SFS 2018:218 3 kap. 5 §
 *   2018:218 3:5
 *   2018:218 5 a §
 *   3 kap. 5 § lag (2018:218)
 *   Prop. 2017/18:105
 *   SOU 2023:45
 *   Ds 2022:10
 *   NJA 2020 s. 45
 *   HFD 2019 ref. 12
 *   AD 2020 nr 5
 * </pre>
 * Unrecognised or empty input yields an invalid citation with a diagnostic; parsing never
 * throws for bad data.
 */
public final class CitationParser {

    private static final Pattern CASE_PREFIX = Pattern.compile("^(nja|hfd|ad|md|mig)\\s");
    private static final Pattern STATUTE_PREFIX = Pattern.compile("^(?:sfs\\s+)?\\d{4}:\\d+");

    private CitationParser() {}

    public static ParsedCitation parse(String citation) {
        Objects.requireNonNull(citation, "citation");
        String trimmed = citation.trim();
        if (trimmed.isEmpty()) {
            return ParsedCitation.invalid(citation, "Empty citation");
        }

        for (CitationGrammar grammar : CitationGrammar.values()) {
            Matcher m = grammar.pattern().matcher(trimmed);
            if (m.find()) {
                return grammar.interpret(citation, m);
            }
        }
        return ParsedCitation.invalid(citation, "Unrecognized citation format: \"" + trimmed + "\"");
    }

    /**
     * Guesses the document type from the citation prefix without a full parse.
     */
    public static Optional<DocumentType> detectDocumentType(String citation) {
        if (citation == null) return Optional.empty();
        String lower = citation.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("prop.")) return Optional.of(DocumentType.BILL);
        if (lower.startsWith("sou ")) return Optional.of(DocumentType.SOU);
        if (lower.startsWith("ds ")) return Optional.of(DocumentType.DS);
        if (CASE_PREFIX.matcher(lower).find()) return Optional.of(DocumentType.CASE_LAW);
        if (STATUTE_PREFIX.matcher(lower).find()) return Optional.of(DocumentType.STATUTE);
        if (CitationGrammar.STATUTE_PROVISION_FIRST.pattern().matcher(citation.trim()).find()) {
            return Optional.of(DocumentType.STATUTE);
        }
        return Optional.empty();
    }
}
