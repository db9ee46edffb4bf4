package no.cantara.lagref.citation;

import java.util.Objects;
import java.util.Optional;

/**
 * Renders parsed citations in standard Swedish form. Formatting never rejects input: an invalid
 * citation comes back as its raw text.
 */
public final class CitationFormatter {

    private CitationFormatter() {}

    public static String format(ParsedCitation citation) {
        return format(citation, CitationStyle.FULL);
    }

    public static String format(ParsedCitation citation, CitationStyle style) {
        Objects.requireNonNull(citation, "citation");
        Objects.requireNonNull(style, "style");
        if (!citation.valid()) {
            return citation.raw();
        }

        return switch (citation.type()) {
            case STATUTE -> formatStatute(citation, style);
            case BILL -> "Prop. " + citation.documentId();
            case SOU -> "SOU " + citation.documentId();
            case DS -> "Ds " + citation.documentId();
            case CASE_LAW -> formatCaseLaw(citation);
        };
    }

    /**
     * {@code "3:5"} for chapter 3 section 5, {@code "5"} for a flat statute.
     */
    public static String formatProvisionRef(String chapter, String section) {
        Objects.requireNonNull(section, "section");
        return chapter != null && !chapter.isBlank() ? chapter + ":" + section : section;
    }

    private static String formatStatute(ParsedCitation c, CitationStyle style) {
        String id = c.documentId();
        Optional<String> chapter = c.chapter();
        Optional<String> section = c.section();

        switch (style) {
            case PINPOINT:
                if (section.isEmpty()) return id;
                return chapter.map(ch -> ch + " kap. " + section.get() + " §").orElse(section.get() + " §");
            case SHORT:
                if (section.isEmpty()) return id;
                return chapter.map(ch -> id + " " + ch + ":" + section.get()).orElse(id + " " + section.get() + " §");
            default:
                StringBuilder sb = new StringBuilder("SFS ").append(id);
                chapter.ifPresent(ch -> sb.append(' ').append(ch).append(" kap."));
                section.ifPresent(s -> sb.append(' ').append(s).append(" §"));
                return sb.toString();
        }
    }

    private static String formatCaseLaw(ParsedCitation c) {
        String id = c.documentId();
        if (c.page().isEmpty()) return id;
        String court = id.contains(" ") ? id.substring(0, id.indexOf(' ')) : id;
        String marker = switch (court) {
            case "NJA" -> "s.";
            case "HFD" -> "ref.";
            default -> "nr";
        };
        return id + " " + marker + " " + c.page().get();
    }
}
