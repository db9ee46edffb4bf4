package no.cantara.lagref;

import no.cantara.lagref.citation.CitationFormatter;
import no.cantara.lagref.citation.CitationParser;
import no.cantara.lagref.citation.CitationStyle;
import no.cantara.lagref.citation.ParsedCitation;
import no.cantara.lagref.eu.EuReference;
import no.cantara.lagref.eu.EuReferenceExtractor;
import no.cantara.lagref.eu.EuReferences;
import no.cantara.lagref.model.Provision;
import no.cantara.lagref.statute.CrossReferenceExtractor;
import no.cantara.lagref.statute.ExtractedReference;
import no.cantara.lagref.statute.ProvisionSegmenter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line interface for citation parsing and statute text analysis.
 * <pre>
 * Usage: java -jar lagref-parser.jar format &lt;citation&gt; [full|short|pinpoint]
 *        java -jar lagref-parser.jar segment &lt;statute.txt&gt;
 *        java -jar lagref-parser.jar references &lt;statute.txt&gt;
 * </pre>
 */
public class LagrefCli {

    private static final String USAGE = "Usage: java -jar lagref-parser.jar "
            + "(format <citation> [full|short|pinpoint] | segment <statute.txt> | references <statute.txt>)";

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println(USAGE);
            System.exit(1);
        }

        switch (args[0]) {
            case "format" -> format(args);
            case "segment" -> segment(read(args[1]));
            case "references" -> references(read(args[1]));
            default -> {
                System.err.println(USAGE);
                System.exit(1);
            }
        }
    }

    private static void format(String[] args) {
        ParsedCitation parsed = CitationParser.parse(args[1]);
        if (!parsed.valid()) {
            System.err.println("Parse error: " + parsed.error().orElse("invalid citation"));
            System.exit(1);
        }
        CitationStyle style = CitationStyle.FULL;
        if (args.length > 2) {
            style = CitationStyle.fromId(args[2]).orElse(null);
            if (style == null) {
                System.err.println("Error: unknown style '" + args[2] + "'");
                System.exit(1);
            }
        }
        System.out.printf("%s [%s]%n", CitationFormatter.format(parsed, style), parsed.type().id());
    }

    private static void segment(String text) {
        List<Provision> provisions = ProvisionSegmenter.segment(text);
        for (Provision p : provisions) {
            String title = p.titleIfAny().map(t -> " (" + t + ")").orElse("");
            System.out.printf("%-8s %d chars%s%n", p.provisionRef(), p.content().length(), title);
        }
        System.out.printf("✓ %d provision(s), %s%n", provisions.size(),
                ProvisionSegmenter.isChaptered(text) ? "chaptered" : "flat");
    }

    private static void references(String text) {
        for (Provision p : ProvisionSegmenter.segment(text)) {
            for (ExtractedReference ref : CrossReferenceExtractor.extract(p.content())) {
                System.out.printf("%-8s -> %s%n", p.provisionRef(), ref.rawText());
            }
        }
        for (EuReference ref : new EuReferenceExtractor().extract(text)) {
            System.out.printf("EU       -> %s (CELEX %s)%n", EuReferences.format(ref, EuReferences.Style.FULL),
                    ref.celexNumber());
        }
    }

    private static String read(String file) {
        Path path = Path.of(file);
        if (!path.toFile().exists()) {
            System.err.println("Error: file not found: " + path);
            System.exit(1);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Read error: " + e.getMessage());
            System.exit(1);
            return "";
        }
    }
}
