package no.cantara.lagref.statute;

import no.cantara.lagref.model.Provision;
import no.cantara.lagref.model.ProvisionRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw statute text into provisions.
 *
 * <p>Handles chaptered statutes ({@code "3 kap. 5 §"} gives ref {@code 3:5}), flat statutes
 * ({@code "5 §"} gives {@code 5}) and inserted sections ({@code "5 a §"} gives {@code 5 a}).
 * A section without body text, such as a repealed stub, produces no provision.
 *
 * <p>While a section has no body text yet, a heading line becomes its title, and a later heading
 * line replaces an earlier one. A heading is shorter than 80 characters and starts with a capital
 * letter. A line ending in {@code "."} is a sentence and is never a heading.
 */
public final class ProvisionSegmenter {

    private static final Pattern CHAPTER_PATTERN = Pattern.compile("^(\\d+)\\s*kap\\.\\s*(.*)$");
    private static final Pattern SECTION_PATTERN = Pattern.compile("^(\\d+\\s*[a-z]?)\\s*§\\s*(.*)$");
    private static final Pattern CHAPTER_ANYWHERE = Pattern.compile("^\\d+\\s*kap\\.", Pattern.MULTILINE);
    private static final Pattern HEADING_START = Pattern.compile("^\\p{Lu}");
    private static final int MAX_HEADING_LENGTH = 80;

    private ProvisionSegmenter() {}

    public static List<Provision> segment(String text) {
        Objects.requireNonNull(text, "text");
        return segment(List.of(text.split("\\r?\\n")));
    }

    public static List<Provision> segment(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        Accumulator acc = new Accumulator();

        for (String raw : lines) {
            String line = raw == null ? "" : raw.trim();
            if (line.isEmpty()) continue;

            Matcher chapter = CHAPTER_PATTERN.matcher(line);
            if (chapter.matches()) {
                acc.flush();
                acc.chapter = chapter.group(1);
                continue;
            }

            Matcher section = SECTION_PATTERN.matcher(line);
            if (section.matches()) {
                acc.flush();
                acc.section = ProvisionRef.normalizeSection(section.group(1));
                String remainder = section.group(2).trim();
                if (!remainder.isEmpty()) {
                    acc.content.add(remainder);
                }
                continue;
            }

            if (acc.section != null && acc.content.isEmpty() && isHeading(line)) {
                acc.title = line;
                continue;
            }

            if (acc.section != null) {
                acc.content.add(line);
            }
        }

        acc.flush();
        return List.copyOf(acc.provisions);
    }

    /**
     * True if a chapter heading starts any line of the text.
     */
    public static boolean isChaptered(String text) {
        return text != null && CHAPTER_ANYWHERE.matcher(text).find();
    }

    // A heading is short, capitalised and not a sentence.
    static boolean isHeading(String line) {
        return line.length() < MAX_HEADING_LENGTH
                && HEADING_START.matcher(line).find()
                && !line.endsWith(".");
    }

    private static final class Accumulator {
        private final List<Provision> provisions = new ArrayList<>();
        private final List<String> content = new ArrayList<>();
        private String chapter;
        private String section;
        private String title;

        void flush() {
            if (section != null && !content.isEmpty()) {
                provisions.add(new Provision(ProvisionRef.of(chapter, section), title, String.join(" ", content)));
            }
            section = null;
            title = null;
            content.clear();
        }
    }
}
