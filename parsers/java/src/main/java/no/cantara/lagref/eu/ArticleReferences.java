package no.cantara.lagref.eu;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Article pinpoints inside EU citations.
 *
 * <pre>
 *   "artikel 9.2(h) och 9.3"   -&gt; [9.2.h, 9.3]
 *   "artiklarna 83 och 84"     -&gt; [83, 84]
 *   "artiklarna 13–15"         -&gt; [13-15]
 * </pre>
 */
public final class ArticleReferences {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final Pattern SEGMENT_PATTERN = Pattern.compile("\\bartik(?:el|larna)\\s+([^;\\n]+)", FLAGS);
    private static final Pattern CONJUNCTION = Pattern.compile("\\s+(?:och|and)\\s+", FLAGS);
    private static final Pattern SEPARATOR = Pattern.compile("\\s*(?:,|och|and)\\s*", FLAGS);

    private static final Pattern DASHES = Pattern.compile("[–—]");
    private static final Pattern PARENTHESISED = Pattern.compile("\\(([^)]+)\\)");
    private static final Pattern EDGE_DOTS = Pattern.compile("^\\.+|\\.+$");
    private static final Pattern TRAILING_LETTER = Pattern.compile("^(\\d+(?:\\.\\d+)*)([a-z])$", FLAGS);
    private static final Pattern PATH_SHAPE = Pattern.compile("^\\d+(?:\\.\\d+)*(?:\\.[a-z])?$");
    private static final Pattern RANGE_SHAPE = Pattern.compile("^\\d+(?:\\.\\d+)*-\\d+(?:\\.\\d+)*$");

    private ArticleReferences() {}

    public static List<String> extractInline(String text) {
        return extractInline(text, EuVocabulary.defaults());
    }

    /**
     * Finds article pinpoints anywhere in the text, normalised and de-duplicated in order of
     * appearance.
     */
    public static List<String> extractInline(String text, EuVocabulary vocabulary) {
        if (text == null || text.isBlank()) return List.of();
        Set<String> found = new LinkedHashSet<>();

        Matcher m = SEGMENT_PATTERN.matcher(text);
        while (m.find()) {
            String segment = m.group(1).trim();
            segment = vocabulary.articleTailPattern().split(segment, 2)[0].trim();
            if (segment.isEmpty()) continue;

            segment = CONJUNCTION.matcher(segment).replaceAll(",");
            for (String part : SEPARATOR.split(segment)) {
                normalizeToken(part).ifPresent(found::add);
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Normalises one article token. {@code "9(h)"} becomes {@code "9.h"}, {@code "13–15"} becomes
     * {@code "13-15"}. Tokens that are neither a dotted path nor a numeric range are rejected.
     */
    public static Optional<String> normalizeToken(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim();
        if (normalized.isEmpty()) return Optional.empty();

        normalized = DASHES.matcher(normalized).replaceAll("-");
        normalized = PARENTHESISED.matcher(normalized).replaceAll(".$1");
        normalized = normalized.replaceAll("\\s+", "");
        normalized = EDGE_DOTS.matcher(normalized).replaceAll("");
        normalized = TRAILING_LETTER.matcher(normalized).replaceAll("$1.$2");
        normalized = normalized.toLowerCase(Locale.ROOT);

        if (PATH_SHAPE.matcher(normalized).matches() || RANGE_SHAPE.matcher(normalized).matches()) {
            return Optional.of(normalized);
        }
        return Optional.empty();
    }
}
