package no.cantara.lagref.statute;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads amendment markers from Swedish statute text.
 *
 * <p>Recognised forms:
 * <ul>
 *   <li>{@code "... personuppgifter. Lag (2021:1174)."} at the end of a provision</li>
 *   <li>{@code "Upphävd genom lag (yyyy:nnn)"}</li>
 *   <li>{@code "Införd genom lag (yyyy:nnn)"}</li>
 *   <li>{@code "Har upphävts genom lag (yyyy:nnn)"}</li>
 *   <li>transitional text containing {@code "träder i kraft"}</li>
 * </ul>
 */
public final class AmendmentExtractor {

    private static final Pattern SUFFIX_PATTERN = Pattern.compile("Lag\\s*\\((\\d{4}:\\d+)\\)\\.\\s*$");
    private static final Pattern REPEALED_PATTERN = Pattern.compile("[Uu]pphävd\\s+genom\\s+lag\\s*\\((\\d{4}:\\d+)\\)");
    private static final Pattern INTRODUCED_PATTERN = Pattern.compile("[Ii]nförd\\s+genom\\s+lag\\s*\\((\\d{4}:\\d+)\\)");
    private static final Pattern HAS_REPEALED_PATTERN =
            Pattern.compile("[Hh]ar\\s+upphävts\\s+genom\\s+lag\\s*\\((\\d{4}:\\d+)\\)");
    private static final Pattern FORCE_PATTERN = Pattern.compile("[Tt]räder\\s+i\\s+kraft");
    private static final Pattern SFS_PATTERN = Pattern.compile("(\\d{4}:\\d+)");

    private static final Pattern EFFECTIVE_DATE_PATTERN = Pattern.compile(
            "träder\\s+i\\s+kraft\\s+den\\s+(\\d{1,2})\\s+([a-zåäö]+)\\s+(\\d{4})",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern ISO_DATE_PATTERN = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("januari", 1), Map.entry("februari", 2), Map.entry("mars", 3),
            Map.entry("april", 4), Map.entry("maj", 5), Map.entry("juni", 6),
            Map.entry("juli", 7), Map.entry("augusti", 8), Map.entry("september", 9),
            Map.entry("oktober", 10), Map.entry("november", 11), Map.entry("december", 12));

    private AmendmentExtractor() {}

    /**
     * Extracts amendment markers. A trailing {@code "Lag (yyyy:nnn)."} is definitive and stops the
     * scan; otherwise all inline markers are collected, followed by entry-into-force references
     * to SFS numbers not already reported.
     */
    public static List<AmendmentReference> extract(String content) {
        Objects.requireNonNull(content, "content");
        List<AmendmentReference> amendments = new ArrayList<>();

        Matcher suffix = SUFFIX_PATTERN.matcher(content);
        if (suffix.find()) {
            amendments.add(new AmendmentReference(suffix.group(1), AmendmentReference.Kind.AMENDED,
                    AmendmentReference.Position.SUFFIX, suffix.group()));
            return List.copyOf(amendments);
        }

        collectInline(REPEALED_PATTERN, AmendmentReference.Kind.REPEALED, content, amendments);
        collectInline(INTRODUCED_PATTERN, AmendmentReference.Kind.INTRODUCED, content, amendments);
        collectInline(HAS_REPEALED_PATTERN, AmendmentReference.Kind.REPEALED, content, amendments);

        if (FORCE_PATTERN.matcher(content).find()) {
            Matcher sfs = SFS_PATTERN.matcher(content);
            while (sfs.find()) {
                String number = sfs.group(1);
                boolean known = amendments.stream().anyMatch(a -> a.amendedBySfs().equals(number));
                if (!known) {
                    amendments.add(new AmendmentReference(number, AmendmentReference.Kind.ENTRY_INTO_FORCE,
                            AmendmentReference.Position.TRANSITION, sfs.group()));
                }
            }
        }

        return List.copyOf(amendments);
    }

    /**
     * Reads the date of entry into force, e.g. {@code "Denna lag träder i kraft den 1 juli 2021"},
     * falling back to the first ISO date in the text.
     */
    public static Optional<LocalDate> extractEffectiveDate(String text) {
        if (text == null) return Optional.empty();

        Matcher m = EFFECTIVE_DATE_PATTERN.matcher(text);
        if (m.find()) {
            Integer month = MONTHS.get(m.group(2).toLowerCase(Locale.ROOT));
            if (month != null) {
                Optional<LocalDate> date = date(m.group(3), month, m.group(1));
                if (date.isPresent()) return date;
            }
        }

        Matcher iso = ISO_DATE_PATTERN.matcher(text);
        if (iso.find()) {
            return date(iso.group(1), Integer.parseInt(iso.group(2)), iso.group(3));
        }
        return Optional.empty();
    }

    private static void collectInline(Pattern pattern, AmendmentReference.Kind kind, String content,
                                      List<AmendmentReference> into) {
        Matcher m = pattern.matcher(content);
        while (m.find()) {
            into.add(new AmendmentReference(m.group(1), kind, AmendmentReference.Position.INLINE, m.group()));
        }
    }

    private static Optional<LocalDate> date(String year, int month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), month, Integer.parseInt(day)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
