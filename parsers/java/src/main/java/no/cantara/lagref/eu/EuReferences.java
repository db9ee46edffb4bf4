package no.cantara.lagref.eu;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Display and lookup-key helpers for {@link EuReference}.
 */
public final class EuReferences {

    private static final Pattern LOOKUP_KEY = Pattern.compile("^(directive|regulation):(\\d{4})/(\\d+)$");

    public enum Style { SHORT, FULL }

    /** Parsed form of a lookup key such as {@code directive:2016/680}. */
    public record LookupKey(EuActType type, int year, int number) {}

    private EuReferences() {}

    public static Optional<LookupKey> parseLookupKey(String key) {
        if (key == null) return Optional.empty();
        Matcher m = LOOKUP_KEY.matcher(key);
        if (!m.matches()) return Optional.empty();
        try {
            return Optional.of(new LookupKey(
                    EuActType.fromId(m.group(1)).orElseThrow(),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Renders a reference in Swedish, e.g. {@code "förordning (EU) 2016/679"} (short) or
     * {@code "Europaparlamentets och rådets förordning (EU) 2016/679, artikel 6.1.c"} (full).
     */
    public static String format(EuReference ref, Style style) {
        String community = ref.community().map(Community::label).orElse(Community.EU.label());
        String base = ref.type().swedishLabel() + " (" + community + ") " + ref.id();
        if (style == Style.SHORT) {
            return base;
        }
        StringBuilder sb = new StringBuilder();
        ref.issuingBody().ifPresent(body -> sb.append(body).append(' '));
        sb.append(base);
        ref.article().ifPresent(a -> sb.append(", artikel ").append(a));
        return sb.toString();
    }
}
